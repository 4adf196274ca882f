package io.github.crudgraph.core.exception;

import lombok.Getter;
import org.springframework.http.HttpStatus;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Classified failure surfaced to API callers with a stable code and status.
 *
 * @see ClientError
 * @see ServerError
 */
@Getter
public class ApplicationException extends RuntimeException {

    private final transient ErrorDescriptor descriptor;
    private final Map<String, Object> params;

    public ApplicationException(ErrorDescriptor descriptor) {
        this(descriptor, Collections.emptyMap(), null);
    }

    public ApplicationException(ErrorDescriptor descriptor, Map<String, ?> params) {
        this(descriptor, params, null);
    }

    public ApplicationException(ErrorDescriptor descriptor, Map<String, ?> params, Throwable cause) {
        super(interpolate(descriptor.getMessageTemplate(), params), cause);
        this.descriptor = descriptor;
        this.params = Collections.unmodifiableMap(new LinkedHashMap<>(params));
    }

    /**
     * Wraps {@code cause} into {@code descriptor} unless it is already an application error,
     * in which case it is returned untouched.
     */
    public static ApplicationException wrap(ErrorDescriptor descriptor, Throwable cause) {
        if (cause instanceof ApplicationException) {
            return (ApplicationException) cause;
        }
        return new ApplicationException(descriptor, Collections.emptyMap(), cause);
    }

    public String getCode() {
        return descriptor.getCode();
    }

    public HttpStatus getStatus() {
        return descriptor.getStatus();
    }

    public boolean isServerError() {
        return descriptor.isServerError();
    }

    static String interpolate(String template, Map<String, ?> params) {
        String message = template;
        for (Map.Entry<String, ?> entry : params.entrySet()) {
            message = message.replace("{" + entry.getKey() + "}", String.valueOf(entry.getValue()));
        }
        return message;
    }
}
