package io.github.crudgraph.core.context;

import io.github.crudgraph.core.util.MapPaths;
import lombok.Getter;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Per-request metadata decoded from the caller's token: scoping ids, actor id and similar values.
 * Values are scalars, arrays/collections or nested maps.
 */
@Getter
public class AuthContext {

    public static final String REQUEST_ATTRIBUTE = AuthContext.class.getName();

    private static final AuthContext ANONYMOUS = new AuthContext(Collections.emptyMap());

    private final Map<String, Object> metadata;

    public AuthContext(Map<String, ?> metadata) {
        this.metadata = Collections.unmodifiableMap(new LinkedHashMap<>(metadata));
    }

    public static AuthContext anonymous() {
        return ANONYMOUS;
    }

    public static AuthContext of(Map<String, ?> metadata) {
        return new AuthContext(metadata);
    }

    /**
     * Whether {@code key} carries a value. For arrays only the first element is checked.
     */
    public boolean hasValue(String key) {
        Object value = metadata.get(key);
        if (value instanceof Collection) {
            Collection<?> values = (Collection<?>) value;
            return !values.isEmpty() && values.iterator().next() != null;
        }
        if (value instanceof Object[]) {
            Object[] values = (Object[]) value;
            return values.length > 0 && values[0] != null;
        }
        return value != null;
    }

    /**
     * Value of {@code key} as a list: arrays are copied, scalars (including a missing value) wrapped.
     */
    public List<Object> getValues(String key) {
        Object value = metadata.get(key);
        if (value instanceof Collection) {
            return new ArrayList<>((Collection<?>) value);
        }
        if (value instanceof Object[]) {
            return new ArrayList<>(Arrays.asList((Object[]) value));
        }
        List<Object> single = new ArrayList<>(1);
        single.add(value);
        return single;
    }

    /**
     * Value at a dotted path, e.g. {@code internal.id}.
     */
    public Object get(String path) {
        return MapPaths.get(metadata, path);
    }
}
