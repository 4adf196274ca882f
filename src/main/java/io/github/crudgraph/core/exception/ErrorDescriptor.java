package io.github.crudgraph.core.exception;

import org.springframework.http.HttpStatus;

/**
 * Static description of an application error: stable code, HTTP status, short title
 * and a message template with {@code {param}} placeholders.
 */
public interface ErrorDescriptor {

    String getCode();

    HttpStatus getStatus();

    String getTitle();

    String getMessageTemplate();

    default boolean isServerError() {
        return getStatus().is5xxServerError();
    }
}
