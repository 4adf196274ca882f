package io.github.crudgraph.core.exception;

import lombok.Getter;

/**
 * Raised when a dotted path does not resolve against the entity graph.
 * Consumers translate it into their own {@link ApplicationException}.
 */
@Getter
public class InvalidPathException extends RuntimeException {

    private final String path;

    public InvalidPathException(String path, String reason) {
        super("Invalid path '" + path + "': " + reason);
        this.path = path;
    }
}
