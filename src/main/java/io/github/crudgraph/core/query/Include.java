package io.github.crudgraph.core.query;

import lombok.Value;

import java.util.List;

/**
 * Join along an association alias chain.
 * <p>
 * {@code attributes == null} selects every attribute of the joined entity, an empty list joins
 * without selecting anything (filtering and permission joins).
 */
@Value
public class Include {

    List<String> path;
    boolean required;
    List<String> attributes;

    public static Include eager(String... path) {
        return new Include(List.of(path), false, null);
    }

    public static Include joinOnly(List<String> path, boolean required) {
        return new Include(List.copyOf(path), required, List.of());
    }

    public boolean isSelecting() {
        return attributes == null || !attributes.isEmpty();
    }
}
