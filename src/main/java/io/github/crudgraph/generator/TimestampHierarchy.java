package io.github.crudgraph.generator;

import lombok.Value;

import java.util.List;

/**
 * Tree of entities whose modification times contribute to the root entity's effective {@code updated_at}.
 * Each child must be directly associated with its parent.
 */
@Value
public class TimestampHierarchy {

    String entity;
    List<TimestampHierarchy> include;

    public static TimestampHierarchy of(String entity, TimestampHierarchy... include) {
        return new TimestampHierarchy(entity, List.of(include));
    }
}
