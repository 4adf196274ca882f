package io.github.crudgraph.service;

import io.github.crudgraph.core.context.AuthContext;

import java.util.Map;

/**
 * Converts stored items to response objects and client input to storage attributes.
 *
 * @param <R> response type
 */
public interface EntitySerializer<R> {

    R serialize(Map<String, Object> item, AuthContext auth);

    default Map<String, Object> deserialize(Map<String, Object> input, AuthContext auth) {
        return input;
    }
}
