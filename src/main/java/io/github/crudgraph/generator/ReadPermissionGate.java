package io.github.crudgraph.generator;

import io.github.crudgraph.core.context.AuthContext;

/**
 * Extra check run before list and get operations, for rules with no column to restrict on.
 * {@code id} is {@code null} for list operations.
 */
@FunctionalInterface
public interface ReadPermissionGate {

    ReadPermissionGate ALLOW_ALL = (auth, id) -> { };

    void validate(AuthContext auth, Object id);
}
