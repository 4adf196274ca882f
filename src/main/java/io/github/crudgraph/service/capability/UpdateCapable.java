package io.github.crudgraph.service.capability;

import io.github.crudgraph.core.context.AuthContext;

import java.util.Map;

public interface UpdateCapable<R> {

    /**
     * @param isPartial merge {@code input} into the existing item instead of replacing its fields
     */
    R updateItem(AuthContext auth, Object id, Map<String, Object> input, boolean isPartial);
}
