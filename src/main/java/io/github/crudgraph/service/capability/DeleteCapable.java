package io.github.crudgraph.service.capability;

import io.github.crudgraph.core.context.AuthContext;

public interface DeleteCapable<R> {

    R deleteItem(AuthContext auth, Object id);
}
