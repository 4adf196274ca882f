package io.github.crudgraph.service.capability;

import io.github.crudgraph.core.context.AuthContext;

public interface GetCapable<R> {

    R getItem(AuthContext auth, Object id);
}
