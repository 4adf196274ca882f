package io.github.crudgraph.service.capability;

import io.github.crudgraph.core.context.AuthContext;
import io.github.crudgraph.core.context.ContextRequest;
import io.github.crudgraph.service.ListResult;

public interface ListCapable<R> {

    ListResult<R> getList(AuthContext auth, ContextRequest request);
}
