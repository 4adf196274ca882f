package io.github.crudgraph.service.capability;

import io.github.crudgraph.core.context.AuthContext;

import java.util.Map;

public interface CreateCapable<R> {

    R createItem(AuthContext auth, Map<String, Object> input);
}
