package io.github.crudgraph.service;

import io.github.crudgraph.core.context.AuthContext;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Identity serializer: items are returned as the maps read from storage.
 */
public class MapEntitySerializer implements EntitySerializer<Map<String, Object>> {

    @Override
    public Map<String, Object> serialize(Map<String, Object> item, AuthContext auth) {
        return new LinkedHashMap<>(item);
    }
}
