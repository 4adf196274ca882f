package io.github.crudgraph.service;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.github.crudgraph.core.context.AuthContext;

import java.util.Map;

/**
 * Maps stored items onto a response DTO with Jackson. Unknown properties are ignored so DTOs
 * may expose a subset of the entity.
 */
public class JacksonEntitySerializer<R> implements EntitySerializer<R> {

    private static final TypeReference<Map<String, Object>> MAP_TYPE = new TypeReference<>() {
    };

    private final ObjectMapper objectMapper;
    private final Class<R> responseType;

    public JacksonEntitySerializer(ObjectMapper objectMapper, Class<R> responseType) {
        this.objectMapper = objectMapper.copy()
                .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
        this.responseType = responseType;
    }

    @Override
    public R serialize(Map<String, Object> item, AuthContext auth) {
        return objectMapper.convertValue(item, responseType);
    }

    @Override
    public Map<String, Object> deserialize(Map<String, Object> input, AuthContext auth) {
        return objectMapper.convertValue(input, MAP_TYPE);
    }
}
