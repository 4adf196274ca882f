package io.github.crudgraph.service;

import io.github.crudgraph.core.config.CrudGraphProperties;
import io.github.crudgraph.core.model.EntityGraph;
import io.github.crudgraph.service.storage.StorageClient;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import java.util.Map;
import java.util.function.Function;

/**
 * Builds entity data providers against the application's entity graph and storage.
 */
@Slf4j
@Getter
public class CrudGraphServiceFactory {

    private final EntityGraph graph;
    private final StorageClient storage;
    private final CrudGraphProperties properties;

    public CrudGraphServiceFactory(EntityGraph graph, StorageClient storage, CrudGraphProperties properties) {
        this.graph = graph;
        this.storage = storage;
        this.properties = properties;
    }

    public EntityServiceContext context(EntityServiceConfig config) {
        return new EntityServiceContext(graph, config, storage, properties);
    }

    public EntityDataProvider<Map<String, Object>> create(EntityServiceConfig config) {
        return create(config, new MapEntitySerializer());
    }

    public <R> EntityDataProvider<R> create(EntityServiceConfig config, EntitySerializer<R> serializer) {
        return create(config, serializer, EntityValidator::new);
    }

    public <R> EntityDataProvider<R> create(EntityServiceConfig config, EntitySerializer<R> serializer,
                                            Function<EntityServiceContext, ? extends EntityValidator> validator) {
        EntityServiceContext context = context(config);
        EntityDataProvider<R> provider = new EntityDataProvider<>(
                new EntityRepository(context), serializer, validator.apply(context));
        log.info("✓ Data provider created for entity: {}", config.getEntity());
        return provider;
    }
}
