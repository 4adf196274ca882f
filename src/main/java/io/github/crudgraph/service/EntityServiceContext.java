package io.github.crudgraph.service;

import io.github.crudgraph.core.config.CrudGraphProperties;
import io.github.crudgraph.core.model.EntityDescriptor;
import io.github.crudgraph.core.model.EntityGraph;
import io.github.crudgraph.generator.FiltersGenerator;
import io.github.crudgraph.generator.OrderGenerator;
import io.github.crudgraph.generator.PermissionsManager;
import io.github.crudgraph.generator.TimestampsManager;
import io.github.crudgraph.service.storage.StorageClient;
import lombok.Getter;

import java.util.List;

/**
 * Shared, immutable wiring of one entity service. Condition generators are created per call
 * so no request state is ever shared between concurrent requests.
 */
@Getter
public class EntityServiceContext {

    private final EntityGraph graph;
    private final EntityDescriptor entity;
    private final EntityServiceConfig config;
    private final StorageClient storage;
    private final CrudGraphProperties properties;

    public EntityServiceContext(EntityGraph graph, EntityServiceConfig config, StorageClient storage,
                                CrudGraphProperties properties) {
        this.graph = graph;
        this.entity = graph.entity(config.getEntity());
        this.config = config;
        this.storage = storage;
        this.properties = properties;
        // fail at startup on a mis-declared hierarchy
        newTimestampsManager();
    }

    public PermissionsManager newPermissionsManager() {
        return new PermissionsManager(graph, entity, config.getPermissionPathMap(),
                config.getPermissionDefinitions(), storage, config.getReadPermissionGate());
    }

    public FiltersGenerator newFiltersGenerator() {
        return new FiltersGenerator(graph, entity, config.getFilterPathMap(), searchFields(), newTimestampsManager());
    }

    public OrderGenerator newOrderGenerator() {
        return new OrderGenerator(graph, entity, config.getOrderPathMap(), newTimestampsManager());
    }

    public TimestampsManager newTimestampsManager() {
        return new TimestampsManager(graph, entity, config.getTimestampHierarchy());
    }

    public String statusAttribute() {
        return properties.getStatus().getAttribute();
    }

    public String auditForeignKey() {
        return properties.getAudit().getForeignKey();
    }

    private List<String> searchFields() {
        return config.getSearchFields() != null
                ? config.getSearchFields()
                : properties.getSearch().getDefaultFields();
    }
}
