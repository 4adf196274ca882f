package io.github.crudgraph.service;

import io.github.crudgraph.core.enums.EntityStatus;
import io.github.crudgraph.core.query.Condition;
import io.github.crudgraph.generator.PathOverride;
import io.github.crudgraph.generator.PermissionDefinition;
import io.github.crudgraph.generator.PermissionsManager;
import io.github.crudgraph.generator.ReadPermissionGate;
import io.github.crudgraph.generator.TimestampHierarchy;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;
import java.util.Map;

/**
 * Everything that makes one entity's CRUD service differ from another's.
 */
@Value
@Builder(toBuilder = true)
public class EntityServiceConfig {

    /** Entity graph name of the served entity. */
    String entity;

    @Singular("filterPath")
    Map<String, PathOverride> filterPathMap;

    @Singular("orderPath")
    Map<String, PathOverride> orderPathMap;

    @Singular("permissionPath")
    Map<String, PathOverride> permissionPathMap;

    @Builder.Default
    List<PermissionDefinition> permissionDefinitions = PermissionsManager.DEFAULT_DEFINITIONS;

    /** Fields matched by {@code q}; {@code null} falls back to the configured defaults. */
    List<String> searchFields;

    TimestampHierarchy timestampHierarchy;

    /** Static joins, projections and predicate of every read. */
    @Builder.Default
    Condition fetchCondition = Condition.EMPTY;

    @Builder.Default
    EntityStatus softDeleteStatus = EntityStatus.ARCHIVED;

    @Singular
    List<String> immutablePaths;

    /** Input field to association alias, for relation validation of renamed payload keys. */
    @Singular("associationMapping")
    Map<String, String> associationModelMapping;

    OrderStrategy orderStrategy;

    ReadPermissionGate readPermissionGate;
}
