package io.github.crudgraph.generator;

import io.github.crudgraph.core.context.AuthContext;
import io.github.crudgraph.core.enums.FilterOperator;
import io.github.crudgraph.core.exception.ApplicationException;
import io.github.crudgraph.core.exception.ClientError;
import io.github.crudgraph.core.exception.InvalidPathException;
import io.github.crudgraph.core.exception.ServerError;
import io.github.crudgraph.core.model.Association;
import io.github.crudgraph.core.model.EntityDescriptor;
import io.github.crudgraph.core.model.EntityGraph;
import io.github.crudgraph.core.query.ColumnRef;
import io.github.crudgraph.core.query.Comparison;
import io.github.crudgraph.core.query.Condition;
import io.github.crudgraph.core.query.Include;
import io.github.crudgraph.core.query.Junction;
import io.github.crudgraph.core.query.Predicate;
import io.github.crudgraph.core.util.MapPaths;
import io.github.crudgraph.service.storage.StorageClient;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Turns auth metadata into row restrictions for reads and into ownership lookups for writes.
 */
@Slf4j
public class PermissionsManager {

    public static final List<PermissionDefinition> DEFAULT_DEFINITIONS =
            List.of(PermissionDefinition.of("market_place"));

    private final EntityGraph graph;
    private final EntityDescriptor entity;
    private final Map<String, PathOverride> pathMap;
    private final AssociationPathResolver resolver;
    private final List<PermissionDefinition> definitions;
    private final StorageClient storage;
    private final ReadPermissionGate readGate;

    public PermissionsManager(EntityGraph graph, EntityDescriptor entity, Map<String, PathOverride> pathMap,
                              List<PermissionDefinition> definitions, StorageClient storage,
                              ReadPermissionGate readGate) {
        this.graph = graph;
        this.entity = entity;
        this.pathMap = pathMap != null ? pathMap : Collections.emptyMap();
        this.resolver = new AssociationPathResolver(graph, entity, this.pathMap);
        this.definitions = definitions != null ? definitions : DEFAULT_DEFINITIONS;
        this.storage = storage;
        this.readGate = readGate != null ? readGate : ReadPermissionGate.ALLOW_ALL;
    }

    // ==================== READ ====================

    /**
     * One {@code path IN values} restriction per applicable definition, ANDed, with the joins they need.
     */
    public Condition generateCondition(AuthContext auth) {
        List<Predicate> restrictions = new ArrayList<>();
        List<Include> joins = new ArrayList<>();

        for (PermissionDefinition definition : applicable(auth)) {
            ResolvedPath path = resolve(definition.getKey());
            restrictions.add(Comparison.of(path.operand(), FilterOperator.IN, auth.getValues(definition.getKey())));
            joins.addAll(path.joins(true));
        }

        return Condition.builder()
                .where(Junction.and(restrictions))
                .includes(Condition.mergeIncludes(List.of(joins)))
                .build();
    }

    public void validateReadPermissions(AuthContext auth, Object id) {
        readGate.validate(auth, id);
    }

    // ==================== WRITE ====================

    /**
     * Checks that the entity referenced by the first hop of each definition, as given in {@code input},
     * is visible under the caller's metadata. Definitions whose reference cannot be read from the input
     * are skipped with a warning.
     */
    public void validateCreatePermissions(AuthContext auth, Map<String, Object> input) {
        for (PermissionDefinition definition : applicable(auth)) {
            String key = definition.getKey();
            ResolvedPath path = resolve(key);

            if (path.getAssociations().isEmpty()) {
                log.warn("⚠️  No direct association found for '{}' permission definition of {}, create check skipped",
                        key, entity.getName());
                continue;
            }

            Association direct = path.getAssociations().get(0);
            EntityDescriptor target = graph.target(direct);
            Object id = MapPaths.get(input, direct.getAs() + "." + target.getPrimaryKey());

            if (id == null) {
                log.warn("⚠️  No id found in input at '{}.{}' for '{}' permission definition of {}, create check skipped",
                        direct.getAs(), target.getPrimaryKey(), key, entity.getName());
                continue;
            }

            ResolvedPath remaining = path.tail();
            Condition lookup = ownershipLookup(target, id, remaining, auth.getValues(key));

            if (storage.findOne(target, lookup).isEmpty()) {
                throw new ApplicationException(ClientError.NO_ACCESS, Map.of("key", key, "value", id));
            }
        }
    }

    public void validateUpdatePermissions(AuthContext auth, Object id) {
        validateOwnership(auth, id);
    }

    public void validateDeletePermissions(AuthContext auth, Object id) {
        validateOwnership(auth, id);
    }

    /**
     * Path a definition key restricts: association keys without an override address the target's primary key.
     */
    public String serializeKey(String key) {
        if (pathMap.containsKey(key) || entity.hasAttribute(key)) {
            return key;
        }
        return entity.association(key)
                .map(association -> key + "." + graph.target(association).getPrimaryKey())
                .orElse(key);
    }

    private void validateOwnership(AuthContext auth, Object id) {
        for (PermissionDefinition definition : applicable(auth)) {
            ResolvedPath path = resolve(definition.getKey());
            Condition lookup = ownershipLookup(entity, id, path, auth.getValues(definition.getKey()));

            if (storage.findOne(entity, lookup).isEmpty()) {
                throw new ApplicationException(ClientError.NO_PERMISSIONS);
            }
        }
    }

    private Condition ownershipLookup(EntityDescriptor target, Object id, ResolvedPath path, List<Object> values) {
        Predicate byId = Comparison.of(ColumnRef.root(target.primaryKeyColumn()), FilterOperator.EQ, id);
        Predicate restriction = Comparison.of(path.operand(), FilterOperator.IN, values);
        return Condition.builder()
                .where(Junction.and(byId, restriction))
                .includes(path.joins(true))
                .build();
    }

    private List<PermissionDefinition> applicable(AuthContext auth) {
        return definitions.stream().filter(definition -> definition.appliesTo(auth)).collect(Collectors.toList());
    }

    private ResolvedPath resolve(String key) {
        try {
            return resolver.resolve(serializeKey(key));
        } catch (InvalidPathException e) {
            log.error("🔥 Permission definition '{}' of {} does not resolve: {}", key, entity.getName(), e.getMessage());
            throw new ApplicationException(ServerError.INVALID_PERMISSION_DEFINITION, Map.of("key", key), e);
        }
    }
}
