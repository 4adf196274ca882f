package io.github.crudgraph.service;

import io.github.crudgraph.core.config.CrudGraphProperties;
import io.github.crudgraph.core.context.AuthContext;
import io.github.crudgraph.core.enums.AssociationType;
import io.github.crudgraph.core.enums.EntityStatus;
import io.github.crudgraph.core.enums.FilterOperator;
import io.github.crudgraph.core.exception.ApplicationException;
import io.github.crudgraph.core.exception.ServerError;
import io.github.crudgraph.core.model.Association;
import io.github.crudgraph.core.model.AttributeDescriptor;
import io.github.crudgraph.core.model.EntityDescriptor;
import io.github.crudgraph.core.model.EntityGraph;
import io.github.crudgraph.core.query.ColumnRef;
import io.github.crudgraph.core.query.Comparison;
import io.github.crudgraph.core.query.Junction;
import io.github.crudgraph.core.query.Predicate;
import io.github.crudgraph.service.storage.StorageClient;
import io.github.crudgraph.service.storage.TransactionHandle;
import lombok.extern.slf4j.Slf4j;

import java.time.LocalDateTime;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * Recursive graph upsert of nested input payloads and maintenance of audit ("info") records.
 * Every method runs inside the caller's transaction.
 */
@Slf4j
public class EntityWriteOperations {

    public static final String ACTION_CREATED = "created";
    public static final String ACTION_MODIFIED = "modified";
    public static final String ACTION_DELETED = "deleted";

    private static final String THROUGH_KEY = "through";

    /**
     * How existing linkage is removed before a collection is replaced.
     */
    public enum RemovalPolicy {
        NULLIFY,
        SOFT_DELETE,
        DESTROY
    }

    private final EntityServiceContext context;
    private final EntityGraph graph;
    private final StorageClient storage;
    private final CrudGraphProperties properties;

    public EntityWriteOperations(EntityServiceContext context) {
        this.context = context;
        this.graph = context.getGraph();
        this.storage = context.getStorage();
        this.properties = context.getProperties();
    }

    // ==================== UPSERT ====================

    public Map<String, Object> upsertEntity(TransactionHandle tx, AuthContext auth, EntityDescriptor entity,
                                            Map<String, Object> input) {
        return upsertEntity(tx, auth, entity, input, 0);
    }

    @SuppressWarnings("unchecked")
    private Map<String, Object> upsertEntity(TransactionHandle tx, AuthContext auth, EntityDescriptor entity,
                                             Map<String, Object> input, int depth) {
        int maxDepth = properties.getUpsert().getMaxDepth();
        if (depth > maxDepth) {
            throw new ApplicationException(ServerError.UPSERT_DEPTH_EXCEEDED,
                    Map.of("entity", entity.getName(), "maxDepth", maxDepth));
        }

        Map<String, Object> attributes = new LinkedHashMap<>();
        Map<Association, Object> onSource = new LinkedHashMap<>();
        Map<Association, Object> onTarget = new LinkedHashMap<>();

        input.forEach((key, value) -> {
            if (entity.hasAttribute(key)) {
                attributes.put(key, value);
            } else if (value != null && entity.hasAssociation(key)) {
                Association association = entity.association(key).orElseThrow();
                (association.isForeignKeyOnSource() ? onSource : onTarget).put(association, value);
            }
        });

        // Parents referenced by foreign key must exist before this row
        for (Map.Entry<Association, Object> entry : onSource.entrySet()) {
            Association association = entry.getKey();
            EntityDescriptor target = graph.target(association);
            Map<String, Object> parent = upsertEntity(tx, auth, target, asMap(entry.getValue(), association), depth + 1);
            attributes.put(association.getForeignKey(), parent.get(target.getPrimaryKey()));
        }

        Object id = attributes.get(entity.getPrimaryKey());
        Map<String, Object> saved = id == null
                ? create(tx, auth, entity, attributes)
                : update(tx, auth, entity, id, attributes);
        Object savedId = saved.get(entity.getPrimaryKey());

        for (Map.Entry<Association, Object> entry : onTarget.entrySet()) {
            Association association = entry.getKey();
            Object value = entry.getValue();
            if (value instanceof List) {
                replaceCollection(tx, auth, association, savedId, (List<Object>) value, depth);
            } else if (association.getType() == AssociationType.BELONGS_TO_MANY) {
                replaceCollection(tx, auth, association, savedId, List.of(value), depth);
            } else {
                Map<String, Object> child = new LinkedHashMap<>(asMap(value, association));
                child.put(association.getForeignKey(), savedId);
                upsertEntity(tx, auth, graph.target(association), child, depth + 1);
            }
        }

        return saved;
    }

    private Map<String, Object> create(TransactionHandle tx, AuthContext auth, EntityDescriptor entity,
                                       Map<String, Object> attributes) {
        if (isAudited(entity)) {
            Map<String, Object> info = upsertInfo(tx, auth, ACTION_CREATED, null);
            attributes.put(context.auditForeignKey(), info.get(auditEntity().getPrimaryKey()));
        }
        return storage.create(tx, entity, attributes);
    }

    private Map<String, Object> update(TransactionHandle tx, AuthContext auth, EntityDescriptor entity, Object id,
                                       Map<String, Object> attributes) {
        Map<String, Object> existing = storage.findByPrimaryKey(tx, entity, id).orElseThrow(() ->
                new ApplicationException(ServerError.ENTITY_TO_UPDATE_NOT_FOUND, Map.of("id", id)));

        Map<String, Object> changes = new LinkedHashMap<>(attributes);
        changes.remove(entity.getPrimaryKey());

        if (isAudited(entity)) {
            String auditKey = context.auditForeignKey();
            Object infoId = existing.get(auditKey);
            Map<String, Object> info = upsertInfo(tx, auth, ACTION_MODIFIED, infoId);
            if (infoId == null) {
                changes.put(auditKey, info.get(auditEntity().getPrimaryKey()));
            }
        }
        return storage.update(tx, entity, id, changes);
    }

    // ==================== COLLECTIONS ====================

    @SuppressWarnings("unchecked")
    private void replaceCollection(TransactionHandle tx, AuthContext auth, Association association, Object parentId,
                                   List<Object> entries, int depth) {
        EntityDescriptor target = graph.target(association);
        List<Map<String, Object>> items = entries.stream()
                .map(entry -> asMap(entry, association))
                .collect(Collectors.toList());

        if (association.getType() == AssociationType.BELONGS_TO_MANY) {
            EntityDescriptor through = graph.entity(association.getThrough());
            removeRelations(tx, association, through, parentId, List.of());

            for (Map<String, Object> item : items) {
                Object targetId = item.get(target.getPrimaryKey());
                if (targetId == null) {
                    targetId = upsertEntity(tx, auth, target, item, depth + 1).get(target.getPrimaryKey());
                }
                Map<String, Object> link = new LinkedHashMap<>();
                link.put(association.getForeignKey(), parentId);
                link.put(association.getOtherKey(), targetId);
                Object extra = item.get(THROUGH_KEY);
                if (extra instanceof Map) {
                    ((Map<String, Object>) extra).forEach((key, value) -> {
                        if (through.hasAttribute(key)) {
                            link.put(key, value);
                        }
                    });
                }
                storage.create(tx, through, link);
            }
            return;
        }

        List<Object> keptIds = items.stream()
                .map(item -> item.get(target.getPrimaryKey()))
                .filter(Objects::nonNull)
                .collect(Collectors.toList());
        removeRelations(tx, association, target, parentId, keptIds);

        for (Map<String, Object> item : items) {
            Map<String, Object> child = new LinkedHashMap<>(item);
            child.put(association.getForeignKey(), parentId);
            upsertEntity(tx, auth, target, child, depth + 1);
        }
    }

    /**
     * Unlinks every row of {@code relation} pointing at {@code parentId}, except {@code keptIds}
     * which the replacing collection links again. Nullable keys are nulled, rows with a status are
     * marked deleted, anything else is destroyed.
     */
    public RemovalPolicy removeRelations(TransactionHandle tx, Association association, EntityDescriptor relation,
                                         Object parentId, List<Object> keptIds) {
        AttributeDescriptor foreignKey = relation.attribute(association.getForeignKey()).orElseThrow();
        Predicate linked = Comparison.of(ColumnRef.root(foreignKey.getColumn()), FilterOperator.EQ, parentId);
        Predicate where = keptIds.isEmpty()
                ? linked
                : Junction.and(linked, Comparison.of(ColumnRef.root(relation.primaryKeyColumn()),
                FilterOperator.NOT_IN, keptIds));

        RemovalPolicy policy = removalPolicy(relation, foreignKey);
        int affected;
        switch (policy) {
            case NULLIFY:
                affected = storage.updateWhere(tx, relation, where,
                        Collections.singletonMap(foreignKey.getName(), null));
                break;
            case SOFT_DELETE:
                affected = storage.updateWhere(tx, relation, where,
                        Map.of(context.statusAttribute(), EntityStatus.DELETED.getId()));
                break;
            default:
                affected = storage.destroyWhere(tx, relation, where);
        }
        log.debug("Removed {} {} row(s) linked to {} {} ({})", affected, relation.getName(),
                association.getSource(), parentId, policy);
        return policy;
    }

    public RemovalPolicy removalPolicy(EntityDescriptor relation, AttributeDescriptor foreignKey) {
        if (foreignKey.isNullable()) {
            return RemovalPolicy.NULLIFY;
        }
        if (relation.hasAttribute(context.statusAttribute())) {
            return RemovalPolicy.SOFT_DELETE;
        }
        return RemovalPolicy.DESTROY;
    }

    // ==================== AUDIT ====================

    /**
     * Stamps {@code <action>_at} and, when the caller has an actor id, {@code <action>_by_id} on an audit
     * record; creates the record when {@code infoId} is {@code null}.
     */
    public Map<String, Object> upsertInfo(TransactionHandle tx, AuthContext auth, String action, Object infoId) {
        EntityDescriptor info = auditEntity();
        Map<String, Object> attributes = new LinkedHashMap<>();
        putIfDeclared(info, attributes, action + "_at", LocalDateTime.now());

        Object actor = auth.get(properties.getAudit().getActorKey());
        if (actor != null) {
            putIfDeclared(info, attributes, action + "_by_id", actor);
        }

        if (infoId == null) {
            return storage.create(tx, info, attributes);
        }
        return storage.update(tx, info, infoId, attributes);
    }

    public boolean isAudited(EntityDescriptor entity) {
        return entity.hasAttribute(context.auditForeignKey())
                && !entity.getName().equals(properties.getAudit().getEntity())
                && graph.contains(properties.getAudit().getEntity());
    }

    private EntityDescriptor auditEntity() {
        return graph.entity(properties.getAudit().getEntity());
    }

    private static void putIfDeclared(EntityDescriptor entity, Map<String, Object> attributes,
                                      String attribute, Object value) {
        if (entity.hasAttribute(attribute)) {
            attributes.put(attribute, value);
        }
    }

    @SuppressWarnings("unchecked")
    private static Map<String, Object> asMap(Object value, Association association) {
        if (!(value instanceof Map)) {
            throw new IllegalArgumentException("Expected an object for association '" + association.getAs()
                    + "' of " + association.getSource() + " but got " + value);
        }
        return new LinkedHashMap<>((Map<String, Object>) value);
    }
}
