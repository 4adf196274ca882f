package io.github.crudgraph.service;

import io.github.crudgraph.core.context.AuthContext;
import io.github.crudgraph.core.enums.AssociationType;
import io.github.crudgraph.core.enums.FilterOperator;
import io.github.crudgraph.core.exception.ApplicationException;
import io.github.crudgraph.core.exception.ClientError;
import io.github.crudgraph.core.model.Association;
import io.github.crudgraph.core.model.EntityDescriptor;
import io.github.crudgraph.core.query.ColumnRef;
import io.github.crudgraph.core.query.Comparison;
import io.github.crudgraph.core.query.Condition;
import io.github.crudgraph.core.query.Junction;
import io.github.crudgraph.core.util.MapPaths;
import io.github.crudgraph.service.storage.StorageClient;

import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Input checks run before writes. Subclasses add domain rules by overriding {@link #validateInput}.
 */
public class EntityValidator {

    private final EntityServiceContext context;
    private final EntityDescriptor entity;
    private final StorageClient storage;

    public EntityValidator(EntityServiceContext context) {
        this.context = context;
        this.entity = context.getEntity();
        this.storage = context.getStorage();
    }

    /**
     * Rejects changes to immutable paths. A path absent from the input, or not yet set on the
     * existing record, is never a violation.
     */
    public void validateImmutableFields(Map<String, Object> input, Map<String, Object> existing) {
        for (String path : context.getConfig().getImmutablePaths()) {
            Object current = MapPaths.get(existing, path);
            if (current == null || !MapPaths.has(input, path)) {
                continue;
            }
            if (!MapPaths.deepEquals(current, MapPaths.get(input, path))) {
                throw new ApplicationException(ClientError.VALIDATION_IMMUTABLE_FIELD, Map.of("field", path));
            }
        }
    }

    /**
     * Checks that associations referenced by primary key in the input exist (and are visible under
     * the target's default scope). Entries without a primary key are new and skipped.
     */
    public void validateRelations(Map<String, Object> input) {
        Map<String, String> mapping = context.getConfig().getAssociationModelMapping();

        for (Map.Entry<String, Object> entry : input.entrySet()) {
            String field = entry.getKey();
            Object value = entry.getValue();
            String alias = mapping.getOrDefault(field, field);
            if (value == null || !entity.hasAssociation(alias)) {
                continue;
            }

            Association association = entity.association(alias).orElseThrow();
            EntityDescriptor target = context.getGraph().target(association);
            if (!shouldValidate(value, target.getPrimaryKey())) {
                continue;
            }

            Set<Object> ids = primaryKeys(value, target.getPrimaryKey());
            boolean toOne = association.getType() == AssociationType.BELONGS_TO
                    || association.getType() == AssociationType.HAS_ONE;
            long expected = toOne ? 1 : ids.size();

            Condition lookup = Condition.builder()
                    .where(Junction.and(
                            Comparison.of(ColumnRef.root(target.primaryKeyColumn()), FilterOperator.IN, List.copyOf(ids)),
                            target.getDefaultScope()))
                    .build();
            if (storage.findAll(target, lookup).size() != expected) {
                throw new ApplicationException(ClientError.VALIDATION_INVALID_RELATION, Map.of("field", field));
            }
        }
    }

    /**
     * Domain specific validation hook, a no-op by default.
     *
     * @param existing the current item for updates, {@code null} for creates
     */
    public void validateInput(AuthContext auth, Map<String, Object> input, Map<String, Object> existing) {
    }

    private boolean shouldValidate(Object value, String primaryKey) {
        if (value instanceof Collection) {
            Collection<?> entries = (Collection<?>) value;
            return entries.stream().allMatch(entry -> hasPrimaryKey(entry, primaryKey));
        }
        return hasPrimaryKey(value, primaryKey);
    }

    private static boolean hasPrimaryKey(Object value, String primaryKey) {
        return value instanceof Map && ((Map<?, ?>) value).get(primaryKey) != null;
    }

    private static Set<Object> primaryKeys(Object value, String primaryKey) {
        if (value instanceof Collection) {
            return ((Collection<?>) value).stream()
                    .map(entry -> ((Map<?, ?>) entry).get(primaryKey))
                    .collect(Collectors.toCollection(LinkedHashSet::new));
        }
        Set<Object> single = new LinkedHashSet<>();
        single.add(((Map<?, ?>) value).get(primaryKey));
        return single;
    }
}
