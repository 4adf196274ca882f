package io.github.crudgraph.service;

import io.github.crudgraph.core.context.AuthContext;
import io.github.crudgraph.core.context.ContextRequest;
import io.github.crudgraph.core.exception.ApplicationException;
import io.github.crudgraph.core.exception.ClientError;
import io.github.crudgraph.core.model.EntityDescriptor;
import io.github.crudgraph.core.util.MapPaths;
import io.github.crudgraph.generator.PermissionsManager;
import io.github.crudgraph.service.capability.CreateCapable;
import io.github.crudgraph.service.capability.DeleteCapable;
import io.github.crudgraph.service.capability.GetCapable;
import io.github.crudgraph.service.capability.ListCapable;
import io.github.crudgraph.service.capability.UpdateCapable;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Full CRUD data provider of one entity. Orchestrates permission checks, validation, lifecycle
 * hooks, serialization and the repository.
 *
 * <p>Permission failures propagate unchanged. Any other failure is reported as the operation's
 * {@code UNABLE_TO_*} client error unless it already is an {@link ApplicationException}.</p>
 *
 * <p>Subclasses override the hooks of {@link DataProviderHooks}; restricting the surface is done
 * by exposing a provider that implements fewer capability interfaces.</p>
 */
@Slf4j
public class EntityDataProvider<R> extends DataProviderHooks
        implements ListCapable<R>, GetCapable<R>, CreateCapable<R>, UpdateCapable<R>, DeleteCapable<R> {

    @Getter
    private final EntityRepository repository;
    @Getter
    private final EntitySerializer<R> serializer;
    @Getter
    private final EntityValidator validator;
    private final EntityServiceContext context;

    public EntityDataProvider(EntityRepository repository, EntitySerializer<R> serializer, EntityValidator validator) {
        this.repository = repository;
        this.serializer = serializer;
        this.validator = validator;
        this.context = repository.getContext();
    }

    public String getEntityName() {
        return context.getEntity().getName();
    }

    // ==================== READ ====================

    @Override
    public ListResult<R> getList(AuthContext auth, ContextRequest request) {
        permissions().validateReadPermissions(auth, null);
        try {
            return repository.getList(auth, request).map(item -> serializer.serialize(item, auth));
        } catch (Exception e) {
            throw fail(ClientError.UNABLE_TO_LIST, e);
        }
    }

    @Override
    public R getItem(AuthContext auth, Object id) {
        permissions().validateReadPermissions(auth, id);
        try {
            return serializer.serialize(repository.getItem(auth, id), auth);
        } catch (Exception e) {
            throw fail(ClientError.UNABLE_TO_GET, e);
        }
    }

    // ==================== WRITE ====================

    @Override
    public R createItem(AuthContext auth, Map<String, Object> input) {
        permissions().validateCreatePermissions(auth, input);
        try {
            validator.validateRelations(input);
            validator.validateInput(auth, input, null);

            Map<String, Object> prepared = beforeCreate(auth, input);
            Map<String, Object> created = repository.createItem(auth, serializer.deserialize(prepared, auth));
            return serializer.serialize(afterCreate(auth, created, input), auth);
        } catch (Exception e) {
            throw fail(ClientError.UNABLE_TO_CREATE, e);
        }
    }

    @Override
    public R updateItem(AuthContext auth, Object id, Map<String, Object> input, boolean isPartial) {
        permissions().validateUpdatePermissions(auth, id);
        try {
            Map<String, Object> existing = repository.getItem(auth, id);
            validator.validateImmutableFields(input, existing);
            validator.validateRelations(input);

            Map<String, Object> complete = completeInput(id, input, existing, isPartial);
            validator.validateInput(auth, complete, existing);

            Map<String, Object> prepared = beforeUpdate(auth, complete, existing);
            Map<String, Object> updated = repository.updateItem(auth, id, serializer.deserialize(prepared, auth));
            return serializer.serialize(afterUpdate(auth, updated, existing), auth);
        } catch (Exception e) {
            throw fail(ClientError.UNABLE_TO_UPDATE, e);
        }
    }

    @Override
    public R deleteItem(AuthContext auth, Object id) {
        permissions().validateDeletePermissions(auth, id);
        try {
            return serializer.serialize(repository.deleteItem(auth, id), auth);
        } catch (Exception e) {
            throw fail(ClientError.UNABLE_TO_DELETE, e);
        }
    }

    private Map<String, Object> completeInput(Object id, Map<String, Object> input, Map<String, Object> existing,
                                              boolean isPartial) {
        Map<String, Object> complete = isPartial
                ? MapPaths.merge(patchBase(input, existing), input)
                : new LinkedHashMap<>(input);
        complete.put(context.getEntity().getPrimaryKey(), id);
        return complete;
    }

    /**
     * Stored attributes plus the associations the patch touches. Untouched associations are left out
     * so a patch never rewrites related rows it does not mention.
     */
    private Map<String, Object> patchBase(Map<String, Object> input, Map<String, Object> existing) {
        EntityDescriptor entity = context.getEntity();
        Map<String, Object> base = new LinkedHashMap<>();
        existing.forEach((key, value) -> {
            boolean attribute = entity.hasAttribute(key) && !key.equals(entity.getUpdatedAt());
            boolean touched = entity.hasAssociation(key) && input.containsKey(key);
            if (attribute || touched) {
                base.put(key, value);
            }
        });
        return base;
    }

    protected PermissionsManager permissions() {
        return context.newPermissionsManager();
    }

    private ApplicationException fail(ClientError error, Exception cause) {
        ApplicationException failure = ApplicationException.wrap(error, cause);
        if (failure != cause) {
            log.error("{} failed for {}: {}", error.getCode(), getEntityName(), cause.getMessage(), cause);
        }
        return failure;
    }
}
