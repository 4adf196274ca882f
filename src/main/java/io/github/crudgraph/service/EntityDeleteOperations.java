package io.github.crudgraph.service;

import io.github.crudgraph.core.context.AuthContext;
import io.github.crudgraph.core.enums.EntityStatus;
import io.github.crudgraph.core.enums.FilterOperator;
import io.github.crudgraph.core.model.EntityDescriptor;
import io.github.crudgraph.core.query.ColumnRef;
import io.github.crudgraph.core.query.Comparison;
import io.github.crudgraph.service.storage.StorageClient;
import lombok.extern.slf4j.Slf4j;

import java.util.Map;

/**
 * Soft or hard deletion, depending on whether the entity carries a status attribute.
 */
@Slf4j
public class EntityDeleteOperations {

    private final EntityServiceContext context;
    private final EntityDescriptor entity;
    private final StorageClient storage;
    private final EntityReadOperations readOperations;
    private final EntityWriteOperations writeOperations;

    public EntityDeleteOperations(EntityServiceContext context, EntityReadOperations readOperations,
                                  EntityWriteOperations writeOperations) {
        this.context = context;
        this.entity = context.getEntity();
        this.storage = context.getStorage();
        this.readOperations = readOperations;
        this.writeOperations = writeOperations;
    }

    /**
     * Deletes a visible item and returns it as it was before the mutation.
     */
    public Map<String, Object> deleteItem(AuthContext auth, Object id) {
        Map<String, Object> item = readOperations.getItem(auth, id);
        EntityStatus softDeleteStatus = context.getConfig().getSoftDeleteStatus();
        String statusAttribute = context.statusAttribute();

        storage.inTransaction(tx -> {
            if (entity.hasAttribute(statusAttribute)) {
                storage.update(tx, entity, id, Map.of(statusAttribute, softDeleteStatus.getId()));
                log.debug("{} {} marked {}", entity.getName(), id, softDeleteStatus);
            } else {
                storage.destroyWhere(tx, entity,
                        Comparison.of(ColumnRef.root(entity.primaryKeyColumn()), FilterOperator.EQ, id));
                log.debug("{} {} destroyed", entity.getName(), id);
            }

            Object infoId = item.get(context.auditForeignKey());
            if (softDeleteStatus == EntityStatus.DELETED && infoId != null && writeOperations.isAudited(entity)) {
                writeOperations.upsertInfo(tx, auth, EntityWriteOperations.ACTION_DELETED, infoId);
            }
            return null;
        });

        return item;
    }
}
