package io.github.crudgraph.service;

import io.github.crudgraph.core.context.AuthContext;
import io.github.crudgraph.core.context.ContextRequest;
import io.github.crudgraph.core.model.EntityDescriptor;
import io.github.crudgraph.core.query.Condition;
import io.github.crudgraph.service.storage.StorageClient;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Query and persistence engine of one entity, composed of read, write and delete operations.
 * Every write runs in a single storage transaction.
 */
@Slf4j
public class EntityRepository {

    @Getter
    private final EntityServiceContext context;
    private final StorageClient storage;

    private final EntityReadOperations readOperations;
    private final EntityWriteOperations writeOperations;
    private final EntityDeleteOperations deleteOperations;

    public EntityRepository(EntityServiceContext context) {
        this.context = context;
        this.storage = context.getStorage();
        this.readOperations = new EntityReadOperations(context);
        this.writeOperations = new EntityWriteOperations(context);
        this.deleteOperations = new EntityDeleteOperations(context, readOperations, writeOperations);
        log.debug("Repository ready for entity {}", context.getEntity().getName());
    }

    public EntityDescriptor getEntity() {
        return context.getEntity();
    }

    // ==================== READ ====================

    public Map<String, Object> getItem(AuthContext auth, Object id) {
        return readOperations.getItem(auth, id);
    }

    public ListResult<Map<String, Object>> getList(AuthContext auth, ContextRequest request) {
        return readOperations.getList(auth, request);
    }

    public Condition generateCondition(AuthContext auth, ContextRequest request) {
        return readOperations.generateCondition(auth, request);
    }

    // ==================== WRITE ====================

    public Map<String, Object> createItem(AuthContext auth, Map<String, Object> attributes) {
        Map<String, Object> created = storage.inTransaction(tx ->
                writeOperations.upsertEntity(tx, auth, getEntity(), attributes));
        return readOperations.getItem(auth, created.get(getEntity().getPrimaryKey()));
    }

    public Map<String, Object> updateItem(AuthContext auth, Object id, Map<String, Object> attributes) {
        Map<String, Object> input = new LinkedHashMap<>(attributes);
        input.put(getEntity().getPrimaryKey(), id);
        storage.inTransaction(tx -> writeOperations.upsertEntity(tx, auth, getEntity(), input));
        return readOperations.getItem(auth, id);
    }

    public Map<String, Object> deleteItem(AuthContext auth, Object id) {
        return deleteOperations.deleteItem(auth, id);
    }
}
