package io.github.crudgraph.service.storage;

import io.github.crudgraph.core.model.EntityDescriptor;
import io.github.crudgraph.core.query.Condition;
import io.github.crudgraph.core.query.KeyPage;
import io.github.crudgraph.core.query.Predicate;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;

/**
 * Executes declarative conditions against relational storage.
 * <p>
 * Reads return rows as nested maps keyed by attribute name, eagerly included associations nested under
 * their alias (lists for to-many associations). Reads never apply an entity's default scope on their own;
 * callers put it into the condition. Writes take the handle of the surrounding transaction.
 */
public interface StorageClient {

    // ==================== READS ====================

    List<Map<String, Object>> findAll(EntityDescriptor entity, Condition condition);

    Optional<Map<String, Object>> findOne(EntityDescriptor entity, Condition condition);

    /**
     * Distinct primary keys of the matching rows in condition order, windowed by limit/offset,
     * together with the total number of distinct matches.
     */
    KeyPage findPrimaryKeys(EntityDescriptor entity, Condition condition);

    Optional<Map<String, Object>> findByPrimaryKey(TransactionHandle tx, EntityDescriptor entity, Object id);

    // ==================== WRITES ====================

    /**
     * Inserts a row and returns it as stored, generated primary key included.
     */
    Map<String, Object> create(TransactionHandle tx, EntityDescriptor entity, Map<String, Object> attributes);

    Map<String, Object> update(TransactionHandle tx, EntityDescriptor entity, Object id,
                               Map<String, Object> attributes);

    int updateWhere(TransactionHandle tx, EntityDescriptor entity, Predicate where, Map<String, Object> attributes);

    int destroyWhere(TransactionHandle tx, EntityDescriptor entity, Predicate where);

    /**
     * Runs {@code work} in one transaction, committed when it returns and rolled back when it throws.
     */
    <T> T inTransaction(Function<TransactionHandle, T> work);
}
