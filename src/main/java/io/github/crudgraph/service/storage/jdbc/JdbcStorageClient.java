package io.github.crudgraph.service.storage.jdbc;

import io.github.crudgraph.core.model.EntityDescriptor;
import io.github.crudgraph.core.model.EntityGraph;
import io.github.crudgraph.core.query.Condition;
import io.github.crudgraph.core.query.KeyPage;
import io.github.crudgraph.core.query.Predicate;
import io.github.crudgraph.service.storage.StorageClient;
import io.github.crudgraph.service.storage.TransactionHandle;
import lombok.extern.slf4j.Slf4j;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.jdbc.support.GeneratedKeyHolder;
import org.springframework.jdbc.support.KeyHolder;
import org.springframework.transaction.support.TransactionTemplate;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;

/**
 * {@link StorageClient} on Spring JDBC. Statements run on the thread-bound transaction opened by
 * {@link #inTransaction(Function)} when there is one, in auto-commit mode otherwise.
 */
@Slf4j
public class JdbcStorageClient implements StorageClient {

    private final NamedParameterJdbcTemplate jdbcTemplate;
    private final TransactionTemplate transactionTemplate;
    private final SqlRenderer renderer;
    private final RowAssembler assembler = new RowAssembler();
    private final boolean logStatements;

    public JdbcStorageClient(NamedParameterJdbcTemplate jdbcTemplate, TransactionTemplate transactionTemplate,
                             EntityGraph graph, String datetimeType, boolean logStatements) {
        this.jdbcTemplate = jdbcTemplate;
        this.transactionTemplate = transactionTemplate;
        this.renderer = new SqlRenderer(graph, datetimeType);
        this.logStatements = logStatements;
    }

    // ==================== READS ====================

    @Override
    public List<Map<String, Object>> findAll(EntityDescriptor entity, Condition condition) {
        SqlStatement statement = renderer.select(entity, condition);
        trace(statement);
        List<Map<String, Object>> rows = jdbcTemplate.queryForList(statement.getSql(), statement.getParameters());
        return assembler.assemble(statement.getPlan(), rows);
    }

    @Override
    public Optional<Map<String, Object>> findOne(EntityDescriptor entity, Condition condition) {
        List<Map<String, Object>> items = findAll(entity, condition);
        return items.isEmpty() ? Optional.empty() : Optional.of(items.get(0));
    }

    @Override
    public KeyPage findPrimaryKeys(EntityDescriptor entity, Condition condition) {
        SqlStatement keys = renderer.selectKeys(entity, condition);
        trace(keys);
        List<Object> primaryKeys = jdbcTemplate.queryForList(keys.getSql(), keys.getParameters(), Object.class);

        SqlStatement count = renderer.countKeys(entity, condition);
        trace(count);
        Long total = jdbcTemplate.queryForObject(count.getSql(), count.getParameters(), Long.class);

        return new KeyPage(new ArrayList<>(primaryKeys), total != null ? total : 0L);
    }

    @Override
    public Optional<Map<String, Object>> findByPrimaryKey(TransactionHandle tx, EntityDescriptor entity, Object id) {
        SqlStatement statement = renderer.selectByKey(entity, id);
        trace(statement);
        List<Map<String, Object>> rows = jdbcTemplate.queryForList(statement.getSql(), statement.getParameters());
        if (rows.isEmpty()) {
            return Optional.empty();
        }
        Map<String, Object> item = new LinkedHashMap<>();
        rows.get(0).forEach((column, value) -> item.put(attributeName(entity, column), RowAssembler.value(value)));
        return Optional.of(item);
    }

    // ==================== WRITES ====================

    @Override
    public Map<String, Object> create(TransactionHandle tx, EntityDescriptor entity, Map<String, Object> attributes) {
        SqlStatement statement = renderer.insert(entity, attributes);
        trace(statement);

        Object id = attributes.get(entity.getPrimaryKey());
        if (id == null) {
            KeyHolder keyHolder = new GeneratedKeyHolder();
            jdbcTemplate.update(statement.getSql(), statement.getParameters(), keyHolder);
            id = generatedKey(entity, keyHolder);
        } else {
            jdbcTemplate.update(statement.getSql(), statement.getParameters());
        }

        Object createdId = id;
        return findByPrimaryKey(tx, entity, createdId).orElseThrow(() ->
                new IllegalStateException("Inserted " + entity.getName() + " row " + createdId + " cannot be read back"));
    }

    @Override
    public Map<String, Object> update(TransactionHandle tx, EntityDescriptor entity, Object id,
                                      Map<String, Object> attributes) {
        if (!attributes.isEmpty()) {
            SqlStatement statement = renderer.updateByKey(entity, id, attributes);
            trace(statement);
            jdbcTemplate.update(statement.getSql(), statement.getParameters());
        }
        return findByPrimaryKey(tx, entity, id).orElseThrow(() ->
                new IllegalStateException("Updated " + entity.getName() + " row " + id + " cannot be read back"));
    }

    @Override
    public int updateWhere(TransactionHandle tx, EntityDescriptor entity, Predicate where,
                           Map<String, Object> attributes) {
        SqlStatement statement = renderer.updateWhere(entity, where, attributes);
        trace(statement);
        return jdbcTemplate.update(statement.getSql(), statement.getParameters());
    }

    @Override
    public int destroyWhere(TransactionHandle tx, EntityDescriptor entity, Predicate where) {
        SqlStatement statement = renderer.delete(entity, where);
        trace(statement);
        return jdbcTemplate.update(statement.getSql(), statement.getParameters());
    }

    @Override
    public <T> T inTransaction(Function<TransactionHandle, T> work) {
        return transactionTemplate.execute(status -> work.apply(new JdbcTransactionHandle(status)));
    }

    // ==================== HELPERS ====================

    private Object generatedKey(EntityDescriptor entity, KeyHolder keyHolder) {
        Map<String, Object> keys = keyHolder.getKeys();
        if (keys == null || keys.isEmpty()) {
            throw new IllegalStateException("No generated key returned for " + entity.getName());
        }
        String column = entity.primaryKeyColumn();
        return keys.entrySet().stream()
                .filter(entry -> entry.getKey().equalsIgnoreCase(column))
                .map(Map.Entry::getValue)
                .findFirst()
                .orElseGet(() -> keys.values().iterator().next());
    }

    private String attributeName(EntityDescriptor entity, String label) {
        return entity.getAttributes().keySet().stream()
                .filter(attribute -> attribute.equalsIgnoreCase(label))
                .findFirst()
                .orElse(label);
    }

    private void trace(SqlStatement statement) {
        if (logStatements) {
            log.debug("SQL: {}", statement);
        }
    }
}
