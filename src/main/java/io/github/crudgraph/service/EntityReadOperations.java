package io.github.crudgraph.service;

import io.github.crudgraph.core.context.AuthContext;
import io.github.crudgraph.core.context.ContextRequest;
import io.github.crudgraph.core.enums.FilterOperator;
import io.github.crudgraph.core.exception.ApplicationException;
import io.github.crudgraph.core.exception.ClientError;
import io.github.crudgraph.core.model.EntityDescriptor;
import io.github.crudgraph.core.query.ColumnRef;
import io.github.crudgraph.core.query.Comparison;
import io.github.crudgraph.core.query.Condition;
import io.github.crudgraph.core.query.Include;
import io.github.crudgraph.core.query.Junction;
import io.github.crudgraph.core.query.KeyPage;
import io.github.crudgraph.core.query.OrderItem;
import io.github.crudgraph.core.query.ProjectedAttribute;
import io.github.crudgraph.generator.TimestampsManager;
import io.github.crudgraph.service.storage.StorageClient;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Read path: condition merging, single item lookup and two-phase paginated listing.
 */
@Slf4j
public class EntityReadOperations {

    private final EntityServiceContext context;
    private final EntityDescriptor entity;
    private final StorageClient storage;

    public EntityReadOperations(EntityServiceContext context) {
        this.context = context;
        this.entity = context.getEntity();
        this.storage = context.getStorage();
    }

    public Map<String, Object> getItem(AuthContext auth, Object id) {
        Condition merged = generateCondition(auth, null);
        Condition condition = merged.toBuilder()
                .where(Junction.and(merged.getWhere(), primaryKeyEquals(id)))
                .build();

        List<Map<String, Object>> items = storage.findAll(entity, condition);
        if (items.isEmpty()) {
            throw new ApplicationException(ClientError.ITEM_NOT_FOUND);
        }
        return items.get(0);
    }

    public ListResult<Map<String, Object>> getList(AuthContext auth, ContextRequest request) {
        int page = request.getPage();
        int pageSize = request.getPageSize();
        List<OrderItem> order = generateOrder(request);

        // Phase 1: ordered distinct keys of the requested page
        Condition keyCondition = generateCondition(auth, request).toBuilder()
                .clearOrder()
                .order(order)
                .limit(pageSize)
                .offset(request.getOffset())
                .build();
        KeyPage keys = storage.findPrimaryKeys(entity, keyCondition);

        if (keys.getKeys().isEmpty()) {
            return new ListResult<>(List.of(), keys.getTotalCount(), page, pageSize);
        }

        // Phase 2: full rows of those keys, same order
        Condition base = generateBaseFetchCondition();
        Condition rowCondition = base.toBuilder()
                .where(Junction.and(
                        Comparison.of(primaryKey(), FilterOperator.IN, keys.getKeys()),
                        base.getWhere()))
                .clearOrder()
                .order(order)
                .build();
        List<Map<String, Object>> items = storage.findAll(entity, rowCondition);

        log.debug("Listed {} of {} {} item(s), page {}", items.size(), keys.getTotalCount(), entity.getName(), page);
        return new ListResult<>(items, keys.getTotalCount(), page, pageSize);
    }

    /**
     * Base fetch condition, then permission restrictions, then filters: joins concatenated and
     * de-duplicated, predicates ANDed.
     */
    public Condition generateCondition(AuthContext auth, ContextRequest request) {
        Condition base = generateBaseFetchCondition();
        Condition permissions = context.newPermissionsManager().generateCondition(auth);
        Condition filters = context.newFiltersGenerator().generateCondition(auth, request);

        return base.toBuilder()
                .clearIncludes()
                .includes(Condition.mergeIncludes(List.of(
                        base.getIncludes(), permissions.getIncludes(), filters.getIncludes())))
                .where(Junction.and(base.getWhere(), permissions.getWhere(), filters.getWhere()))
                .build();
    }

    /**
     * Configured fetch condition plus the entity's default scope and, for timestamped entities,
     * the effective {@code updated_at} projection.
     */
    public Condition generateBaseFetchCondition() {
        Condition fetch = context.getConfig().getFetchCondition();
        Condition.ConditionBuilder builder = fetch.toBuilder()
                .where(Junction.and(fetch.getWhere(), entity.getDefaultScope()));

        TimestampsManager timestamps = context.newTimestampsManager();
        if (timestamps.hasTimestamps()) {
            List<Include> includes = new ArrayList<>(fetch.getIncludes());
            includes.addAll(timestamps.joins());
            builder.clearIncludes()
                    .includes(Condition.mergeIncludes(List.of(includes)))
                    .attribute(ProjectedAttribute.of(timestamps.buildLatestTimestampExpression(),
                            TimestampsManager.UPDATED_AT));
        }
        return builder.build();
    }

    private List<OrderItem> generateOrder(ContextRequest request) {
        OrderStrategy strategy = context.getConfig().getOrderStrategy();
        if (strategy != null) {
            return strategy.order(request, context.newOrderGenerator());
        }
        return context.newOrderGenerator().generateCondition(request);
    }

    private Comparison primaryKeyEquals(Object id) {
        return Comparison.of(primaryKey(), FilterOperator.EQ, id);
    }

    private ColumnRef primaryKey() {
        return ColumnRef.root(entity.primaryKeyColumn());
    }
}
