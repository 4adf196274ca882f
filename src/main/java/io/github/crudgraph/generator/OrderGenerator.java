package io.github.crudgraph.generator;

import io.github.crudgraph.core.context.ContextRequest;
import io.github.crudgraph.core.enums.Direction;
import io.github.crudgraph.core.exception.ApplicationException;
import io.github.crudgraph.core.exception.ClientError;
import io.github.crudgraph.core.exception.InvalidPathException;
import io.github.crudgraph.core.model.EntityDescriptor;
import io.github.crudgraph.core.model.EntityGraph;
import io.github.crudgraph.core.query.ColumnRef;
import io.github.crudgraph.core.query.Operand;
import io.github.crudgraph.core.query.OrderItem;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;

/**
 * Translates {@code sort_by} ({@code [-]path,[-]path}) into order items, always closed by the primary key ascending.
 */
public class OrderGenerator {

    private final EntityDescriptor entity;
    private final AssociationPathResolver resolver;
    private final TimestampsManager timestamps;

    public OrderGenerator(EntityGraph graph, EntityDescriptor entity, Map<String, PathOverride> pathMap,
                          TimestampsManager timestamps) {
        this.entity = entity;
        this.resolver = new AssociationPathResolver(graph, entity, pathMap);
        this.timestamps = timestamps != null ? timestamps : new TimestampsManager(graph, entity, null);
    }

    public List<OrderItem> generateCondition(ContextRequest request) {
        List<OrderItem> order = new ArrayList<>();
        String sortBy = request != null ? request.getSortBy() : null;

        if (sortBy != null) {
            for (String item : sortBy.split(",", -1)) {
                order.add(buildOrderItem(item.trim()));
            }
        }

        order.add(defaultOrder());
        return order;
    }

    public OrderItem defaultOrder() {
        return OrderItem.of(ColumnRef.root(entity.primaryKeyColumn()), Direction.ASC);
    }

    private OrderItem buildOrderItem(String item) {
        boolean descending = item.startsWith("-");
        String field = descending ? item.substring(1) : item;
        Direction direction = descending ? Direction.DESC : Direction.ASC;

        if (TimestampsManager.isTimestampField(field)) {
            if (!timestamps.hasTimestamps()) {
                throw new ApplicationException(ClientError.INVALID_SORT_BY_OPERATOR);
            }
            return OrderItem.of(timestamps.buildLatestTimestampExpression(), direction);
        }

        Operand operand;
        try {
            operand = resolver.resolve(field).operand();
        } catch (InvalidPathException e) {
            throw new ApplicationException(ClientError.INVALID_SORT_BY_OPERATOR, Collections.emptyMap(), e);
        }
        return OrderItem.of(operand, direction);
    }
}
