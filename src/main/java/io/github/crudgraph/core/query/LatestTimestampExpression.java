package io.github.crudgraph.core.query;

import lombok.Value;

import java.util.List;

/**
 * Most recent modification time across several timestamp columns of a root entity and its relations.
 * <p>
 * Storage clients render a single column as a null-safe coalesce against the epoch. Several columns are
 * rendered as the greatest of the coalesces, maximised over a window partitioned by {@code partitionKey}
 * (or over the group when keys are paged), and cast to a date-time type.
 */
@Value
public class LatestTimestampExpression implements Operand {

    List<ColumnRef> columns;
    ColumnRef partitionKey;

    public LatestTimestampExpression(List<ColumnRef> columns, ColumnRef partitionKey) {
        if (columns.isEmpty()) {
            throw new IllegalArgumentException("At least one timestamp column is required");
        }
        this.columns = List.copyOf(columns);
        this.partitionKey = partitionKey;
    }

    public boolean isSingleColumn() {
        return columns.size() == 1;
    }
}
