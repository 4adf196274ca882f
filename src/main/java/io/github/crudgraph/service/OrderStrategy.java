package io.github.crudgraph.service;

import io.github.crudgraph.core.context.ContextRequest;
import io.github.crudgraph.core.query.OrderItem;
import io.github.crudgraph.generator.OrderGenerator;

import java.util.List;

/**
 * Replaces the {@code sort_by} driven ordering of list operations.
 * The generator is passed in so implementations can extend its default order.
 */
@FunctionalInterface
public interface OrderStrategy {

    List<OrderItem> order(ContextRequest request, OrderGenerator defaults);
}
