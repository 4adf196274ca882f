package io.github.crudgraph.core.query;

/**
 * Node of a WHERE-equivalent predicate tree.
 */
public interface Predicate {
}
