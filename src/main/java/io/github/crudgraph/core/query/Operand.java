package io.github.crudgraph.core.query;

/**
 * Left-hand side of a comparison or target of an ordering: a column reference or an opaque expression.
 */
public interface Operand {
}
