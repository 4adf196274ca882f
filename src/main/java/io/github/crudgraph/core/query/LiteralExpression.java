package io.github.crudgraph.core.query;

import lombok.Value;

/**
 * Opaque SQL expression embedded verbatim, declared through path override maps.
 */
@Value(staticConstructor = "of")
public class LiteralExpression implements Operand {
    String sql;
}
