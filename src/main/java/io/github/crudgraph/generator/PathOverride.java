package io.github.crudgraph.generator;

import io.github.crudgraph.core.query.LiteralExpression;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Value;

/**
 * Override map entry: either another dotted path or an opaque SQL literal.
 */
@Value
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class PathOverride {

    String path;
    LiteralExpression literal;

    public static PathOverride to(String path) {
        return new PathOverride(path, null);
    }

    public static PathOverride literal(String sql) {
        return new PathOverride(null, LiteralExpression.of(sql));
    }

    public boolean isLiteral() {
        return literal != null;
    }
}
