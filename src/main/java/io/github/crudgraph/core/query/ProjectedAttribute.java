package io.github.crudgraph.core.query;

import lombok.Value;

/**
 * Synthetic attribute computed from an expression and returned under {@code alias}.
 */
@Value(staticConstructor = "of")
public class ProjectedAttribute {
    Operand operand;
    String alias;
}
