package io.github.crudgraph.core.query;

import io.github.crudgraph.core.enums.FilterOperator;
import lombok.Value;

@Value(staticConstructor = "of")
public class Comparison implements Predicate {
    Operand operand;
    FilterOperator operator;
    Object value;
}
