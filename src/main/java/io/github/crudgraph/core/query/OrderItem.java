package io.github.crudgraph.core.query;

import io.github.crudgraph.core.enums.Direction;
import lombok.Value;

@Value(staticConstructor = "of")
public class OrderItem {
    Operand operand;
    Direction direction;
}
