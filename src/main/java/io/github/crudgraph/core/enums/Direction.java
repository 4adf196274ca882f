package io.github.crudgraph.core.enums;

public enum Direction {
    ASC,
    DESC
}
