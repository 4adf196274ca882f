package io.github.crudgraph.core.enums;

public enum CrudGraphOperation {
    GET_LIST,
    GET_ITEM,
    CREATE,
    UPDATE,
    DELETE
}
