package io.github.crudgraph.core.enums;

public enum AssociationType {
    BELONGS_TO,
    HAS_ONE,
    HAS_MANY,
    BELONGS_TO_MANY;

    /**
     * Whether the linking foreign key lives on the source entity.
     */
    public boolean isForeignKeyOnSource() {
        return this == BELONGS_TO;
    }

    public boolean isToMany() {
        return this == HAS_MANY || this == BELONGS_TO_MANY;
    }
}
