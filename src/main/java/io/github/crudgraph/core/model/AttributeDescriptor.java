package io.github.crudgraph.core.model;

import io.github.crudgraph.core.enums.AttributeType;
import lombok.Value;
import lombok.With;

/**
 * Declared attribute of an entity. {@code column} differs from {@code name} when the attribute is aliased.
 */
@Value
@With
public class AttributeDescriptor {

    String name;
    String column;
    AttributeType type;
    boolean nullable;

    public static AttributeDescriptor of(String name, AttributeType type) {
        return new AttributeDescriptor(name, name, type, true);
    }

    public AttributeDescriptor column(String column) {
        return withColumn(column);
    }

    public AttributeDescriptor notNull() {
        return withNullable(false);
    }
}
