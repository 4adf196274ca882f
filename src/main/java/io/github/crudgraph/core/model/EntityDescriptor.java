package io.github.crudgraph.core.model;

import io.github.crudgraph.core.query.Predicate;
import lombok.Builder;
import lombok.Getter;
import lombok.Singular;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Immutable description of one table: attributes, primary key, associations and read defaults.
 */
@Getter
public class EntityDescriptor {

    public static final String DEFAULT_UPDATED_AT = "updated_at";

    private final String name;
    private final String table;
    private final String primaryKey;
    private final Map<String, AttributeDescriptor> attributes;
    private final Map<String, Association> associations;
    private final boolean timestamps;
    private final String updatedAt;
    private final Predicate defaultScope;

    @Builder
    private EntityDescriptor(String name, String table, String primaryKey,
                             @Singular List<AttributeDescriptor> attributes,
                             @Singular List<Association> associations,
                             boolean timestamps, String updatedAt, Predicate defaultScope) {
        this.name = name;
        this.table = table != null ? table : name;
        this.primaryKey = primaryKey != null ? primaryKey : "id";
        this.timestamps = timestamps;
        this.updatedAt = updatedAt != null ? updatedAt : DEFAULT_UPDATED_AT;
        this.defaultScope = defaultScope;

        Map<String, AttributeDescriptor> byName = new LinkedHashMap<>();
        attributes.forEach(attribute -> byName.put(attribute.getName(), attribute));
        this.attributes = Collections.unmodifiableMap(byName);

        Map<String, Association> byAlias = new LinkedHashMap<>();
        associations.forEach(association -> byAlias.put(association.getAs(), association.withSource(name)));
        this.associations = Collections.unmodifiableMap(byAlias);
    }

    public boolean hasAttribute(String attribute) {
        return attributes.containsKey(attribute);
    }

    public Optional<AttributeDescriptor> attribute(String attribute) {
        return Optional.ofNullable(attributes.get(attribute));
    }

    public boolean hasAssociation(String alias) {
        return associations.containsKey(alias);
    }

    public Optional<Association> association(String alias) {
        return Optional.ofNullable(associations.get(alias));
    }

    public Collection<AttributeDescriptor> attributeList() {
        return attributes.values();
    }

    public AttributeDescriptor primaryKeyAttribute() {
        return attributes.get(primaryKey);
    }

    public String primaryKeyColumn() {
        return primaryKeyAttribute().getColumn();
    }

    /**
     * Physical column of an attribute, or the name itself when it is not declared.
     */
    public String columnOf(String attribute) {
        AttributeDescriptor descriptor = attributes.get(attribute);
        return descriptor != null ? descriptor.getColumn() : attribute;
    }

    @Override
    public String toString() {
        return "EntityDescriptor(" + name + ")";
    }
}
