package io.github.crudgraph.core.model;

import lombok.extern.slf4j.Slf4j;

import java.util.Arrays;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Registry of entity descriptors keyed by entity name. Validated once on construction, read-only afterwards.
 */
@Slf4j
public class EntityGraph {

    private final Map<String, EntityDescriptor> entities;

    public EntityGraph(Collection<EntityDescriptor> descriptors) {
        Map<String, EntityDescriptor> byName = new LinkedHashMap<>();
        for (EntityDescriptor descriptor : descriptors) {
            if (byName.put(descriptor.getName(), descriptor) != null) {
                throw new IllegalStateException("Entity declared twice: " + descriptor.getName());
            }
        }
        this.entities = Collections.unmodifiableMap(byName);
        entities.values().forEach(this::validate);
        log.debug("Entity graph loaded with {} entities", entities.size());
    }

    public static EntityGraph of(EntityDescriptor... descriptors) {
        return new EntityGraph(Arrays.asList(descriptors));
    }

    public EntityDescriptor entity(String name) {
        EntityDescriptor descriptor = entities.get(name);
        if (descriptor == null) {
            throw new IllegalArgumentException("Unknown entity: " + name);
        }
        return descriptor;
    }

    public boolean contains(String name) {
        return entities.containsKey(name);
    }

    public EntityDescriptor target(Association association) {
        return entity(association.getTarget());
    }

    /**
     * Resolves an alias chain starting at {@code root}, returning the visited associations in order.
     */
    public List<Association> walk(EntityDescriptor root, List<String> aliases) {
        EntityDescriptor current = root;
        Association[] hops = new Association[aliases.size()];
        for (int i = 0; i < aliases.size(); i++) {
            String alias = aliases.get(i);
            EntityDescriptor from = current;
            Association association = from.association(alias).orElseThrow(() ->
                    new IllegalArgumentException("Entity " + from.getName() + " has no association '" + alias + "'"));
            hops[i] = association;
            current = target(association);
        }
        return List.of(hops);
    }

    public Collection<EntityDescriptor> entities() {
        return entities.values();
    }

    private void validate(EntityDescriptor descriptor) {
        if (descriptor.primaryKeyAttribute() == null) {
            throw new IllegalStateException("Primary key '" + descriptor.getPrimaryKey()
                    + "' of entity " + descriptor.getName() + " is not a declared attribute");
        }
        for (Association association : descriptor.getAssociations().values()) {
            String where = descriptor.getName() + "." + association.getAs();
            requireEntity(association.getTarget(), where);
            switch (association.getType()) {
                case BELONGS_TO:
                    requireAttribute(descriptor, association.getForeignKey(), where);
                    break;
                case HAS_ONE:
                case HAS_MANY:
                    requireAttribute(entity(association.getTarget()), association.getForeignKey(), where);
                    break;
                case BELONGS_TO_MANY:
                    requireEntity(association.getThrough(), where);
                    EntityDescriptor through = entity(association.getThrough());
                    requireAttribute(through, association.getForeignKey(), where);
                    requireAttribute(through, association.getOtherKey(), where);
                    break;
                default:
                    throw new IllegalStateException("Unsupported association type " + association.getType());
            }
        }
    }

    private void requireEntity(String name, String where) {
        if (name == null || !entities.containsKey(name)) {
            throw new IllegalStateException("Association " + where + " references unknown entity " + name);
        }
    }

    private void requireAttribute(EntityDescriptor owner, String attribute, String where) {
        if (attribute == null || !owner.hasAttribute(attribute)) {
            throw new IllegalStateException("Association " + where + " expects attribute '" + attribute
                    + "' on entity " + owner.getName());
        }
    }
}
