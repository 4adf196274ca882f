package io.github.crudgraph.generator;

import io.github.crudgraph.core.exception.InvalidPathException;
import io.github.crudgraph.core.model.Association;
import io.github.crudgraph.core.model.AttributeDescriptor;
import io.github.crudgraph.core.model.EntityDescriptor;
import io.github.crudgraph.core.model.EntityGraph;
import lombok.Getter;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Map;

/**
 * Resolves dotted paths such as {@code contacts.address.email} against the entity graph, starting at a root entity.
 * <p>
 * An exact key of the override map short-circuits resolution: literal overrides resolve to an opaque field
 * without associations, path overrides are resolved in place of the requested path.
 */
public class AssociationPathResolver {

    @Getter
    private final EntityDescriptor root;
    private final EntityGraph graph;
    private final Map<String, PathOverride> overrides;

    public AssociationPathResolver(EntityGraph graph, EntityDescriptor root, Map<String, PathOverride> overrides) {
        this.graph = graph;
        this.root = root;
        this.overrides = overrides != null ? overrides : Collections.emptyMap();
    }

    public ResolvedPath resolve(String path) {
        if (path == null || path.isBlank()) {
            throw new InvalidPathException(String.valueOf(path), "path is empty");
        }
        PathOverride override = overrides.get(path);
        if (override != null) {
            if (override.isLiteral()) {
                return ResolvedPath.literal(override.getLiteral());
            }
            return resolveMechanically(override.getPath());
        }
        return resolveMechanically(path);
    }

    /**
     * Association chain of {@code path} without requiring the last segment to be an attribute.
     */
    public List<Association> resolveAssociations(List<String> aliases) {
        List<Association> associations = new ArrayList<>();
        EntityDescriptor current = root;
        for (String alias : aliases) {
            EntityDescriptor from = current;
            Association association = from.association(alias).orElseThrow(() -> new InvalidPathException(
                    String.join(".", aliases), "'" + alias + "' is not an association of " + from.getName()));
            associations.add(association);
            current = graph.target(association);
        }
        return associations;
    }

    /**
     * Entity reached after the last association, or the root when the chain is empty.
     */
    public EntityDescriptor targetEntity(List<Association> associations) {
        if (associations.isEmpty()) {
            return root;
        }
        return graph.target(associations.get(associations.size() - 1));
    }

    private ResolvedPath resolveMechanically(String path) {
        List<String> segments = Arrays.asList(path.split("\\."));
        List<Association> associations = resolveAssociations(segments.subList(0, segments.size() - 1));
        EntityDescriptor target = targetEntity(associations);
        String field = segments.get(segments.size() - 1);
        AttributeDescriptor attribute = target.attribute(field).orElseThrow(() -> new InvalidPathException(
                path, "'" + field + "' is not an attribute of " + target.getName()));
        return new ResolvedPath(List.copyOf(associations), target, attribute, null);
    }
}
