package io.github.crudgraph.service.storage.jdbc;

import io.github.crudgraph.core.model.Association;
import io.github.crudgraph.core.model.EntityDescriptor;
import io.github.crudgraph.core.model.EntityGraph;
import lombok.Getter;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Node of the join tree of one SELECT. The root node stands for the queried entity itself.
 */
@Getter
class JoinNode {

    static final String PATH_SEPARATOR = "->";
    static final String THROUGH_SUFFIX = "__through";

    private final EntityDescriptor entity;
    private final Association association;
    private final JoinNode parent;
    private final List<String> path;
    private final Map<String, JoinNode> children = new LinkedHashMap<>();
    private final Set<String> selectedAttributes = new LinkedHashSet<>();
    private boolean required;
    private boolean selectAll;

    private JoinNode(EntityDescriptor entity, Association association, JoinNode parent, List<String> path) {
        this.entity = entity;
        this.association = association;
        this.parent = parent;
        this.path = path;
    }

    static JoinNode root(EntityDescriptor entity) {
        return new JoinNode(entity, null, null, List.of());
    }

    boolean isRoot() {
        return parent == null;
    }

    /**
     * Table alias: the entity name for the root, the arrow joined alias chain otherwise.
     */
    String alias() {
        return isRoot() ? entity.getName() : String.join(PATH_SEPARATOR, path);
    }

    String throughAlias() {
        return alias() + THROUGH_SUFFIX;
    }

    /**
     * Dot joined alias chain used to label selected columns.
     */
    String label() {
        return String.join(".", path);
    }

    boolean isSelecting() {
        return selectAll || !selectedAttributes.isEmpty();
    }

    /**
     * Adds (or reuses) the nodes along {@code aliases}. Required joins make their ancestors required,
     * selecting joins make their ancestors select every attribute unless those already select some.
     */
    JoinNode add(EntityGraph graph, List<String> aliases, boolean requiredJoin, Collection<String> attributes) {
        JoinNode current = this;
        for (int i = 0; i < aliases.size(); i++) {
            current = current.child(graph, aliases.get(i));
            if (requiredJoin) {
                current.required = true;
            }
            boolean last = i == aliases.size() - 1;
            if (last) {
                if (attributes == null) {
                    current.selectAll = true;
                } else {
                    current.selectedAttributes.addAll(attributes);
                }
            } else if ((attributes == null || !attributes.isEmpty()) && !current.isSelecting()) {
                current.selectAll = true;
            }
        }
        return current;
    }

    /**
     * Node reached by {@code aliases} from this node, joined without selection when missing.
     */
    JoinNode descend(EntityGraph graph, List<String> aliases) {
        JoinNode current = this;
        for (String alias : aliases) {
            current = current.child(graph, alias);
        }
        return current;
    }

    /**
     * Attributes to select: all, or the requested ones plus the primary key.
     */
    List<String> attributesToSelect() {
        if (selectAll) {
            return new ArrayList<>(entity.getAttributes().keySet());
        }
        Set<String> attributes = new LinkedHashSet<>();
        attributes.add(entity.getPrimaryKey());
        attributes.addAll(selectedAttributes);
        attributes.removeIf(attribute -> !entity.hasAttribute(attribute));
        return new ArrayList<>(attributes);
    }

    /**
     * Depth-first list of the descendants of this node.
     */
    List<JoinNode> descendants() {
        List<JoinNode> nodes = new ArrayList<>();
        for (JoinNode child : children.values()) {
            nodes.add(child);
            nodes.addAll(child.descendants());
        }
        return nodes;
    }

    private JoinNode child(EntityGraph graph, String alias) {
        JoinNode existing = children.get(alias);
        if (existing != null) {
            return existing;
        }
        Association next = entity.association(alias).orElseThrow(() -> new IllegalArgumentException(
                "Entity " + entity.getName() + " has no association '" + alias + "'"));
        List<String> childPath = new ArrayList<>(path);
        childPath.add(alias);
        JoinNode node = new JoinNode(graph.target(next), next, this, List.copyOf(childPath));
        children.put(alias, node);
        return node;
    }
}
