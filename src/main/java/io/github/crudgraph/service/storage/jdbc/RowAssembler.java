package io.github.crudgraph.service.storage.jdbc;

import io.github.crudgraph.core.model.EntityDescriptor;

import java.sql.Date;
import java.sql.Timestamp;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.IdentityHashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Folds flat joined rows back into one nested map per root entity, keeping the order of first appearance.
 * To-many associations become lists (empty when nothing joined), to-one associations a map or {@code null}.
 */
public class RowAssembler {

    public List<Map<String, Object>> assemble(SelectPlan plan, List<Map<String, Object>> rows) {
        EntityDescriptor root = plan.getRoot();
        Map<Object, Map<String, Object>> roots = new LinkedHashMap<>();
        Map<Map<String, Object>, Map<String, Map<Object, Map<String, Object>>>> children = new IdentityHashMap<>();

        for (Map<String, Object> row : rows) {
            Object key = row.get(root.getPrimaryKey());
            Map<String, Object> item = roots.computeIfAbsent(key, ignored -> rootObject(plan, row));

            Map<String, Map<String, Object>> objectsOfRow = new HashMap<>();
            objectsOfRow.put("", item);

            for (SelectPlan.Node node : plan.getNodes()) {
                Map<String, Object> parent = objectsOfRow.get(node.getParentLabel());
                if (parent == null) {
                    continue;
                }
                if (node.isToMany()) {
                    parent.computeIfAbsent(node.getAlias(), ignored -> new ArrayList<Map<String, Object>>());
                } else {
                    parent.putIfAbsent(node.getAlias(), null);
                }

                Object childKey = row.get(node.getLabel() + "." + node.getPrimaryKey());
                if (childKey == null) {
                    continue;
                }

                Map<Object, Map<String, Object>> known = children
                        .computeIfAbsent(parent, ignored -> new HashMap<>())
                        .computeIfAbsent(node.getLabel(), ignored -> new HashMap<>());
                Map<String, Object> child = known.get(childKey);
                if (child == null) {
                    child = nodeObject(node, row);
                    known.put(childKey, child);
                    attach(parent, node, child);
                }
                objectsOfRow.put(node.getLabel(), child);
            }
        }
        return new ArrayList<>(roots.values());
    }

    @SuppressWarnings("unchecked")
    private void attach(Map<String, Object> parent, SelectPlan.Node node, Map<String, Object> child) {
        if (node.isToMany()) {
            ((List<Map<String, Object>>) parent.get(node.getAlias())).add(child);
        } else {
            parent.put(node.getAlias(), child);
        }
    }

    private Map<String, Object> rootObject(SelectPlan plan, Map<String, Object> row) {
        Map<String, Object> item = new LinkedHashMap<>();
        plan.getRootAttributes().forEach(attribute -> item.put(attribute, value(row.get(attribute))));
        plan.getProjectedAttributes().forEach(attribute -> item.put(attribute, value(row.get(attribute))));
        return item;
    }

    private Map<String, Object> nodeObject(SelectPlan.Node node, Map<String, Object> row) {
        Map<String, Object> child = new LinkedHashMap<>();
        node.getAttributes().forEach(attribute ->
                child.put(attribute, value(row.get(node.getLabel() + "." + attribute))));
        if (!node.getThroughAttributes().isEmpty()) {
            Map<String, Object> through = new LinkedHashMap<>();
            node.getThroughAttributes().forEach(attribute -> through.put(attribute,
                    value(row.get(node.getLabel() + "." + SqlRenderer.THROUGH_LABEL + "." + attribute))));
            child.put(SqlRenderer.THROUGH_LABEL, through);
        }
        return child;
    }

    static Object value(Object raw) {
        if (raw instanceof Timestamp) {
            return ((Timestamp) raw).toLocalDateTime();
        }
        if (raw instanceof Date) {
            return ((Date) raw).toLocalDate();
        }
        return raw;
    }
}
