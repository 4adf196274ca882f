package io.github.crudgraph.service.storage.jdbc;

import io.github.crudgraph.core.model.EntityDescriptor;
import lombok.Value;

import java.util.List;

/**
 * Column labels of a rendered SELECT, consumed by {@link RowAssembler} to rebuild nested rows.
 */
@Value
public class SelectPlan {

    EntityDescriptor root;
    List<String> rootAttributes;
    List<String> projectedAttributes;
    List<Node> nodes;

    @Value
    public static class Node {
        /** Dot joined alias chain, also the label prefix of the node's columns. */
        String label;
        String parentLabel;
        String alias;
        boolean toMany;
        String primaryKey;
        List<String> attributes;
        List<String> throughAttributes;
    }
}
