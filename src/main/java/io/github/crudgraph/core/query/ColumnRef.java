package io.github.crudgraph.core.query;

import lombok.Value;

import java.util.List;

/**
 * Physical column reached through a chain of association aliases. An empty chain addresses the root entity.
 */
@Value
public class ColumnRef implements Operand {

    List<String> associationPath;
    String column;

    public static ColumnRef of(List<String> associationPath, String column) {
        return new ColumnRef(List.copyOf(associationPath), column);
    }

    public static ColumnRef root(String column) {
        return new ColumnRef(List.of(), column);
    }

    public boolean isRoot() {
        return associationPath.isEmpty();
    }

    /**
     * Dot joined alias chain followed by the column, the reference shape used in generated conditions.
     */
    public String qualifiedName() {
        if (associationPath.isEmpty()) {
            return column;
        }
        return String.join(".", associationPath) + "." + column;
    }
}
