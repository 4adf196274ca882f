package io.github.crudgraph.generator;

import io.github.crudgraph.core.model.Association;
import io.github.crudgraph.core.model.AttributeDescriptor;
import io.github.crudgraph.core.model.EntityDescriptor;
import io.github.crudgraph.core.query.ColumnRef;
import io.github.crudgraph.core.query.Include;
import io.github.crudgraph.core.query.LiteralExpression;
import io.github.crudgraph.core.query.Operand;
import lombok.Value;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Outcome of resolving a dotted path: the association hops plus a terminal attribute or literal.
 */
@Value
public class ResolvedPath {

    List<Association> associations;
    EntityDescriptor entity;
    AttributeDescriptor attribute;
    LiteralExpression literal;

    static ResolvedPath literal(LiteralExpression literal) {
        return new ResolvedPath(List.of(), null, null, literal);
    }

    public boolean isLiteral() {
        return literal != null;
    }

    public List<String> aliases() {
        return associations.stream().map(Association::getAs).collect(Collectors.toList());
    }

    /**
     * Column reference qualified by the alias chain, or the literal itself.
     */
    public Operand operand() {
        if (isLiteral()) {
            return literal;
        }
        return ColumnRef.of(aliases(), attribute.getColumn());
    }

    /**
     * Join required to reach the terminal field, none for root fields and literals.
     */
    public List<Include> joins(boolean required) {
        if (associations.isEmpty()) {
            return List.of();
        }
        return new ArrayList<>(List.of(Include.joinOnly(aliases(), required)));
    }

    public ResolvedPath tail() {
        return new ResolvedPath(associations.subList(1, associations.size()), entity, attribute, literal);
    }
}
