package io.github.crudgraph.service.storage.jdbc;

import io.github.crudgraph.core.enums.AssociationType;
import io.github.crudgraph.core.enums.Direction;
import io.github.crudgraph.core.enums.FilterOperator;
import io.github.crudgraph.core.model.Association;
import io.github.crudgraph.core.model.EntityDescriptor;
import io.github.crudgraph.core.model.EntityGraph;
import io.github.crudgraph.core.query.ColumnRef;
import io.github.crudgraph.core.query.Comparison;
import io.github.crudgraph.core.query.Condition;
import io.github.crudgraph.core.query.Include;
import io.github.crudgraph.core.query.Junction;
import io.github.crudgraph.core.query.LatestTimestampExpression;
import io.github.crudgraph.core.query.LiteralExpression;
import io.github.crudgraph.core.query.Operand;
import io.github.crudgraph.core.query.OrderItem;
import io.github.crudgraph.core.query.Predicate;
import io.github.crudgraph.core.query.ProjectedAttribute;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;

import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.StringJoiner;
import java.util.stream.Collectors;

/**
 * Renders declarative conditions to ANSI-quoted SQL with named parameters.
 * <p>
 * Table aliases are the root entity name and the arrow joined association chain ({@code "contacts->address"});
 * column labels are the dot joined chain plus the attribute name ({@code "contacts.address.email"}).
 * Every association referenced by a predicate, an ordering or a projection is joined even when no include
 * names it.
 */
public class SqlRenderer {

    static final String EPOCH = "TIMESTAMP '1970-01-01 00:00:00'";
    static final String KEY_LABEL = "__pk";
    static final String THROUGH_LABEL = "through";

    private final EntityGraph graph;
    private final String datetimeType;

    public SqlRenderer(EntityGraph graph, String datetimeType) {
        this.graph = graph;
        this.datetimeType = datetimeType;
    }

    // ==================== SELECT ====================

    /**
     * Row select with eager includes, projections, ordering and paging window.
     */
    public SqlStatement select(EntityDescriptor entity, Condition condition) {
        Context context = new Context(buildTree(entity, condition), false);
        JoinNode root = context.root;

        List<String> columns = new ArrayList<>();
        Set<String> aliases = condition.getAttributes().stream()
                .map(ProjectedAttribute::getAlias)
                .collect(Collectors.toSet());
        // a projection replaces the stored attribute of the same name
        List<String> rootAttributes = root.getEntity().getAttributes().keySet().stream()
                .filter(attribute -> !condition.getExcludedAttributes().contains(attribute))
                .filter(attribute -> !aliases.contains(attribute))
                .collect(Collectors.toList());
        rootAttributes.forEach(attribute -> columns.add(column(root, attribute) + " AS " + quote(attribute)));

        List<SelectPlan.Node> nodes = new ArrayList<>();
        for (JoinNode node : root.descendants()) {
            if (!node.isSelecting()) {
                continue;
            }
            List<String> attributes = node.attributesToSelect();
            attributes.forEach(attribute ->
                    columns.add(column(node, attribute) + " AS " + quote(node.label() + "." + attribute)));

            List<String> throughAttributes = throughAttributes(node);
            throughAttributes.forEach(attribute -> columns.add(quote(node.throughAlias()) + "."
                    + graph.entity(node.getAssociation().getThrough()).columnOf(attribute)
                    + " AS " + quote(node.label() + "." + THROUGH_LABEL + "." + attribute)));

            nodes.add(new SelectPlan.Node(node.label(), node.getParent().label(), node.getAssociation().getAs(),
                    node.getAssociation().getType().isToMany(), node.getEntity().getPrimaryKey(),
                    attributes, throughAttributes));
        }

        List<String> projected = new ArrayList<>();
        for (ProjectedAttribute attribute : condition.getAttributes()) {
            columns.add(operand(attribute.getOperand(), context) + " AS " + quote(attribute.getAlias()));
            context.projections.put(attribute.getOperand(), attribute.getAlias());
            projected.add(attribute.getAlias());
        }

        StringBuilder sql = new StringBuilder("SELECT ").append(String.join(", ", columns));
        appendFromWhere(sql, context, condition.getWhere());
        appendOrder(sql, context, condition.getOrder());
        appendWindow(sql, condition.getLimit(), condition.getOffset());

        SelectPlan plan = new SelectPlan(entity, rootAttributes, projected, nodes);
        return new SqlStatement(sql.toString(), context.parameters, plan);
    }

    /**
     * Phase one of paging: distinct primary keys grouped so joined fan-out cannot skew the window.
     * Order operands are aggregated per group (MIN ascending, MAX descending).
     */
    public SqlStatement selectKeys(EntityDescriptor entity, Condition condition) {
        Context context = new Context(buildTree(entity, condition), true);
        String key = column(context.root, entity.getPrimaryKey());

        StringBuilder sql = new StringBuilder("SELECT ").append(key).append(" AS ").append(quote(KEY_LABEL));
        appendFromWhere(sql, context, condition.getWhere());
        sql.append(" GROUP BY ").append(key);
        appendOrder(sql, context, condition.getOrder());
        appendWindow(sql, condition.getLimit(), condition.getOffset());
        return new SqlStatement(sql.toString(), context.parameters);
    }

    public SqlStatement countKeys(EntityDescriptor entity, Condition condition) {
        Context context = new Context(buildTree(entity, condition), false);
        StringBuilder sql = new StringBuilder("SELECT COUNT(DISTINCT ")
                .append(column(context.root, entity.getPrimaryKey())).append(")");
        appendFromWhere(sql, context, condition.getWhere());
        return new SqlStatement(sql.toString(), context.parameters);
    }

    public SqlStatement selectByKey(EntityDescriptor entity, Object id) {
        MapSqlParameterSource parameters = new MapSqlParameterSource("id", id);
        StringJoiner columns = new StringJoiner(", ");
        entity.attributeList().forEach(attribute ->
                columns.add(attribute.getColumn() + " AS " + quote(attribute.getName())));
        String sql = "SELECT " + columns + " FROM " + entity.getTable()
                + " WHERE " + entity.primaryKeyColumn() + " = :id";
        return new SqlStatement(sql, parameters);
    }

    // ==================== MUTATIONS ====================

    public SqlStatement insert(EntityDescriptor entity, Map<String, Object> attributes) {
        if (attributes.isEmpty()) {
            return new SqlStatement("INSERT INTO " + entity.getTable() + " DEFAULT VALUES", new MapSqlParameterSource());
        }
        MapSqlParameterSource parameters = new MapSqlParameterSource();
        StringJoiner columns = new StringJoiner(", ");
        StringJoiner values = new StringJoiner(", ");
        int index = 0;
        for (Map.Entry<String, Object> entry : attributes.entrySet()) {
            String name = "v" + index++;
            columns.add(entity.columnOf(entry.getKey()));
            values.add(":" + name);
            parameters.addValue(name, entry.getValue());
        }
        String sql = "INSERT INTO " + entity.getTable() + " (" + columns + ") VALUES (" + values + ")";
        return new SqlStatement(sql, parameters);
    }

    public SqlStatement updateByKey(EntityDescriptor entity, Object id, Map<String, Object> attributes) {
        Predicate byKey = Comparison.of(ColumnRef.root(entity.primaryKeyColumn()),
                FilterOperator.EQ, id);
        return updateWhere(entity, byKey, attributes);
    }

    public SqlStatement updateWhere(EntityDescriptor entity, Predicate where, Map<String, Object> attributes) {
        Context context = Context.bare(entity);
        StringJoiner assignments = new StringJoiner(", ");
        for (Map.Entry<String, Object> entry : attributes.entrySet()) {
            assignments.add(entity.columnOf(entry.getKey()) + " = " + context.bind(entry.getValue()));
        }
        StringBuilder sql = new StringBuilder("UPDATE ").append(entity.getTable()).append(" SET ").append(assignments);
        if (where != null) {
            sql.append(" WHERE ").append(predicate(where, context));
        }
        return new SqlStatement(sql.toString(), context.parameters);
    }

    public SqlStatement delete(EntityDescriptor entity, Predicate where) {
        Context context = Context.bare(entity);
        StringBuilder sql = new StringBuilder("DELETE FROM ").append(entity.getTable());
        if (where != null) {
            sql.append(" WHERE ").append(predicate(where, context));
        }
        return new SqlStatement(sql.toString(), context.parameters);
    }

    // ==================== CLAUSES ====================

    private void appendFromWhere(StringBuilder sql, Context context, Predicate where) {
        JoinNode root = context.root;
        sql.append(" FROM ").append(root.getEntity().getTable()).append(" ").append(quote(root.alias()));
        for (JoinNode node : root.descendants()) {
            appendJoin(sql, node, context);
        }
        if (where != null) {
            sql.append(" WHERE ").append(predicate(where, context));
        }
    }

    private void appendJoin(StringBuilder sql, JoinNode node, Context context) {
        Association association = node.getAssociation();
        JoinNode parent = node.getParent();
        EntityDescriptor source = parent.getEntity();
        EntityDescriptor target = node.getEntity();
        String join = node.isRequired() ? " INNER JOIN " : " LEFT OUTER JOIN ";
        String alias = quote(node.alias());
        String parentAlias = quote(parent.alias());

        String on;
        if (association.getType() == AssociationType.BELONGS_TO) {
            on = alias + "." + target.primaryKeyColumn() + " = " + parentAlias + "." + source.columnOf(association.getForeignKey());
        } else if (association.getType() == AssociationType.BELONGS_TO_MANY) {
            EntityDescriptor through = graph.entity(association.getThrough());
            String throughAlias = quote(node.throughAlias());
            sql.append(join).append(through.getTable()).append(" ").append(throughAlias)
                    .append(" ON ").append(throughAlias).append(".").append(through.columnOf(association.getForeignKey()))
                    .append(" = ").append(parentAlias).append(".").append(source.primaryKeyColumn());
            on = alias + "." + target.primaryKeyColumn() + " = " + throughAlias + "." + through.columnOf(association.getOtherKey());
        } else {
            on = alias + "." + target.columnOf(association.getForeignKey()) + " = " + parentAlias + "." + source.primaryKeyColumn();
        }

        if (target.getDefaultScope() != null) {
            on = on + " AND " + predicate(target.getDefaultScope(), context.relativeTo(node));
        }
        sql.append(join).append(target.getTable()).append(" ").append(alias).append(" ON ").append(on);
    }

    private void appendOrder(StringBuilder sql, Context context, List<OrderItem> order) {
        if (order.isEmpty()) {
            return;
        }
        StringJoiner items = new StringJoiner(", ");
        for (OrderItem item : order) {
            String expression;
            String projection = context.projections.get(item.getOperand());
            if (projection != null) {
                expression = quote(projection);
            } else if (context.grouped && !(item.getOperand() instanceof LatestTimestampExpression)) {
                String aggregate = item.getDirection() == Direction.DESC ? "MAX" : "MIN";
                expression = aggregate + "(" + operand(item.getOperand(), context) + ")";
            } else {
                expression = operand(item.getOperand(), context);
            }
            items.add(expression + " " + item.getDirection().name());
        }
        sql.append(" ORDER BY ").append(items);
    }

    private void appendWindow(StringBuilder sql, Integer limit, Integer offset) {
        if (limit != null) {
            sql.append(" LIMIT ").append(limit.intValue());
        }
        if (offset != null && offset > 0) {
            if (limit == null) {
                sql.append(" LIMIT ").append(Integer.MAX_VALUE);
            }
            sql.append(" OFFSET ").append(offset.intValue());
        }
    }

    // ==================== PREDICATES & OPERANDS ====================

    String predicate(Predicate predicate, Context context) {
        if (predicate instanceof Junction) {
            Junction junction = (Junction) predicate;
            if (junction.getPredicates().isEmpty()) {
                return junction.getType() == Junction.Type.AND ? "1 = 1" : "1 = 0";
            }
            String separator = " " + junction.getType().name() + " ";
            return junction.getPredicates().stream()
                    .map(child -> predicate(child, context))
                    .collect(Collectors.joining(separator, "(", ")"));
        }
        if (predicate instanceof Comparison) {
            return comparison((Comparison) predicate, context);
        }
        throw new IllegalArgumentException("Unsupported predicate " + predicate);
    }

    private String comparison(Comparison comparison, Context context) {
        String left = operand(comparison.getOperand(), context);
        Object value = comparison.getValue();
        switch (comparison.getOperator()) {
            case EQ:
            case IS:
                return value == null ? left + " IS NULL" : left + " = " + context.bind(value);
            case NE:
            case NOT:
                return value == null ? left + " IS NOT NULL" : left + " <> " + context.bind(value);
            case GT:
                return left + " > " + context.bind(value);
            case GTE:
                return left + " >= " + context.bind(value);
            case LT:
                return left + " < " + context.bind(value);
            case LTE:
                return left + " <= " + context.bind(value);
            case LIKE:
                return left + " LIKE " + context.bind(value);
            case IN:
                return values(value).isEmpty() ? "1 = 0" : left + " IN (" + context.bind(values(value)) + ")";
            case NOT_IN:
                return values(value).isEmpty() ? "1 = 1" : left + " NOT IN (" + context.bind(values(value)) + ")";
            default:
                throw new IllegalArgumentException("Unsupported operator " + comparison.getOperator());
        }
    }

    String operand(Operand operand, Context context) {
        if (operand instanceof ColumnRef) {
            ColumnRef ref = (ColumnRef) operand;
            if (context.bare) {
                if (!ref.isRoot()) {
                    throw new IllegalArgumentException("Mutations only accept root columns, got " + ref.qualifiedName());
                }
                return ref.getColumn();
            }
            JoinNode node = context.base.descend(graph, ref.getAssociationPath());
            return quote(node.alias()) + "." + ref.getColumn();
        }
        if (operand instanceof LiteralExpression) {
            return ((LiteralExpression) operand).getSql();
        }
        if (operand instanceof LatestTimestampExpression) {
            return latestTimestamp((LatestTimestampExpression) operand, context);
        }
        throw new IllegalArgumentException("Unsupported operand " + operand);
    }

    private String latestTimestamp(LatestTimestampExpression expression, Context context) {
        List<String> coalesced = expression.getColumns().stream()
                .map(column -> "COALESCE(" + operand(column, context) + ", " + EPOCH + ")")
                .collect(Collectors.toList());
        String inner;
        if (context.grouped) {
            inner = expression.isSingleColumn()
                    ? "MAX(" + coalesced.get(0) + ")"
                    : "MAX(GREATEST(" + String.join(", ", coalesced) + "))";
        } else if (expression.isSingleColumn()) {
            inner = coalesced.get(0);
        } else {
            inner = "MAX(GREATEST(" + String.join(", ", coalesced) + ")) OVER (PARTITION BY "
                    + operand(expression.getPartitionKey(), context) + ")";
        }
        return "CAST(" + inner + " AS " + datetimeType + ")";
    }

    // ==================== HELPERS ====================

    private JoinNode buildTree(EntityDescriptor entity, Condition condition) {
        JoinNode root = JoinNode.root(entity);
        for (Include include : condition.getIncludes()) {
            root.add(graph, include.getPath(), include.isRequired(), include.getAttributes());
        }
        List<ColumnRef> references = new ArrayList<>();
        collect(condition.getWhere(), references);
        condition.getOrder().forEach(item -> collect(item.getOperand(), references));
        condition.getAttributes().forEach(attribute -> collect(attribute.getOperand(), references));
        references.stream()
                .filter(ref -> !ref.isRoot())
                .forEach(ref -> root.add(graph, ref.getAssociationPath(), false, List.of()));
        return root;
    }

    private void collect(Predicate predicate, List<ColumnRef> references) {
        if (predicate instanceof Junction) {
            ((Junction) predicate).getPredicates().forEach(child -> collect(child, references));
        } else if (predicate instanceof Comparison) {
            collect(((Comparison) predicate).getOperand(), references);
        }
    }

    private void collect(Operand operand, List<ColumnRef> references) {
        if (operand instanceof ColumnRef) {
            references.add((ColumnRef) operand);
        } else if (operand instanceof LatestTimestampExpression) {
            references.addAll(((LatestTimestampExpression) operand).getColumns());
        }
    }

    private List<String> throughAttributes(JoinNode node) {
        Association association = node.getAssociation();
        if (association.getType() != AssociationType.BELONGS_TO_MANY) {
            return List.of();
        }
        EntityDescriptor through = graph.entity(association.getThrough());
        Set<String> keys = Set.of(through.getPrimaryKey(), association.getForeignKey(), association.getOtherKey());
        return through.getAttributes().keySet().stream()
                .filter(attribute -> !keys.contains(attribute))
                .collect(Collectors.toList());
    }

    private String column(JoinNode node, String attribute) {
        return quote(node.alias()) + "." + node.getEntity().columnOf(attribute);
    }

    private static List<?> values(Object value) {
        if (value instanceof Collection) {
            return new ArrayList<>((Collection<?>) value);
        }
        List<Object> single = new ArrayList<>(1);
        single.add(value);
        return single;
    }

    static String quote(String identifier) {
        return "\"" + identifier.replace("\"", "\"\"") + "\"";
    }

    /**
     * Per-statement rendering state: parameter counter, join tree and projections.
     */
    static final class Context {
        private final JoinNode root;
        private final JoinNode base;
        private final boolean grouped;
        private final boolean bare;
        private final MapSqlParameterSource parameters;
        private final Map<Operand, String> projections;
        private final int[] counter;

        Context(JoinNode root, boolean grouped) {
            this(root, root, grouped, false, new MapSqlParameterSource(), new HashMap<>(), new int[1]);
        }

        private Context(JoinNode root, JoinNode base, boolean grouped, boolean bare,
                        MapSqlParameterSource parameters, Map<Operand, String> projections, int[] counter) {
            this.root = root;
            this.base = base;
            this.grouped = grouped;
            this.bare = bare;
            this.parameters = parameters;
            this.projections = projections;
            this.counter = counter;
        }

        static Context bare(EntityDescriptor entity) {
            JoinNode root = JoinNode.root(entity);
            return new Context(root, root, false, true, new MapSqlParameterSource(), new HashMap<>(), new int[1]);
        }

        Context relativeTo(JoinNode node) {
            return new Context(root, node, grouped, bare, parameters, projections, counter);
        }

        String bind(Object value) {
            String name = "p" + counter[0]++;
            parameters.addValue(name, value);
            return ":" + name;
        }
    }
}
