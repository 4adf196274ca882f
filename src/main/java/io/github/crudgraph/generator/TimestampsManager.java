package io.github.crudgraph.generator;

import io.github.crudgraph.core.enums.FilterOperator;
import io.github.crudgraph.core.exception.ApplicationException;
import io.github.crudgraph.core.exception.ClientError;
import io.github.crudgraph.core.exception.ServerError;
import io.github.crudgraph.core.model.Association;
import io.github.crudgraph.core.model.EntityDescriptor;
import io.github.crudgraph.core.model.EntityGraph;
import io.github.crudgraph.core.query.ColumnRef;
import io.github.crudgraph.core.query.Comparison;
import io.github.crudgraph.core.query.Include;
import io.github.crudgraph.core.query.Junction;
import io.github.crudgraph.core.query.LatestTimestampExpression;
import io.github.crudgraph.core.query.Predicate;
import lombok.Value;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Computes the effective last-modified time of an entity across the relations named in its
 * {@link TimestampHierarchy}, for {@code updated_at} ordering and {@code updated_since} filters.
 */
public class TimestampsManager {

    public static final String UPDATED_AT = "updated_at";
    public static final String UPDATED_SINCE = "updated_since";

    private static final List<Function<String, LocalDateTime>> ISO_PARSERS = List.of(
            value -> OffsetDateTime.parse(value).withOffsetSameInstant(ZoneOffset.UTC).toLocalDateTime(),
            LocalDateTime::parse,
            value -> LocalDate.parse(value).atStartOfDay()
    );

    private final EntityGraph graph;
    private final EntityDescriptor root;
    private final List<Node> nodes;

    public TimestampsManager(EntityGraph graph, EntityDescriptor root, TimestampHierarchy hierarchy) {
        this.graph = graph;
        this.root = root;
        this.nodes = new ArrayList<>();
        TimestampHierarchy tree = hierarchy != null ? hierarchy : TimestampHierarchy.of(root.getName());
        if (!tree.getEntity().equals(root.getName())) {
            throw new ApplicationException(ServerError.INVALID_UPDATED_AT_HIERARCHY,
                    Map.of("source", root.getName(), "target", tree.getEntity()));
        }
        walk(tree, root, List.of());
    }

    public static boolean isTimestampField(String field) {
        return UPDATED_AT.equals(field) || UPDATED_SINCE.equals(field);
    }

    public boolean hasTimestamps() {
        return nodes.stream().anyMatch(node -> node.getEntity().isTimestamps());
    }

    /**
     * Qualified timestamp columns: the root by entity name, relations by their alias path joined with
     * {@code separator}, each optionally wrapped in {@code wrapChar}. Duplicates are dropped.
     */
    public List<String> listTimestampColumns(String separator, String wrapChar) {
        String wrap = wrapChar != null ? wrapChar : "";
        Set<String> columns = new LinkedHashSet<>();
        for (Node node : timestampedNodes()) {
            String table = node.getAliases().isEmpty() ? root.getName() : String.join(separator, node.getAliases());
            columns.add(wrap + table + wrap + "." + wrap + node.column() + wrap);
        }
        return new ArrayList<>(columns);
    }

    public List<ColumnRef> timestampColumns() {
        return timestampedNodes().stream()
                .map(node -> ColumnRef.of(node.getAliases(), node.column()))
                .distinct()
                .collect(Collectors.toList());
    }

    public LatestTimestampExpression buildLatestTimestampExpression() {
        return new LatestTimestampExpression(timestampColumns(), ColumnRef.root(root.primaryKeyColumn()));
    }

    /**
     * Joins needed to reach every timestamped relation.
     */
    public List<Include> joins() {
        return timestampedNodes().stream()
                .filter(node -> !node.getAliases().isEmpty())
                .map(node -> Include.joinOnly(node.getAliases(), false))
                .distinct()
                .collect(Collectors.toList());
    }

    /**
     * OR of {@code column operator value} over every timestamp column.
     */
    public Predicate buildSinceFilter(String field, String value, FilterOperator operator) {
        if (!hasTimestamps()) {
            throw new ApplicationException(ClientError.INVALID_UPDATED_SINCE_FIELD, Map.of("field", field));
        }
        LocalDateTime since = parseIsoDateTime(field, value);
        List<Predicate> comparisons = timestampColumns().stream()
                .map(column -> Comparison.of(column, operator, since))
                .collect(Collectors.toList());
        return comparisons.size() == 1 ? comparisons.get(0) : Junction.or(comparisons);
    }

    /**
     * Alias of the association from {@code parent} to {@code child}.
     */
    public String extractAssociationAlias(EntityDescriptor parent, String child) {
        return parent.getAssociations().values().stream()
                .filter(association -> association.getTarget().equals(child))
                .map(Association::getAs)
                .findFirst()
                .orElseThrow(() -> new ApplicationException(ServerError.INVALID_UPDATED_AT_HIERARCHY,
                        Map.of("source", parent.getName(), "target", child)));
    }

    static LocalDateTime parseIsoDateTime(String field, String value) {
        if (value == null) {
            throw new ApplicationException(ClientError.INVALID_FORMAT_DATE_TIME, Map.of("field", field));
        }
        DateTimeParseException failure = null;
        for (Function<String, LocalDateTime> parser : ISO_PARSERS) {
            try {
                return parser.apply(value);
            } catch (DateTimeParseException e) {
                failure = e;
            }
        }
        throw new ApplicationException(ClientError.INVALID_FORMAT_DATE_TIME, Map.of("field", field), failure);
    }

    private void walk(TimestampHierarchy node, EntityDescriptor entity, List<String> aliases) {
        nodes.add(new Node(entity, aliases));
        for (TimestampHierarchy child : node.getInclude()) {
            String alias = extractAssociationAlias(entity, child.getEntity());
            List<String> childAliases = new ArrayList<>(aliases);
            childAliases.add(alias);
            walk(child, graph.entity(child.getEntity()), List.copyOf(childAliases));
        }
    }

    private List<Node> timestampedNodes() {
        return nodes.stream().filter(node -> node.getEntity().isTimestamps()).collect(Collectors.toList());
    }

    @Value
    private static class Node {
        EntityDescriptor entity;
        List<String> aliases;

        String column() {
            return entity.columnOf(entity.getUpdatedAt());
        }
    }
}
