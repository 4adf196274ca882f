package io.github.crudgraph.generator;

import io.github.crudgraph.core.context.AuthContext;
import io.github.crudgraph.core.context.ContextRequest;
import io.github.crudgraph.core.enums.AttributeType;
import io.github.crudgraph.core.enums.FilterOperator;
import io.github.crudgraph.core.exception.ApplicationException;
import io.github.crudgraph.core.exception.ClientError;
import io.github.crudgraph.core.exception.InvalidPathException;
import io.github.crudgraph.core.model.EntityDescriptor;
import io.github.crudgraph.core.model.EntityGraph;
import io.github.crudgraph.core.query.Comparison;
import io.github.crudgraph.core.query.Condition;
import io.github.crudgraph.core.query.Include;
import io.github.crudgraph.core.query.Junction;
import io.github.crudgraph.core.query.Predicate;
import lombok.Value;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Map;

/**
 * Builds the condition for {@code filter} and {@code q} parameters.
 * <p>
 * Filter grammar: {@code <path> <operator> <value...>}, e.g. {@code contacts.email ct @example.com}.
 */
@Slf4j
public class FiltersGenerator {

    public static final List<String> DEFAULT_SEARCH_FIELDS = List.of("id", "name");

    private static final String NULL_VALUE = "null";
    private static final String EMPTY_VALUE = "empty";
    private static final String TRUE_VALUE = "true";
    private static final String FALSE_VALUE = "false";

    private final AssociationPathResolver resolver;
    private final List<String> searchFields;
    private final TimestampsManager timestamps;

    public FiltersGenerator(EntityGraph graph, EntityDescriptor entity, Map<String, PathOverride> pathMap,
                            List<String> searchFields, TimestampsManager timestamps) {
        this.resolver = new AssociationPathResolver(graph, entity, pathMap);
        this.searchFields = searchFields != null ? searchFields : DEFAULT_SEARCH_FIELDS;
        this.timestamps = timestamps != null ? timestamps : new TimestampsManager(graph, entity, null);
    }

    public Condition generateCondition(AuthContext auth, ContextRequest request) {
        if (request == null) {
            return Condition.EMPTY;
        }

        List<Predicate> predicates = new ArrayList<>();
        List<Include> joins = new ArrayList<>();

        for (String filter : request.getFilters()) {
            BuiltFilter built = buildFilter(filter);
            predicates.add(built.getPredicate());
            joins.addAll(built.getJoins());
        }

        String search = request.getSearch();
        if (search != null && !search.isBlank() && !searchFields.isEmpty()) {
            List<Predicate> alternatives = new ArrayList<>();
            for (String field : searchFields) {
                BuiltFilter built = buildFilter(field + " ct " + search.trim());
                alternatives.add(built.getPredicate());
                joins.addAll(built.getJoins());
            }
            predicates.add(alternatives.size() == 1 ? alternatives.get(0) : Junction.or(alternatives));
        }

        if (!predicates.isEmpty()) {
            log.debug("Generated {} filter predicate(s) for {}", predicates.size(), resolver.getRoot().getName());
        }

        return Condition.builder()
                .where(Junction.and(predicates))
                .includes(Condition.mergeIncludes(List.of(joins)))
                .build();
    }

    public BuiltFilter buildFilter(String filter) {
        List<String> tokens = filter == null ? List.of() : Arrays.asList(filter.trim().split("\\s+"));
        if (tokens.size() < 2 || tokens.get(0).isEmpty()) {
            throw new ApplicationException(ClientError.INVALID_FILTER_PARAMETER);
        }

        String path = tokens.get(0);
        String operatorToken = tokens.get(1);
        String value = String.join(" ", tokens.subList(2, tokens.size()));

        FilterOperator operator = FilterOperator.fromToken(operatorToken).orElseThrow(() ->
                new ApplicationException(ClientError.INVALID_FILTER_OPERATOR, Map.of("operator", operatorToken)));

        if (TimestampsManager.isTimestampField(path)) {
            return new BuiltFilter(timestamps.buildSinceFilter(path, value, operator), timestamps.joins());
        }

        ResolvedPath resolved;
        try {
            resolved = resolver.resolve(path);
        } catch (InvalidPathException e) {
            throw new ApplicationException(ClientError.INVALID_FILTER_PARAMETER, Collections.emptyMap(), e);
        }

        Comparison comparison = coerce(resolved, operator, value);
        return new BuiltFilter(comparison, resolved.joins(false));
    }

    private Comparison coerce(ResolvedPath path, FilterOperator operator, String value) {
        switch (operator) {
            case IS:
            case NOT:
                return nullComparison(path, operator, value);
            case IN:
            case NOT_IN:
                return Comparison.of(path.operand(), operator, Arrays.asList(value.trim().split("\\s*,\\s*")));
            case LIKE:
                return Comparison.of(path.operand(), operator, "%" + value + "%");
            default:
                if (!path.isLiteral() && path.getAttribute().getType() == AttributeType.BOOLEAN
                        && (TRUE_VALUE.equals(value) || FALSE_VALUE.equals(value))) {
                    return Comparison.of(path.operand(), operator, Boolean.valueOf(value));
                }
                return Comparison.of(path.operand(), operator, value);
        }
    }

    private Comparison nullComparison(ResolvedPath path, FilterOperator operator, String value) {
        if (NULL_VALUE.equals(value)) {
            return Comparison.of(path.operand(), operator, null);
        }
        if (EMPTY_VALUE.equals(value)) {
            // "is empty" compares with equality, "is" only accepts NULL
            FilterOperator effective = operator == FilterOperator.IS ? FilterOperator.EQ : operator;
            return Comparison.of(path.operand(), effective, "");
        }
        if (operator == FilterOperator.IS) {
            throw new ApplicationException(ClientError.INVALID_IS_OPERATOR_VALUE);
        }
        return Comparison.of(path.operand(), FilterOperator.NE, value);
    }

    @Value
    public static class BuiltFilter {
        Predicate predicate;
        List<Include> joins;
    }
}
