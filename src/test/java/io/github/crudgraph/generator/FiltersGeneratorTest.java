package io.github.crudgraph.generator;

import io.github.crudgraph.TestEntityGraph;
import io.github.crudgraph.core.context.AuthContext;
import io.github.crudgraph.core.context.ContextRequest;
import io.github.crudgraph.core.enums.FilterOperator;
import io.github.crudgraph.core.exception.ApplicationException;
import io.github.crudgraph.core.exception.ClientError;
import io.github.crudgraph.core.model.EntityGraph;
import io.github.crudgraph.core.query.ColumnRef;
import io.github.crudgraph.core.query.Comparison;
import io.github.crudgraph.core.query.Condition;
import io.github.crudgraph.core.query.Include;
import io.github.crudgraph.core.query.Junction;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class FiltersGeneratorTest {

    private final EntityGraph graph = TestEntityGraph.create();

    private FiltersGenerator generator() {
        return generator(null, null);
    }

    private FiltersGenerator generator(List<String> searchFields, TimestampHierarchy hierarchy) {
        return new FiltersGenerator(graph, graph.entity("product"), Map.of(), searchFields,
                new TimestampsManager(graph, graph.entity("product"), hierarchy));
    }

    private static ClientError errorOf(Throwable thrown) {
        return (ClientError) ((ApplicationException) thrown).getDescriptor();
    }

    @Test
    void buildFilter_equality_comparesRootColumn() {
        FiltersGenerator.BuiltFilter filter = generator().buildFilter("name eq Widget");

        assertThat(filter.getPredicate()).isEqualTo(Comparison.of(ColumnRef.root("name"), FilterOperator.EQ, "Widget"));
        assertThat(filter.getJoins()).isEmpty();
    }

    @Test
    void buildFilter_valueWithSpaces_isKeptWhole() {
        FiltersGenerator.BuiltFilter filter = generator().buildFilter("name eq Blue Widget");

        assertThat(((Comparison) filter.getPredicate()).getValue()).isEqualTo("Blue Widget");
    }

    @Test
    void buildFilter_contains_wrapsValueInWildcards() {
        Comparison comparison = (Comparison) generator().buildFilter("name ct gad").getPredicate();

        assertThat(comparison.getOperator()).isEqualTo(FilterOperator.LIKE);
        assertThat(comparison.getValue()).isEqualTo("%gad%");
    }

    @Test
    void buildFilter_in_splitsCommaSeparatedValues() {
        Comparison comparison = (Comparison) generator().buildFilter("id in 1, 2,3").getPredicate();

        assertThat(comparison.getOperator()).isEqualTo(FilterOperator.IN);
        assertThat(comparison.getValue()).isEqualTo(List.of("1", "2", "3"));
    }

    @Test
    void buildFilter_associationPath_addsOptionalJoin() {
        FiltersGenerator.BuiltFilter filter = generator().buildFilter("contacts.email is null");

        assertThat(filter.getPredicate())
                .isEqualTo(Comparison.of(ColumnRef.of(List.of("contacts"), "email"), FilterOperator.IS, null));
        assertThat(filter.getJoins()).containsExactly(Include.joinOnly(List.of("contacts"), false));
    }

    @Test
    void buildFilter_isEmpty_comparesWithEmptyString() {
        Comparison comparison = (Comparison) generator().buildFilter("name is empty").getPredicate();

        assertThat(comparison.getOperator()).isEqualTo(FilterOperator.EQ);
        assertThat(comparison.getValue()).isEqualTo("");
    }

    @Test
    void buildFilter_isWithValue_isRejected() {
        assertThatThrownBy(() -> generator().buildFilter("name is Widget"))
                .isInstanceOf(ApplicationException.class)
                .satisfies(thrown -> assertThat(errorOf(thrown)).isEqualTo(ClientError.INVALID_IS_OPERATOR_VALUE));
    }

    @Test
    void buildFilter_notWithValue_degradesToNotEqual() {
        Comparison comparison = (Comparison) generator().buildFilter("name not Widget").getPredicate();

        assertThat(comparison.getOperator()).isEqualTo(FilterOperator.NE);
        assertThat(comparison.getValue()).isEqualTo("Widget");
    }

    @Test
    void buildFilter_isNotNull_keepsNullValue() {
        Comparison comparison = (Comparison) generator().buildFilter("name isNot null").getPredicate();

        assertThat(comparison.getOperator()).isEqualTo(FilterOperator.NOT);
        assertThat(comparison.getValue()).isNull();
    }

    @Test
    void buildFilter_booleanAttribute_parsesValue() {
        Comparison comparison = (Comparison) generator().buildFilter("available eq true").getPredicate();

        assertThat(comparison.getValue()).isEqualTo(Boolean.TRUE);
    }

    @Test
    void buildFilter_booleanAttributeFalse_parsesValue() {
        Comparison comparison = (Comparison) generator().buildFilter("available ne false").getPredicate();

        assertThat(comparison.getValue()).isEqualTo(Boolean.FALSE);
    }

    @Test
    void buildFilter_booleanAttributeOtherValue_keepsString() {
        Comparison comparison = (Comparison) generator().buildFilter("available eq maybe").getPredicate();

        assertThat(comparison.getValue()).isEqualTo("maybe");
    }

    @ParameterizedTest
    @CsvSource({
            "eq, EQ", "like, LIKE", "ct, LIKE", "gt, GT", "gte, GTE", "ge, GTE", "lt, LT",
            "lte, LTE", "le, LTE", "ne, NE", "in, IN", "notIn, NOT_IN", "not, NE", "isNot, NE"
    })
    void buildFilter_everyOperatorToken_producesComparison(String token, FilterOperator expected) {
        Comparison comparison = (Comparison) generator().buildFilter("name " + token + " x").getPredicate();

        assertThat(comparison.getOperator()).isEqualTo(expected);
    }

    @Test
    void buildFilter_unknownOperator_isRejected() {
        assertThatThrownBy(() -> generator().buildFilter("name approx Widget"))
                .isInstanceOf(ApplicationException.class)
                .hasMessageContaining("approx")
                .satisfies(thrown -> assertThat(errorOf(thrown)).isEqualTo(ClientError.INVALID_FILTER_OPERATOR));
    }

    @Test
    void buildFilter_missingOperator_isRejected() {
        assertThatThrownBy(() -> generator().buildFilter("name"))
                .isInstanceOf(ApplicationException.class)
                .satisfies(thrown -> assertThat(errorOf(thrown)).isEqualTo(ClientError.INVALID_FILTER_PARAMETER));
    }

    @Test
    void buildFilter_unknownField_isRejected() {
        assertThatThrownBy(() -> generator().buildFilter("colour eq red"))
                .isInstanceOf(ApplicationException.class)
                .satisfies(thrown -> assertThat(errorOf(thrown)).isEqualTo(ClientError.INVALID_FILTER_PARAMETER));
    }

    @Test
    void buildFilter_updatedSince_comparesEveryTimestampColumn() {
        FiltersGenerator generator = generator(null,
                TimestampHierarchy.of("product", TimestampHierarchy.of("demand_source")));

        FiltersGenerator.BuiltFilter filter = generator.buildFilter("updated_since gte 2024-03-01T10:00:00Z");

        LocalDateTime since = LocalDateTime.of(2024, 3, 1, 10, 0);
        assertThat(filter.getPredicate()).isEqualTo(Junction.or(List.of(
                Comparison.of(ColumnRef.root("updated_at"), FilterOperator.GTE, since),
                Comparison.of(ColumnRef.of(List.of("demandSource"), "last_change_date"), FilterOperator.GTE, since))));
        assertThat(filter.getJoins()).containsExactly(Include.joinOnly(List.of("demandSource"), false));
    }

    @Test
    void buildFilter_updatedSinceWithBadDate_isRejected() {
        assertThatThrownBy(() -> generator().buildFilter("updated_since gte yesterday"))
                .isInstanceOf(ApplicationException.class)
                .satisfies(thrown -> assertThat(errorOf(thrown)).isEqualTo(ClientError.INVALID_FORMAT_DATE_TIME));
    }

    @Test
    void buildFilter_updatedSinceWithoutTimestamps_isRejected() {
        FiltersGenerator generator = new FiltersGenerator(graph, graph.entity("contact"), Map.of(), null, null);

        assertThatThrownBy(() -> generator.buildFilter("updated_since gte 2024-03-01"))
                .isInstanceOf(ApplicationException.class)
                .satisfies(thrown -> assertThat(errorOf(thrown)).isEqualTo(ClientError.INVALID_UPDATED_SINCE_FIELD));
    }

    @Test
    void generateCondition_withoutRequest_isEmpty() {
        assertThat(generator().generateCondition(AuthContext.anonymous(), null)).isEqualTo(Condition.EMPTY);
    }

    @Test
    void generateCondition_multipleFilters_areAnded() {
        ContextRequest request = ContextRequest.of(Map.of(
                ContextRequest.FILTER, List.of("name eq Widget", "contacts.name ct ann")));

        Condition condition = generator().generateCondition(AuthContext.anonymous(), request);

        assertThat(condition.getWhere()).isInstanceOf(Junction.class);
        assertThat(((Junction) condition.getWhere()).getType()).isEqualTo(Junction.Type.AND);
        assertThat(((Junction) condition.getWhere()).getPredicates()).hasSize(2);
        assertThat(condition.getIncludes()).containsExactly(Include.joinOnly(List.of("contacts"), false));
    }

    @Test
    void generateCondition_search_matchesAnySearchField() {
        ContextRequest request = ContextRequest.of(Map.of(ContextRequest.SEARCH, List.of("acme")));

        Condition condition = generator(List.of("name", "contacts.name"), null)
                .generateCondition(AuthContext.anonymous(), request);

        assertThat(condition.getWhere()).isEqualTo(Junction.or(List.of(
                Comparison.of(ColumnRef.root("name"), FilterOperator.LIKE, "%acme%"),
                Comparison.of(ColumnRef.of(List.of("contacts"), "name"), FilterOperator.LIKE, "%acme%"))));
    }
}
