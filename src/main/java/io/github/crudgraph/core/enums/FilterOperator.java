package io.github.crudgraph.core.enums;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

import java.util.Arrays;
import java.util.Map;
import java.util.Optional;

/**
 * Comparison operators accepted in {@code filter} parameters.
 * User facing aliases ({@code ge}, {@code le}, {@code ct}, {@code isNot}) map onto the canonical tokens.
 */
@Getter
@RequiredArgsConstructor
public enum FilterOperator {
    EQ("eq"),
    LIKE("like"),
    GT("gt"),
    GTE("gte"),
    LT("lt"),
    LTE("lte"),
    NE("ne"),
    IN("in"),
    NOT_IN("notIn"),
    IS("is"),
    NOT("not");

    private static final Map<String, String> ALIASES = Map.of(
            "ge", "gte",
            "le", "lte",
            "ct", "like",
            "isNot", "not"
    );

    private final String token;

    public static Optional<FilterOperator> fromToken(String token) {
        if (token == null) {
            return Optional.empty();
        }
        String canonical = ALIASES.getOrDefault(token, token);
        return Arrays.stream(values())
                .filter(operator -> operator.token.equals(canonical))
                .findFirst();
    }
}
