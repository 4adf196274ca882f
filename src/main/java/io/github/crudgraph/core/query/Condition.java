package io.github.crudgraph.core.query;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.ArrayList;
import java.util.List;

/**
 * Declarative query: predicate, joins, ordering, projections and paging window.
 */
@Value
@Builder(toBuilder = true)
public class Condition {

    public static final Condition EMPTY = Condition.builder().build();

    Predicate where;

    @Singular
    List<Include> includes;

    @Singular("orderItem")
    List<OrderItem> order;

    @Singular
    List<ProjectedAttribute> attributes;

    @Singular
    List<String> excludedAttributes;

    Integer limit;

    Integer offset;

    /**
     * Includes of all given lists, duplicates removed by structural equality, first occurrence kept.
     */
    public static List<Include> mergeIncludes(List<List<Include>> includeLists) {
        List<Include> merged = new ArrayList<>();
        for (List<Include> includes : includeLists) {
            for (Include include : includes) {
                if (!merged.contains(include)) {
                    merged.add(include);
                }
            }
        }
        return merged;
    }
}
