package io.github.crudgraph.core.query;

import lombok.Value;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;

@Value
public class Junction implements Predicate {

    public enum Type {
        AND,
        OR
    }

    Type type;
    List<Predicate> predicates;

    public static Junction or(List<? extends Predicate> predicates) {
        return new Junction(Type.OR, List.copyOf(predicates));
    }

    /**
     * ANDs the non-null predicates: nothing yields {@code null}, a single predicate is returned as is.
     */
    public static Predicate and(Predicate... predicates) {
        return and(Arrays.asList(predicates));
    }

    public static Predicate and(List<? extends Predicate> predicates) {
        List<Predicate> present = new ArrayList<>();
        predicates.stream().filter(Objects::nonNull).forEach(present::add);
        if (present.isEmpty()) {
            return null;
        }
        if (present.size() == 1) {
            return present.get(0);
        }
        return new Junction(Type.AND, List.copyOf(present));
    }
}
