package io.github.crudgraph.core.util;

import java.math.BigDecimal;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Helpers for the nested {@code Map<String, Object>} payloads exchanged with clients.
 */
public final class MapPaths {

    private MapPaths() {}

    /**
     * Value at a dotted path, {@code null} when any segment is missing or not a map.
     */
    public static Object get(Map<String, ?> source, String path) {
        if (source == null || path == null) {
            return null;
        }
        Object current = source;
        for (String segment : path.split("\\.")) {
            if (!(current instanceof Map)) {
                return null;
            }
            current = ((Map<?, ?>) current).get(segment);
        }
        return current;
    }

    public static boolean has(Map<String, ?> source, String path) {
        if (source == null || path == null) {
            return false;
        }
        Object current = source;
        for (String segment : path.split("\\.")) {
            if (!(current instanceof Map) || !((Map<?, ?>) current).containsKey(segment)) {
                return false;
            }
            current = ((Map<?, ?>) current).get(segment);
        }
        return true;
    }

    /**
     * Deep merge of {@code patch} into a copy of {@code base}. Nested maps merge, lists and scalars replace.
     */
    @SuppressWarnings("unchecked")
    public static Map<String, Object> merge(Map<String, ?> base, Map<String, ?> patch) {
        Map<String, Object> merged = new LinkedHashMap<>(base);
        patch.forEach((key, value) -> {
            Object existing = merged.get(key);
            if (existing instanceof Map && value instanceof Map) {
                merged.put(key, merge((Map<String, ?>) existing, (Map<String, ?>) value));
            } else {
                merged.put(key, value);
            }
        });
        return merged;
    }

    /**
     * Structural equality tolerant of numeric type differences ({@code 1} equals {@code 1L}).
     */
    public static boolean deepEquals(Object left, Object right) {
        if (left instanceof Number && right instanceof Number) {
            return new BigDecimal(left.toString()).compareTo(new BigDecimal(right.toString())) == 0;
        }
        if (left instanceof Map && right instanceof Map) {
            Map<?, ?> l = (Map<?, ?>) left;
            Map<?, ?> r = (Map<?, ?>) right;
            if (!l.keySet().equals(r.keySet())) {
                return false;
            }
            return l.keySet().stream().allMatch(key -> deepEquals(l.get(key), r.get(key)));
        }
        if (left instanceof Collection && right instanceof Collection) {
            Object[] l = ((Collection<?>) left).toArray();
            Object[] r = ((Collection<?>) right).toArray();
            if (l.length != r.length) {
                return false;
            }
            for (int i = 0; i < l.length; i++) {
                if (!deepEquals(l[i], r[i])) {
                    return false;
                }
            }
            return true;
        }
        return Objects.equals(left, right);
    }
}
