package io.github.crudgraph.core.query;

import lombok.Value;

import java.util.List;

/**
 * Ordered distinct primary keys of one page plus the total number of distinct matches.
 */
@Value
public class KeyPage {
    List<Object> keys;
    long totalCount;
}
