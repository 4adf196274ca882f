package io.github.crudgraph.service;

import lombok.Value;

import java.util.List;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * One page of items plus the total number of matches across all pages.
 */
@Value
public class ListResult<T> {

    List<T> items;
    long totalCount;
    int page;
    int pageSize;

    public <R> ListResult<R> map(Function<T, R> mapper) {
        return new ListResult<>(items.stream().map(mapper).collect(Collectors.toList()), totalCount, page, pageSize);
    }
}
