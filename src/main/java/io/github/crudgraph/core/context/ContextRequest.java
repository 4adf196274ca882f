package io.github.crudgraph.core.context;

import io.github.crudgraph.core.exception.ApplicationException;
import io.github.crudgraph.core.exception.ClientError;
import org.springframework.util.LinkedMultiValueMap;
import org.springframework.util.MultiValueMap;

import java.util.Collections;
import java.util.List;
import java.util.Map;

/**
 * Query-string shaped request parameters consumed by the listing operations.
 */
public class ContextRequest {

    public static final String FILTER = "filter";
    public static final String SORT_BY = "sort_by";
    public static final String SEARCH = "q";
    public static final String PAGE = "page";
    public static final String PAGE_SIZE = "page_size";

    public static final int DEFAULT_PAGE = 1;

    private final MultiValueMap<String, String> params;
    private final int defaultPageSize;
    private final int maximumPageSize;

    public ContextRequest(MultiValueMap<String, String> params, int defaultPageSize, int maximumPageSize) {
        this.params = params != null ? params : new LinkedMultiValueMap<>();
        this.defaultPageSize = defaultPageSize;
        this.maximumPageSize = maximumPageSize;
    }

    public static ContextRequest of(Map<String, List<String>> params) {
        return new ContextRequest(new LinkedMultiValueMap<>(params), 25, 100);
    }

    public boolean has(String name) {
        return params.containsKey(name) && !params.get(name).isEmpty();
    }

    public List<String> getArray(String name) {
        List<String> values = params.get(name);
        return values != null ? values : Collections.emptyList();
    }

    public String getString(String name) {
        return params.getFirst(name);
    }

    public Integer getNumber(String name) {
        String value = getString(name);
        if (value == null || value.isBlank()) {
            return null;
        }
        try {
            return Integer.valueOf(value.trim());
        } catch (NumberFormatException e) {
            throw new ApplicationException(ClientError.VALIDATION_INVALID_PAGE,
                    Map.of("value", value, "parameter", name), e);
        }
    }

    public List<String> getFilters() {
        return getArray(FILTER);
    }

    public String getSortBy() {
        return getString(SORT_BY);
    }

    public String getSearch() {
        return getString(SEARCH);
    }

    public int getPage() {
        Integer page = getNumber(PAGE);
        if (page == null) {
            return DEFAULT_PAGE;
        }
        if (page < 1) {
            throw new ApplicationException(ClientError.VALIDATION_INVALID_PAGE,
                    Map.of("value", page, "parameter", PAGE));
        }
        return page;
    }

    /**
     * Requested page size (absolute value), bounded by the configured maximum.
     */
    public int getPageSize() {
        Integer requested = getNumber(PAGE_SIZE);
        int pageSize = requested == null ? defaultPageSize : Math.abs(requested);
        if (pageSize < 0) {
            throw new ApplicationException(ClientError.VALIDATION_INVALID_PAGE,
                    Map.of("value", requested, "parameter", PAGE_SIZE));
        }
        if (pageSize > maximumPageSize) {
            throw new ApplicationException(ClientError.VALIDATION_MAXIMUM_PAGE_SIZE,
                    Map.of("pageSize", pageSize, "maximumPageSize", maximumPageSize));
        }
        return pageSize;
    }

    /**
     * Rows skipped before the requested page. A page whose offset does not fit the storage window
     * is rejected rather than wrapped around.
     */
    public int getOffset() {
        int page = getPage();
        long offset = Math.multiplyExact((long) getPageSize(), (long) page - 1);
        if (offset > Integer.MAX_VALUE) {
            throw new ApplicationException(ClientError.VALIDATION_INVALID_PAGE,
                    Map.of("value", page, "parameter", PAGE));
        }
        return (int) offset;
    }
}
