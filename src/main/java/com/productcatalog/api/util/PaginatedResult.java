package com.productcatalog.api.util;

import java.util.List;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * One page of an index query.
 * Contains both the results for the current page and the continuation token needed to fetch the next page.
 *
 * @param <T> The type of items in the results list
 */
public class PaginatedResult<T> {

    private final List<T> results;
    private final String nextToken;

    public PaginatedResult(List<T> results, String nextToken) {
        this.results = results;
        this.nextToken = nextToken;
    }

    /**
     * @return The list of items for this page
     */
    public List<T> getResults() {
        return results;
    }

    /**
     * @return The opaque token for the next page, or null on the last page
     */
    public String getNextToken() {
        return nextToken;
    }

    /**
     * Same page with every result converted, keeping the continuation token.
     */
    public <R> PaginatedResult<R> map(Function<? super T, ? extends R> mapper) {
        List<R> mapped = results == null ? List.of() : results.stream()
            .map(mapper)
            .collect(Collectors.toList());
        return new PaginatedResult<>(mapped, nextToken);
    }
}
