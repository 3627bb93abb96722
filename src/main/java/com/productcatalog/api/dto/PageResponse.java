package com.productcatalog.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.productcatalog.api.util.PaginatedResult;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;
import java.util.function.Function;

/**
 * One page of a listing. {@code next_token} is null on the last page.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class PageResponse<T> {

    private List<T> items;

    @JsonProperty("next_token")
    private String nextToken;

    public static <E, T> PageResponse<T> from(PaginatedResult<E> page, Function<? super E, ? extends T> mapper) {
        PaginatedResult<T> mapped = page.map(mapper);
        return new PageResponse<>(mapped.getResults(), mapped.getNextToken());
    }
}
