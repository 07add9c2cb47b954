package com.dealhunt.aggregator.search.model;

import java.util.List;

public record SearchResponse(List<ProductResult> results, PaginationState paginationState) {

    public SearchResponse {
        results = results == null ? List.of() : List.copyOf(results);
        paginationState = paginationState == null ? PaginationState.neutral() : paginationState;
    }

    public static SearchResponse empty() {
        return new SearchResponse(List.of(), PaginationState.neutral());
    }

    public static SearchResponse of(List<ProductResult> results) {
        return new SearchResponse(results, PaginationState.neutral());
    }

    public static SearchResponse failed(PaginationState paginationState) {
        return new SearchResponse(List.of(), paginationState);
    }
}
