package com.tpcc.gateway.domain;

import java.util.List;
import java.util.function.Function;

/**
 * One page of a filtered listing.
 *
 * {@code totalCount} comes from the COUNT query run with the same filters.
 * {@code error} is set only when the listing could not be read; the page is
 * then empty with both navigation flags false.
 */
public record Page<T>(
        List<T> items,
        long totalCount,
        int limit,
        int offset,
        boolean hasNext,
        boolean hasPrev,
        String error) {

    public Page {
        items = List.copyOf(items);
    }

    public static <T> Page<T> of(List<T> items, long totalCount, int limit, int offset) {
        return new Page<>(items, totalCount, limit, offset,
            (long) offset + limit < totalCount, offset > 0, null);
    }

    public static <T> Page<T> failed(int limit, int offset, String error) {
        return new Page<>(List.of(), 0, limit, offset, false, false, error);
    }

    public boolean isSuccess() {
        return error == null;
    }

    public <R> Page<R> map(Function<T, R> mapper) {
        return new Page<>(items.stream().map(mapper).toList(),
            totalCount, limit, offset, hasNext, hasPrev, error);
    }
}
