package com.listing.reconciliation.api;

import java.util.List;

/**
 * One page of an ordered read.
 *
 * @param content       the elements on this page
 * @param totalElements number of elements across all pages
 * @param pageNumber    0-based page number
 * @param pageSize      requested page size
 * @param <T>           element type
 */
public record Page<T>(List<T> content, long totalElements, int pageNumber, int pageSize) {

    public Page {
        content = content != null ? List.copyOf(content) : List.of();
        if (totalElements < 0) {
            throw new IllegalArgumentException("totalElements must be >= 0");
        }
    }

    public boolean hasNext() {
        return (long) (pageNumber + 1) * pageSize < totalElements;
    }

    public int totalPages() {
        return pageSize == 0 ? 0 : (int) Math.ceil((double) totalElements / pageSize);
    }

    /**
     * Slices an already ordered list according to {@code request}.
     */
    public static <T> Page<T> slice(List<T> ordered, PageRequest request) {
        int total = ordered.size();
        int from = Math.min(request.offset(), total);
        int to = (int) Math.min((long) request.offset() + request.limit(), total);
        return new Page<>(ordered.subList(from, to), total, request.pageNumber(), request.limit());
    }
}
