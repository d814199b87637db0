package com.lumen.model.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * One page of an in-memory listing.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PageResult<T> {

    private List<T> items;
    private int page;
    private int limit;
    private long total;
    private int totalPages;

    /**
     * Slice {@code all} into a 1-based page.
     */
    public static <T> PageResult<T> of(List<T> all, int page, int limit) {
        if (page < 1 || limit < 1) {
            throw new IllegalArgumentException("page and limit must be positive");
        }
        int from = Math.min((page - 1) * limit, all.size());
        int to = Math.min(from + limit, all.size());
        int totalPages = (int) Math.ceil(all.size() / (double) limit);
        return new PageResult<>(List.copyOf(all.subList(from, to)), page, limit, all.size(), totalPages);
    }
}
