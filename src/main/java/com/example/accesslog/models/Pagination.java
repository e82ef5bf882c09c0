package com.example.accesslog.models;

import java.util.List;

/**
 * Zero-based page selection. A null {@code perPage} returns every row and ignores {@code page}.
 */
public record Pagination(int page, Integer perPage) {

    public Pagination {
        if (page < 0) {
            throw new IllegalArgumentException("page must be >= 0");
        }
        if (perPage != null && perPage <= 0) {
            throw new IllegalArgumentException("perPage must be > 0");
        }
    }

    public static Pagination all() {
        return new Pagination(0, null);
    }

    public static Pagination of(int page, int perPage) {
        return new Pagination(page, perPage);
    }

    public <T> List<T> apply(List<T> rows) {
        if (perPage == null) {
            return rows;
        }
        long from = (long) page * perPage;
        if (from >= rows.size()) {
            return List.of();
        }
        int to = (int) Math.min(rows.size(), from + perPage);
        return rows.subList((int) from, to);
    }
}
