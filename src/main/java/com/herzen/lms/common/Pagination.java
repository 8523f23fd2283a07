package com.herzen.lms.common;

import jakarta.validation.constraints.Min;

public record Pagination(@Min(1) Integer page, @Min(0) Integer offset, @Min(1) Integer limit) {
    public static final int DEFAULT_PAGE = 1;
    public static final int DEFAULT_LIMIT = 10;

    public Pagination {
        if (page == null) page = DEFAULT_PAGE;
        if (limit == null) limit = DEFAULT_LIMIT;
    }

    public static Pagination ofOffset(Integer offset, Integer limit) {
        return new Pagination(null, offset, limit);
    }

    /**
     * Rows to skip: the explicit offset when given, otherwise derived from the page.
     */
    public int skip() {
        if (offset != null) return offset;
        return (page - 1) * limit;
    }
}
