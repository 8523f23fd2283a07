package com.herzen.lms.common;

import java.util.List;

public record PageResult<T>(List<T> data, long totalElements, int offset, int limit) {
    public static <T> PageResult<T> of(List<T> data, long totalElements, Pagination pagination) {
        return new PageResult<>(data, totalElements, pagination.skip(), pagination.limit());
    }
}
