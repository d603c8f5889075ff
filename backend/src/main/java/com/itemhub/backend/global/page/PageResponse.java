package com.itemhub.backend.global.page;

import java.util.List;
import java.util.function.Function;

/**
 * skip/limit 기반 목록 응답.
 * - total: 조건에 맞는 전체 개수 (클라이언트가 다음 페이지 여부를 계산)
 */
public record PageResponse<T>(
        List<T> items,
        long total,
        int skip,
        int limit
) {
    public static <E, T> PageResponse<T> of(List<E> entities, long total, int skip, int limit, Function<E, T> mapper) {
        return new PageResponse<>(entities.stream().map(mapper).toList(), total, skip, limit);
    }
}
