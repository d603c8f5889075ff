package com.itemhub.backend.user.support;

import java.util.Locale;

/**
 * 이메일 정규화: trim + 소문자.
 * - 저장/조회 모두 같은 규칙을 거쳐야 unique 제약이 의미가 있다.
 */
public final class EmailNormalizer {

    private EmailNormalizer() {}

    public static String normalize(String rawEmail) {
        if (rawEmail == null) return null;
        return rawEmail.trim().toLowerCase(Locale.ROOT);
    }
}
