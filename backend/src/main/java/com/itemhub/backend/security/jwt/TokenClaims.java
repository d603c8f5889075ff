package com.itemhub.backend.security.jwt;

import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.Optional;

/**
 * 토큰에 서명되어 들어가는 클레임 묶음: {sub, exp, type}
 *
 * - exp는 JWT 규격상 초 단위(NumericDate)라서 생성 시점에 초 단위로 잘라둔다.
 *   그래야 decode(encode(c)) == c 가 성립한다.
 */
public record TokenClaims(String subject, Instant expiresAt, TokenKind kind) {

    public TokenClaims {
        if (subject == null || subject.isBlank()) throw new IllegalArgumentException("subject must not be blank");
        if (expiresAt == null) throw new IllegalArgumentException("expiresAt must not be null");
        if (kind == null) throw new IllegalArgumentException("kind must not be null");

        expiresAt = expiresAt.truncatedTo(ChronoUnit.SECONDS);
    }

    public boolean isExpiredAt(Instant now) {
        // 경계 포함: now == exp 이면 이미 만료
        return !now.isBefore(expiresAt);
    }

    /**
     * sub를 사용자 id로 해석한다. 양의 정수(10진수)가 아니면 empty.
     */
    public Optional<Long> subjectAsUserId() {
        try {
            long id = Long.parseLong(subject);
            return id > 0 ? Optional.of(id) : Optional.empty();
        } catch (NumberFormatException e) {
            return Optional.empty();
        }
    }
}
