package com.itemhub.backend.security.jwt;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;

import org.springframework.stereotype.Service;

import com.itemhub.backend.auth.config.AuthProperties;

import lombok.RequiredArgsConstructor;

/**
 * Access / Refresh 토큰 발급기
 *
 * - 클레임(sub/exp/type)과 만료 정책만 결정하고, 서명은 TokenCodec에 위임한다.
 * - 서버에 아무것도 저장하지 않는다. (Stateless)
 *
 * 만료 정책:
 * - access: now + (ttlOverride 또는 access-ttl-minutes)
 * - refresh: now + refresh-ttl-days
 */
@Service
@RequiredArgsConstructor
public class TokenIssuer {

    private final TokenCodec tokenCodec;
    private final AuthProperties props;
    private final Clock clock;

    public String issueAccess(Long subjectId) {
        return issueAccess(subjectId, null);
    }

    /** ttlOverride가 null이면 기본 TTL을 쓴다. */
    public String issueAccess(Long subjectId, Duration ttlOverride) {
        if (ttlOverride != null && (ttlOverride.isZero() || ttlOverride.isNegative())) {
            throw new IllegalArgumentException("ttlOverride must be positive");
        }

        Duration ttl = ttlOverride != null
                ? ttlOverride
                : Duration.ofMinutes(props.jwt().accessTtlMinutes());

        return issue(subjectId, TokenKind.ACCESS, ttl);
    }

    public String issueRefresh(Long subjectId) {
        return issue(subjectId, TokenKind.REFRESH, Duration.ofDays(props.jwt().refreshTtlDays()));
    }

    public TokenPair issuePair(Long subjectId) {
        return new TokenPair(issueAccess(subjectId), issueRefresh(subjectId));
    }

    private String issue(Long subjectId, TokenKind kind, Duration ttl) {
        if (subjectId == null) throw new IllegalArgumentException("subjectId must not be null");

        Instant exp = clock.instant().plus(ttl);
        return tokenCodec.encode(new TokenClaims(String.valueOf(subjectId), exp, kind));
    }
}
