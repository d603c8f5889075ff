package com.itemhub.backend.security.jwt;

import java.util.Arrays;
import java.util.Optional;

/**
 * 토큰 종류 ("type" 클레임).
 * - ACCESS: 보호 리소스 요청용. refresh 엔드포인트에서는 거부된다.
 * - REFRESH: 토큰 재발급용. 리소스 요청(IdentityResolver)에서는 거부된다.
 */
public enum TokenKind {
    ACCESS("access"),
    REFRESH("refresh");

    private final String claimValue;

    TokenKind(String claimValue) {
        this.claimValue = claimValue;
    }

    public String claimValue() {
        return claimValue;
    }

    public static Optional<TokenKind> fromClaim(String raw) {
        if (raw == null) return Optional.empty();
        return Arrays.stream(values())
                .filter(k -> k.claimValue.equals(raw))
                .findFirst();
    }
}
