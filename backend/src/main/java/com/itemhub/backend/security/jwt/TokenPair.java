package com.itemhub.backend.security.jwt;

/**
 * 로그인/재발급 시 함께 내려가는 access + refresh 토큰 쌍.
 */
public record TokenPair(String accessToken, String refreshToken) {

    public TokenPair {
        if (accessToken == null || accessToken.isBlank()) throw new IllegalArgumentException("accessToken must not be blank");
        if (refreshToken == null || refreshToken.isBlank()) throw new IllegalArgumentException("refreshToken must not be blank");
    }
}
