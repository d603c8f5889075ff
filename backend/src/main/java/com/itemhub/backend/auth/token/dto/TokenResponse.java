package com.itemhub.backend.auth.token.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.itemhub.backend.security.jwt.TokenPair;

/**
 * 로그인/재발급 응답: {"access_token", "refresh_token", "token_type": "bearer"}
 */
public record TokenResponse(
        @JsonProperty("access_token") String accessToken,
        @JsonProperty("refresh_token") String refreshToken,
        @JsonProperty("token_type") String tokenType
) {
    public static final String BEARER = "bearer";

    public static TokenResponse from(TokenPair pair) {
        return new TokenResponse(pair.accessToken(), pair.refreshToken(), BEARER);
    }
}
