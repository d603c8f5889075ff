package com.itemhub.backend.security.jwt;

import java.util.Optional;

/**
 * TokenCodec.decode()의 명시적 결과 타입.
 * - 검증 실패는 예외가 아니라 invalid(failure) 값으로 돌려준다.
 * - 호출자(IdentityResolver/AuthService)가 실패를 어떤 ErrorCode로 뭉갤지 결정한다.
 */
public record TokenDecodeResult(TokenClaims claims, Failure failure) {

    public enum Failure {
        MALFORMED,      // 구조/클레임 형식 오류, 빈 토큰
        BAD_SIGNATURE,  // 서명 불일치, 다른 키/알고리즘
        EXPIRED         // now >= exp
    }

    public static TokenDecodeResult valid(TokenClaims claims) {
        if (claims == null) throw new IllegalArgumentException("claims must not be null");
        return new TokenDecodeResult(claims, null);
    }

    public static TokenDecodeResult invalid(Failure failure) {
        if (failure == null) throw new IllegalArgumentException("failure must not be null");
        return new TokenDecodeResult(null, failure);
    }

    public boolean isValid() {
        return claims != null;
    }

    /** 유효하고 kind까지 일치할 때만 claims를 꺼낸다. */
    public Optional<TokenClaims> claimsOfKind(TokenKind expected) {
        if (!isValid() || claims.kind() != expected) return Optional.empty();
        return Optional.of(claims);
    }
}
