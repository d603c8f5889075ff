package com.itemhub.backend.security.jwt;

/**
 * 클레임 <-> 서명된 토큰 문자열 변환기.
 *
 * 구현체는 시작 시점에 설정(app.auth.jwt.algorithm)으로 하나만 골라 Bean으로 등록한다.
 * - HmacTokenCodec: 하나의 공유 비밀키로 서명/검증 (단일 서비스)
 * - RsaTokenCodec: 개인키 서명, 공개키 검증 (검증자가 다른 신뢰 영역에 있을 때)
 */
public interface TokenCodec {

    String encode(TokenClaims claims);

    /** 서명/구조/만료 검증. 실패해도 예외를 던지지 않고 invalid 결과를 돌려준다. */
    TokenDecodeResult decode(String token);
}
