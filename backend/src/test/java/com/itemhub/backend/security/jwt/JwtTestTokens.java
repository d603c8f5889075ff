package com.itemhub.backend.security.jwt;

import java.util.Base64;

/**
 * 토큰 변조 헬퍼 (테스트 전용)
 */
public final class JwtTestTokens {

    private JwtTestTokens() {}

    /**
     * 서명 세그먼트를 디코드해서 한 바이트를 뒤집고 다시 인코드한다.
     * - base64 마지막 문자만 바꾸면 패딩 비트라서 서명이 그대로일 수 있다.
     */
    public static String tamperSignature(String jwt) {
        int dot = jwt.lastIndexOf('.');
        byte[] sig = Base64.getUrlDecoder().decode(jwt.substring(dot + 1));
        sig[0] ^= 0x01;
        return jwt.substring(0, dot + 1) + Base64.getUrlEncoder().withoutPadding().encodeToString(sig);
    }

    /** payload 세그먼트를 통째로 바꾼다. (서명은 원래 것 그대로) */
    public static String replacePayload(String jwt, String payloadJson) {
        String[] parts = jwt.split("\\.");
        String payload = Base64.getUrlEncoder().withoutPadding().encodeToString(payloadJson.getBytes());
        return parts[0] + "." + payload + "." + parts[2];
    }
}
