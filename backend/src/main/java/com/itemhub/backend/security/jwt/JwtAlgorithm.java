package com.itemhub.backend.security.jwt;

import io.jsonwebtoken.SignatureAlgorithm;

/**
 * 설정으로 고를 수 있는 서명 알고리즘.
 * - HS*: 대칭키(HMAC) / RS*: 비대칭키(RSA)
 */
public enum JwtAlgorithm {
    HS256(SignatureAlgorithm.HS256),
    HS384(SignatureAlgorithm.HS384),
    HS512(SignatureAlgorithm.HS512),
    RS256(SignatureAlgorithm.RS256),
    RS384(SignatureAlgorithm.RS384),
    RS512(SignatureAlgorithm.RS512);

    private final SignatureAlgorithm signatureAlgorithm;

    JwtAlgorithm(SignatureAlgorithm signatureAlgorithm) {
        this.signatureAlgorithm = signatureAlgorithm;
    }

    public SignatureAlgorithm signatureAlgorithm() {
        return signatureAlgorithm;
    }

    public boolean isSymmetric() {
        return signatureAlgorithm.isHmac();
    }

    /** HMAC 비밀키 최소 바이트 수 (HS256=32, HS384=48, HS512=64) */
    public int minSecretBytes() {
        return signatureAlgorithm.getMinKeyLength() / Byte.SIZE;
    }
}
