package com.itemhub.backend.security.jwt;

import java.nio.charset.StandardCharsets;
import java.time.Clock;

import javax.crypto.SecretKey;

import io.jsonwebtoken.security.Keys;

/**
 * 대칭키(HS256/HS384/HS512) TokenCodec.
 * - 서명자와 검증자가 같은 프로세스인 단일 서비스 배포용.
 * - 비밀키는 알고리즘 최소 길이 이상이어야 한다. (부족하면 부팅 실패)
 */
public class HmacTokenCodec extends JjwtTokenCodec {

    public HmacTokenCodec(JwtAlgorithm algorithm, String secret, Clock clock) {
        this(algorithm, buildHmacKey(algorithm, secret), clock);
    }

    private HmacTokenCodec(JwtAlgorithm algorithm, SecretKey key, Clock clock) {
        super(algorithm, key, key, clock);
    }

    private static SecretKey buildHmacKey(JwtAlgorithm algorithm, String secret) {
        if (algorithm == null || !algorithm.isSymmetric()) {
            throw new IllegalStateException("HmacTokenCodec requires an HS* algorithm, got " + algorithm);
        }
        if (secret == null || secret.isBlank()) {
            throw new IllegalStateException("JWT secret must not be blank");
        }

        byte[] bytes = secret.getBytes(StandardCharsets.UTF_8);
        if (bytes.length < algorithm.minSecretBytes()) {
            throw new IllegalStateException(
                    "JWT secret must be at least " + algorithm.minSecretBytes() + " bytes for " + algorithm);
        }

        return Keys.hmacShaKeyFor(bytes);
    }
}
