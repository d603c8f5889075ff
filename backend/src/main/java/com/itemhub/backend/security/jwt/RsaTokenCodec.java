package com.itemhub.backend.security.jwt;

import java.security.PrivateKey;
import java.security.PublicKey;
import java.time.Clock;

/**
 * 비대칭키(RS256/RS384/RS512) TokenCodec.
 * - 개인키로 서명, 공개키로 검증한다.
 * - 검증만 하는 서비스는 개인키 없이(null) 만들 수 있다. 이때 encode()는 IllegalStateException.
 */
public class RsaTokenCodec extends JjwtTokenCodec {

    public RsaTokenCodec(JwtAlgorithm algorithm, PrivateKey privateKeyOrNull, PublicKey publicKey, Clock clock) {
        super(requireAsymmetric(algorithm), privateKeyOrNull, publicKey, clock);
    }

    /** PEM 문자열로 생성. privateKeyPem이 비어있으면 검증 전용. */
    public static RsaTokenCodec fromPem(JwtAlgorithm algorithm, String privateKeyPem, String publicKeyPem, Clock clock) {
        if (publicKeyPem == null || publicKeyPem.isBlank()) {
            throw new IllegalStateException("RSA public key must not be blank for " + algorithm);
        }
        PrivateKey privateKey = (privateKeyPem == null || privateKeyPem.isBlank())
                ? null
                : RsaPemKeys.parsePrivateKey(privateKeyPem);

        return new RsaTokenCodec(algorithm, privateKey, RsaPemKeys.parsePublicKey(publicKeyPem), clock);
    }

    private static JwtAlgorithm requireAsymmetric(JwtAlgorithm algorithm) {
        if (algorithm == null || algorithm.isSymmetric()) {
            throw new IllegalStateException("RsaTokenCodec requires an RS* algorithm, got " + algorithm);
        }
        return algorithm;
    }
}
