package com.itemhub.backend.security.jwt;

import java.security.Key;
import java.time.Clock;
import java.time.Instant;
import java.util.Date;

import io.jsonwebtoken.Claims;
import io.jsonwebtoken.ExpiredJwtException;
import io.jsonwebtoken.Jws;
import io.jsonwebtoken.JwtException;
import io.jsonwebtoken.JwtParser;
import io.jsonwebtoken.Jwts;
import io.jsonwebtoken.UnsupportedJwtException;
import io.jsonwebtoken.security.SecurityException;
import lombok.extern.slf4j.Slf4j;

/**
 * jjwt 기반 TokenCodec 공통 구현.
 * - 하위 클래스는 "어떤 키로 서명/검증하는지"만 결정한다. (HMAC 공유키 / RSA 키쌍)
 *
 * JWT 구조: header.payload.signature
 * - payload: {"sub": "<userId>", "exp": <unix seconds>, "type": "access" | "refresh"}
 */
@Slf4j
abstract class JjwtTokenCodec implements TokenCodec {

    static final String TYPE_CLAIM = "type";

    private final JwtAlgorithm algorithm;
    private final Key signingKey; // null이면 검증 전용
    private final JwtParser parser;
    private final Clock clock;

    JjwtTokenCodec(JwtAlgorithm algorithm, Key signingKey, Key verificationKey, Clock clock) {
        if (algorithm == null) throw new IllegalStateException("JWT algorithm must not be null");
        if (verificationKey == null) throw new IllegalStateException("JWT verification key must not be null");
        if (clock == null) throw new IllegalStateException("clock must not be null");

        this.algorithm = algorithm;
        this.signingKey = signingKey;
        this.clock = clock;

        // 허용 오차(leeway) 없음. jjwt는 Date 기반 clock을 쓰므로 여기서 bridge
        this.parser = Jwts.parserBuilder()
                .setSigningKey(verificationKey)
                .setClock(() -> Date.from(clock.instant()))
                .build();
    }

    @Override
    public String encode(TokenClaims claims) {
        if (claims == null) throw new IllegalArgumentException("claims must not be null");
        if (signingKey == null) {
            throw new IllegalStateException("signing key is not configured (" + algorithm + " verify-only codec)");
        }

        return Jwts.builder()
                .setSubject(claims.subject())                       // sub
                .setExpiration(Date.from(claims.expiresAt()))       // exp
                .claim(TYPE_CLAIM, claims.kind().claimValue())      // type: "access"
                .signWith(signingKey, algorithm.signatureAlgorithm())
                .compact();
    }

    @Override
    public TokenDecodeResult decode(String token) {
        if (token == null || token.isBlank()) {
            return TokenDecodeResult.invalid(TokenDecodeResult.Failure.MALFORMED);
        }

        try {
            // 서명/만료/포맷 검증 (하나라도 실패하면 JwtException)
            Jws<Claims> jws = parser.parseClaimsJws(token);

            // 같은 키로 다른 HS* 알고리즘이 서명한 토큰도 거절한다.
            if (!algorithm.name().equals(jws.getHeader().getAlgorithm())) {
                return reject(TokenDecodeResult.Failure.BAD_SIGNATURE, "alg mismatch: " + jws.getHeader().getAlgorithm());
            }

            TokenClaims claims = toTokenClaims(jws.getBody());

            // jjwt는 now > exp 일 때만 만료로 본다. now == exp 경계도 만료로 처리한다.
            Instant now = clock.instant();
            if (claims.isExpiredAt(now)) {
                return reject(TokenDecodeResult.Failure.EXPIRED, "expired at boundary");
            }
            return TokenDecodeResult.valid(claims);
        } catch (ExpiredJwtException e) {
            return reject(TokenDecodeResult.Failure.EXPIRED, e.getMessage());
        } catch (SecurityException | UnsupportedJwtException e) {
            // 다른 키 / 변조된 서명 / 키 종류와 맞지 않는 alg / 서명 없는 토큰
            return reject(TokenDecodeResult.Failure.BAD_SIGNATURE, e.getMessage());
        } catch (JwtException | IllegalArgumentException e) {
            return reject(TokenDecodeResult.Failure.MALFORMED, e.getMessage());
        }
    }

    private static TokenClaims toTokenClaims(Claims body) {
        String subject = body.getSubject();
        Date exp = body.getExpiration();
        String rawKind = body.get(TYPE_CLAIM, String.class);

        if (exp == null) {
            throw new JwtException("exp claim is missing");
        }
        TokenKind kind = TokenKind.fromClaim(rawKind)
                .orElseThrow(() -> new JwtException("type claim invalid: " + rawKind));

        return new TokenClaims(subject, exp.toInstant(), kind);
    }

    private static TokenDecodeResult reject(TokenDecodeResult.Failure failure, String detail) {
        log.debug("token rejected: failure={}, detail={}", failure, detail);
        return TokenDecodeResult.invalid(failure);
    }
}
