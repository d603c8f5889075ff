package com.itemhub.backend.security.jwt;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.time.Instant;
import java.util.Date;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import com.itemhub.backend.infra.TestClockConfig.MutableClock;
import com.itemhub.backend.security.jwt.TokenDecodeResult.Failure;

import io.jsonwebtoken.Jwts;
import io.jsonwebtoken.SignatureAlgorithm;
import io.jsonwebtoken.security.Keys;

@DisplayName("[Security][JWT] HmacTokenCodec")
class HmacTokenCodecTest {

    private static final String SECRET = "hmac-unit-test-secret-0123456789-abcdefghijklmnopqrstuvwxyz-WXYZ"; // 64 bytes

    private final MutableClock clock = MutableClock.startingAtTestStart();
    private final HmacTokenCodec codec = new HmacTokenCodec(JwtAlgorithm.HS256, SECRET, clock);

    private TokenClaims accessClaims(Duration ttl) {
        return new TokenClaims("42", clock.instant().plus(ttl), TokenKind.ACCESS);
    }

    @Test
    @DisplayName("encode → decode: 같은 claims 복원")
    void round_trip() {
        TokenClaims claims = accessClaims(Duration.ofMinutes(30));

        TokenDecodeResult result = codec.decode(codec.encode(claims));

        assertThat(result.isValid()).isTrue();
        assertThat(result.claims()).isEqualTo(claims);
    }

    @Test
    @DisplayName("exp 밀리초는 초 단위로 잘려도 round trip 유지")
    void round_trip_with_sub_second_expiry() {
        TokenClaims claims = new TokenClaims("42", clock.instant().plusMillis(90_500), TokenKind.REFRESH);

        assertThat(claims.expiresAt()).isEqualTo(clock.instant().plusSeconds(90));
        assertThat(codec.decode(codec.encode(claims)).claims()).isEqualTo(claims);
    }

    @Test
    @DisplayName("만료 경계: exp 1초 전은 유효, now == exp 부터 EXPIRED")
    void expiry_boundary_is_inclusive() {
        String token = codec.encode(accessClaims(Duration.ofMinutes(30)));

        clock.advance(Duration.ofMinutes(30).minusSeconds(1));
        assertThat(codec.decode(token).isValid()).isTrue();

        clock.advance(Duration.ofSeconds(1));
        assertThat(codec.decode(token).failure()).isEqualTo(Failure.EXPIRED);

        clock.advance(Duration.ofHours(1));
        assertThat(codec.decode(token).failure()).isEqualTo(Failure.EXPIRED);
    }

    @Test
    @DisplayName("서명 변조 → BAD_SIGNATURE")
    void tampered_signature() {
        String token = codec.encode(accessClaims(Duration.ofMinutes(5)));

        assertThat(codec.decode(JwtTestTokens.tamperSignature(token)).failure()).isEqualTo(Failure.BAD_SIGNATURE);
    }

    @Test
    @DisplayName("payload 변조(sub 변경) → BAD_SIGNATURE")
    void tampered_payload() {
        long exp = clock.instant().plusSeconds(300).getEpochSecond();
        String token = codec.encode(accessClaims(Duration.ofMinutes(5)));
        String forged = JwtTestTokens.replacePayload(token, "{\"sub\":\"1\",\"exp\":" + exp + ",\"type\":\"access\"}");

        assertThat(codec.decode(forged).failure()).isEqualTo(Failure.BAD_SIGNATURE);
    }

    @Test
    @DisplayName("다른 비밀키로 서명된 토큰 → BAD_SIGNATURE")
    void different_secret() {
        HmacTokenCodec other = new HmacTokenCodec(JwtAlgorithm.HS256, SECRET.replace('a', 'b'), clock);
        String token = other.encode(accessClaims(Duration.ofMinutes(5)));

        assertThat(codec.decode(token).failure()).isEqualTo(Failure.BAD_SIGNATURE);
    }

    @Test
    @DisplayName("같은 비밀키라도 알고리즘이 다르면 → BAD_SIGNATURE")
    void algorithm_mismatch() {
        HmacTokenCodec hs512 = new HmacTokenCodec(JwtAlgorithm.HS512, SECRET, clock);
        String token = hs512.encode(accessClaims(Duration.ofMinutes(5)));

        assertThat(codec.decode(token).failure()).isEqualTo(Failure.BAD_SIGNATURE);
    }

    @Test
    @DisplayName("null / 공백 / JWT 아님 → MALFORMED")
    void malformed_inputs() {
        assertThat(codec.decode(null).failure()).isEqualTo(Failure.MALFORMED);
        assertThat(codec.decode("  ").failure()).isEqualTo(Failure.MALFORMED);
        assertThat(codec.decode("not-a-jwt").failure()).isEqualTo(Failure.MALFORMED);
        assertThat(codec.decode("a.b.c").failure()).isEqualTo(Failure.MALFORMED);
    }

    @Test
    @DisplayName("type 클레임이 없거나 모르는 값 → MALFORMED")
    void unknown_type_claim() {
        Date exp = Date.from(clock.instant().plusSeconds(300));
        var key = Keys.hmacShaKeyFor(SECRET.getBytes(StandardCharsets.UTF_8));

        String noType = Jwts.builder().setSubject("42").setExpiration(exp)
                .signWith(key, SignatureAlgorithm.HS256).compact();
        String badType = Jwts.builder().setSubject("42").setExpiration(exp).claim("type", "id")
                .signWith(key, SignatureAlgorithm.HS256).compact();

        assertThat(codec.decode(noType).failure()).isEqualTo(Failure.MALFORMED);
        assertThat(codec.decode(badType).failure()).isEqualTo(Failure.MALFORMED);
    }

    @Test
    @DisplayName("exp 없는 토큰 → MALFORMED")
    void missing_exp() {
        var key = Keys.hmacShaKeyFor(SECRET.getBytes(StandardCharsets.UTF_8));
        String token = Jwts.builder().setSubject("42").claim("type", "access")
                .signWith(key, SignatureAlgorithm.HS256).compact();

        assertThat(codec.decode(token).failure()).isEqualTo(Failure.MALFORMED);
    }

    @Test
    @DisplayName("비밀키가 비었거나 알고리즘 최소 길이보다 짧으면 생성 실패")
    void rejects_weak_or_missing_secret() {
        assertThatThrownBy(() -> new HmacTokenCodec(JwtAlgorithm.HS256, "", clock))
                .isInstanceOf(IllegalStateException.class);
        assertThatThrownBy(() -> new HmacTokenCodec(JwtAlgorithm.HS256, "too-short", clock))
                .isInstanceOf(IllegalStateException.class);
        // 64바이트 미만이면 HS512 불가
        assertThatThrownBy(() -> new HmacTokenCodec(JwtAlgorithm.HS512, SECRET.substring(0, 40), clock))
                .isInstanceOf(IllegalStateException.class);
        assertThatThrownBy(() -> new HmacTokenCodec(JwtAlgorithm.RS256, SECRET, clock))
                .isInstanceOf(IllegalStateException.class);
    }

    @Test
    @DisplayName("TokenClaims: sub가 양의 정수일 때만 userId로 해석")
    void subject_as_user_id() {
        Instant exp = clock.instant().plusSeconds(60);

        assertThat(new TokenClaims("42", exp, TokenKind.ACCESS).subjectAsUserId()).contains(42L);
        assertThat(new TokenClaims("abc", exp, TokenKind.ACCESS).subjectAsUserId()).isEmpty();
        assertThat(new TokenClaims("0", exp, TokenKind.ACCESS).subjectAsUserId()).isEmpty();
        assertThat(new TokenClaims("-3", exp, TokenKind.ACCESS).subjectAsUserId()).isEmpty();
    }
}
