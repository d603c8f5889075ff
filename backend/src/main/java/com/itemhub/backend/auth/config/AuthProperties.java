package com.itemhub.backend.auth.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import com.itemhub.backend.security.jwt.JwtAlgorithm;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;

/*
  @ConfigurationProperties(prefix = "app.auth"):
  application.yml의 app.auth.* 값을 타입 안정성 있게 바인딩해준다.

  app:
    auth:
      jwt:
        algorithm: HS256
        access-ttl-minutes: 30
        refresh-ttl-days: 7
        secret: ${APP_AUTH_JWT_SECRET:}
        rsa:
          private-key: ${APP_AUTH_JWT_RSA_PRIVATE_KEY:}
          public-key: ${APP_AUTH_JWT_RSA_PUBLIC_KEY:}

  부팅 시 한 번 바인딩되고 이후 읽기 전용이다.
 */
@Validated
@ConfigurationProperties(prefix = "app.auth")
public record AuthProperties(@Valid @NotNull Jwt jwt) {

    /**
     * JWT 관련 설정
     * - algorithm: HS* 이면 secret, RS* 이면 rsa 키를 사용
     * - accessTtlMinutes: Access Token 기본 수명(분)
     * - refreshTtlDays: Refresh Token 수명(일)
     * - secret: HMAC 서명용 공유 비밀키 (길이 검증은 HmacTokenCodec에서 알고리즘별로 한다)
     */
    public record Jwt(
            @NotNull JwtAlgorithm algorithm,
            @Min(1) long accessTtlMinutes,
            @Min(1) long refreshTtlDays,
            String secret,
            @Valid Rsa rsa
    ) {}

    /**
     * RSA PEM 키
     * - privateKey가 비어있으면 검증 전용 모드
     */
    public record Rsa(String privateKey, String publicKey) {}
}
