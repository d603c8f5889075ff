package com.itemhub.backend.auth.config;

import java.time.Clock;

import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.security.crypto.bcrypt.BCryptPasswordEncoder;
import org.springframework.security.crypto.password.PasswordEncoder;

import com.itemhub.backend.auth.config.AuthProperties.Jwt;
import com.itemhub.backend.security.jwt.HmacTokenCodec;
import com.itemhub.backend.security.jwt.RsaTokenCodec;
import com.itemhub.backend.security.jwt.TokenCodec;

import lombok.extern.slf4j.Slf4j;

/**
 * 인증 모듈 설정
 *
 * @EnableConfigurationProperties
 *  - AuthProperties를 스프링이 바인딩 + 검증하도록 활성화
 *
 * 여기서 만드는 Bean은 전부 부팅 시 한 번 만들어지고 이후 불변이다.
 * (서명 키, TTL, Clock, PasswordEncoder)
 */
@Slf4j
@Configuration
@EnableConfigurationProperties(AuthProperties.class)
public class AuthModuleConfig {

    /**
     * 토큰 만료 판단은 UTC 기준.
     * - 테스트 환경에서는 TestClockConfig가 별도의 Clock을 제공한다.
     */
    @Bean
    @ConditionalOnMissingBean(Clock.class)
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public PasswordEncoder passwordEncoder() {
        return new BCryptPasswordEncoder();
    }

    /**
     * 서명 전략은 설정(app.auth.jwt.algorithm)으로 부팅 시 한 번만 고른다.
     * - 키가 없거나 짧으면 IllegalStateException으로 부팅 실패 (Fail-fast)
     */
    @Bean
    public TokenCodec tokenCodec(AuthProperties props, Clock clock) {
        Jwt jwt = props.jwt();

        if (jwt.algorithm().isSymmetric()) {
            log.info("JWT codec: symmetric {}", jwt.algorithm());
            return new HmacTokenCodec(jwt.algorithm(), jwt.secret(), clock);
        }

        if (jwt.rsa() == null) {
            throw new IllegalStateException("app.auth.jwt.rsa must be configured for " + jwt.algorithm());
        }
        log.info("JWT codec: asymmetric {}", jwt.algorithm());
        return RsaTokenCodec.fromPem(jwt.algorithm(), jwt.rsa().privateKey(), jwt.rsa().publicKey(), clock);
    }
}
