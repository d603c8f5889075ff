package com.itemhub.backend;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.autoconfigure.security.servlet.UserDetailsServiceAutoConfiguration;
import org.springframework.context.annotation.Import;

import com.itemhub.backend.auth.config.AuthModuleConfig;

/*
================================================================================
[curl 시나리오] (가입 -> 로그인 -> me -> refresh -> items)
================================================================================
# 가입 201
curl -i -X POST "http://localhost:8080/api/v1/auth/register" \
  -H "Content-Type: application/json" \
  -d '{"email":"anna@example.com","password":"s3cret-pass","full_name":"Anna"}'

# 로그인 200 -> {"access_token","refresh_token","token_type":"bearer"}
curl -s -X POST "http://localhost:8080/api/v1/auth/login" \
  -H "Content-Type: application/json" \
  -d '{"email":"anna@example.com","password":"s3cret-pass"}'

# 내 정보
curl -i "http://localhost:8080/api/v1/auth/me" -H "Authorization: Bearer <access_token>"

# 재발급 (access + refresh 둘 다 새로)
curl -s -X POST "http://localhost:8080/api/v1/auth/refresh" \
  -H "Content-Type: application/json" \
  -d '{"refresh_token":"<refresh_token>"}'

# 아이템 생성 201
curl -i -X POST "http://localhost:8080/api/v1/items" \
  -H "Authorization: Bearer <access_token>" -H "Content-Type: application/json" \
  -d '{"title":"first","description":"hello"}'
*/

/**
 * Spring Boot 부팅 시작점
 *
 * - com.itemhub.backend 하위 패키지(auth, security, user, item, health, global)를 컴포넌트 스캔한다.
 * - 설정 값 흐름: 환경변수 -> application.yml(${ENV:default}) -> @ConfigurationProperties
 * - JWT만 쓰므로 기본 인메모리 유저 자동설정(UserDetailsServiceAutoConfiguration)은 끈다.
 */
@Import(AuthModuleConfig.class)
@SpringBootApplication(exclude = {UserDetailsServiceAutoConfiguration.class})
public class BackendApplication {
    public static void main(String[] args) {
        SpringApplication.run(BackendApplication.class, args);
    }
}
