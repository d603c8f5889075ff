package com.itemhub.backend.security.password;

import java.nio.charset.StandardCharsets;

import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.stereotype.Component;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * 비밀번호 해시/검증
 *
 * - 실제 알고리즘은 PasswordEncoder Bean(BCrypt)에 위임한다.
 *   BCrypt는 해시마다 새 salt를 넣으므로 같은 평문이라도 결과가 매번 다르다.
 * - verify는 절대 예외를 던지지 않는다. (이상한 digest도 그냥 false)
 * - BCrypt는 UTF-8 기준 72바이트까지만 본다. 입력 DTO가 fitsBcryptLimit로 먼저 거른다.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class PasswordHasher {

    public static final int MAX_PASSWORD_BYTES = 72;

    private final PasswordEncoder passwordEncoder;

    /** null은 true (필수 여부는 @NotBlank 쪽 책임) */
    public static boolean fitsBcryptLimit(String plaintext) {
        return plaintext == null || plaintext.getBytes(StandardCharsets.UTF_8).length <= MAX_PASSWORD_BYTES;
    }

    public String hash(String plaintext) {
        if (plaintext == null || plaintext.isBlank()) {
            throw new IllegalArgumentException("plaintext must not be blank");
        }
        return passwordEncoder.encode(plaintext);
    }

    public boolean verify(String plaintext, String digest) {
        if (plaintext == null || digest == null || digest.isBlank()) return false;

        try {
            return passwordEncoder.matches(plaintext, digest);
        } catch (IllegalArgumentException e) {
            log.debug("password digest rejected: {}", e.getMessage());
            return false;
        }
    }
}
