package com.itemhub.backend.security.password;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.security.crypto.bcrypt.BCryptPasswordEncoder;

@DisplayName("[Security] PasswordHasher")
class PasswordHasherTest {

    // cost 4: 테스트 속도용 (운영은 기본 10)
    private final PasswordHasher hasher = new PasswordHasher(new BCryptPasswordEncoder(4));

    @Test
    @DisplayName("hash → 원문과 다르고, 같은 평문이라도 매번 다른 digest (salt)")
    void hash_is_salted() {
        String a = hasher.hash("correct horse");
        String b = hasher.hash("correct horse");

        assertThat(a).isNotEqualTo("correct horse");
        assertThat(a).isNotEqualTo(b);
        assertThat(hasher.verify("correct horse", a)).isTrue();
        assertThat(hasher.verify("correct horse", b)).isTrue();
    }

    @Test
    @DisplayName("verify: 틀린 비밀번호 → false")
    void verify_rejects_wrong_password() {
        String digest = hasher.hash("correct horse");

        assertThat(hasher.verify("battery staple", digest)).isFalse();
    }

    @Test
    @DisplayName("verify: null / 빈 digest / BCrypt 형식 아님 → 예외 없이 false")
    void verify_never_throws() {
        assertThat(hasher.verify(null, "$2a$04$abc")).isFalse();
        assertThat(hasher.verify("pw", null)).isFalse();
        assertThat(hasher.verify("pw", " ")).isFalse();
        assertThat(hasher.verify("pw", "not-a-bcrypt-digest")).isFalse();
    }

    @Test
    @DisplayName("hash: 빈 평문 → IllegalArgumentException")
    void hash_rejects_blank() {
        assertThatThrownBy(() -> hasher.hash(" ")).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> hasher.hash(null)).isInstanceOf(IllegalArgumentException.class);
    }
}
