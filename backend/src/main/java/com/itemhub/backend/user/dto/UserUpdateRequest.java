package com.itemhub.backend.user.dto;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.itemhub.backend.global.jackson.TrimStringDeserializer;
import com.itemhub.backend.security.password.PasswordHasher;

import jakarta.validation.constraints.AssertTrue;
import jakarta.validation.constraints.Email;
import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.Size;

/**
 * [사용자 부분 수정 DTO]
 * - null 필드는 "변경 안 함", 보낸 email/password는 공백일 수 없다.
 * - password 상한 72바이트(UTF-8)
 * - is_active 변경은 superuser만 가능 (UserService에서 검사)
 */
public record UserUpdateRequest(

        @JsonDeserialize(using = TrimStringDeserializer.class)
        @Email
        @Pattern(regexp = ".*\\S.*")
        @Size(max = 255)
        String email,

        @JsonProperty("full_name")
        @Size(max = 255)
        String fullName,

        @Size(min = 1, max = 72)
        @Pattern(regexp = ".*\\S.*")
        String password,

        @JsonProperty("is_active")
        Boolean active
) {
    @JsonIgnore
    @AssertTrue(message = "password must be at most 72 bytes")
    public boolean isPasswordWithinBcryptLimit() {
        return PasswordHasher.fitsBcryptLimit(password);
    }

    @JsonIgnore
    public boolean isEmpty() {
        return email == null && fullName == null && password == null && active == null;
    }
}
