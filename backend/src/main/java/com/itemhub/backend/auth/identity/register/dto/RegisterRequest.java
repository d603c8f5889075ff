package com.itemhub.backend.auth.identity.register.dto;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.itemhub.backend.global.jackson.TrimStringDeserializer;
import com.itemhub.backend.security.password.PasswordHasher;

import jakarta.validation.constraints.AssertTrue;
import jakarta.validation.constraints.Email;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

/**
 * [회원가입 요청 DTO]
 * - password 상한 72바이트(UTF-8): BCrypt가 그 이후를 무시하기 때문
 */
public record RegisterRequest(

        @JsonDeserialize(using = TrimStringDeserializer.class)
        @Email
        @NotBlank
        @Size(max = 255)
        String email,

        @NotBlank
        @Size(max = 72)
        String password,

        @JsonProperty("full_name")
        @Size(max = 255)
        String fullName
) {

    @JsonIgnore
    @AssertTrue(message = "password must be at most 72 bytes")
    public boolean isPasswordWithinBcryptLimit() {
        return PasswordHasher.fitsBcryptLimit(password);
    }
}
