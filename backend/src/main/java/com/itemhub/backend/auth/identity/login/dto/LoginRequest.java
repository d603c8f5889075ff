package com.itemhub.backend.auth.identity.login.dto;

import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.itemhub.backend.global.jackson.TrimStringDeserializer;

import jakarta.validation.constraints.NotBlank;

/**
 * [로그인 요청 DTO]
 * - 형식 검증은 @NotBlank까지만. 이메일 형식이 틀려도 "없는 계정"과 같은 401로 처리된다.
 */
public record LoginRequest(

        @JsonDeserialize(using = TrimStringDeserializer.class)
        @NotBlank
        String email,

        @NotBlank
        String password
) {}
