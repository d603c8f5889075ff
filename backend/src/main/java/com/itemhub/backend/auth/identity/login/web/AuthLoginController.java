package com.itemhub.backend.auth.identity.login.web;

import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import com.itemhub.backend.auth.identity.login.dto.LoginRequest;
import com.itemhub.backend.auth.token.dto.TokenResponse;
import com.itemhub.backend.auth.token.service.AuthService;

import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;

/**
 * 로그인 API
 *
 * - 요청(JSON) 검증: @Valid DTO
 * - 핵심 로직: AuthService (인증/정책/토큰 발급)
 * - 응답: access + refresh 토큰 모두 바디로
 */
@RestController
@RequiredArgsConstructor
@RequestMapping("/api/v1/auth")
public class AuthLoginController {

    private final AuthService authService;

    @PostMapping("/login")
    public TokenResponse login(@Valid @RequestBody LoginRequest req) {
        return TokenResponse.from(authService.login(req.email(), req.password()));
    }
}
