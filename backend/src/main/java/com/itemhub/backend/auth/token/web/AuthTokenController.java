package com.itemhub.backend.auth.token.web;

import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import com.itemhub.backend.auth.token.dto.RefreshRequest;
import com.itemhub.backend.auth.token.dto.TokenResponse;
import com.itemhub.backend.auth.token.service.AuthService;

import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;

/**
 * POST /api/v1/auth/refresh
 *
 * 바디의 refresh_token을 검증하고 access/refresh를 모두 새로 발급한다.
 * 실패는 AuthService가 ApiException(REFRESH_INVALID / ACCOUNT_INACTIVE)으로 던진다.
 */
@RestController
@RequiredArgsConstructor
@RequestMapping("/api/v1/auth")
public class AuthTokenController {

    private final AuthService authService;

    @PostMapping("/refresh")
    public TokenResponse refresh(@Valid @RequestBody RefreshRequest req) {
        return TokenResponse.from(authService.refresh(req.refreshToken()));
    }
}
