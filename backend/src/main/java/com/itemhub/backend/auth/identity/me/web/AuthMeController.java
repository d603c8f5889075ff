package com.itemhub.backend.auth.identity.me.web;

import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import com.itemhub.backend.global.ApiException;
import com.itemhub.backend.global.ErrorCode;
import com.itemhub.backend.security.AuthPrincipal;
import com.itemhub.backend.user.dto.UserResponse;
import com.itemhub.backend.user.service.UserService;

import lombok.RequiredArgsConstructor;

/**
 * 내 정보 조회
 * - principal은 JwtAuthenticationFilter가 이번 요청에서 새로 조회한 사용자다.
 */
@RestController
@RequiredArgsConstructor
@RequestMapping("/api/v1/auth")
public class AuthMeController {

    private final UserService userService;

    @GetMapping("/me")
    public UserResponse me(@AuthenticationPrincipal AuthPrincipal principal) {
        // SecurityConfig에서 막히지만 한 번 더 방어
        if (principal == null) throw new ApiException(ErrorCode.AUTH_REQUIRED);
        return userService.get(principal.userId());
    }
}
