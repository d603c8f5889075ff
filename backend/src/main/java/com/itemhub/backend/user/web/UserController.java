package com.itemhub.backend.user.web;

import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PatchMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import com.itemhub.backend.global.MessageResponse;
import com.itemhub.backend.global.page.PageResponse;
import com.itemhub.backend.security.AuthPrincipal;
import com.itemhub.backend.security.PrivilegeGate;
import com.itemhub.backend.user.dto.UserResponse;
import com.itemhub.backend.user.dto.UserUpdateRequest;
import com.itemhub.backend.user.service.UserService;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import lombok.RequiredArgsConstructor;

/**
 * 사용자 관리 API
 *
 * - 목록/삭제: superuser 전용 (PrivilegeGate)
 * - 단건 조회: 인증된 사용자
 * - 수정: 본인 또는 superuser (UserService에서 검사)
 */
@Validated
@RestController
@RequiredArgsConstructor
@RequestMapping("/api/v1/users")
public class UserController {

    private final UserService userService;
    private final PrivilegeGate privilegeGate;

    @GetMapping
    public PageResponse<UserResponse> list(
            @AuthenticationPrincipal AuthPrincipal principal,
            @RequestParam(defaultValue = "0") @Min(0) int skip,
            @RequestParam(defaultValue = "20") @Min(1) @Max(100) int limit
    ) {
        privilegeGate.requirePrivileged(principal);
        return userService.list(skip, limit);
    }

    @GetMapping("/{userId}")
    public UserResponse get(@PathVariable Long userId) {
        return userService.get(userId);
    }

    @PatchMapping("/{userId}")
    public UserResponse update(
            @AuthenticationPrincipal AuthPrincipal principal,
            @PathVariable Long userId,
            @Valid @RequestBody UserUpdateRequest req
    ) {
        return userService.update(principal, userId, req);
    }

    @DeleteMapping("/{userId}")
    public MessageResponse delete(@AuthenticationPrincipal AuthPrincipal principal, @PathVariable Long userId) {
        privilegeGate.requirePrivileged(principal);
        userService.delete(userId);
        return new MessageResponse("User deleted successfully");
    }
}
