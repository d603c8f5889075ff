package com.itemhub.backend.security;

import com.itemhub.backend.global.ApiException;
import com.itemhub.backend.global.ErrorCode;

/**
 * IdentityResolver / PrivilegeGate의 결과.
 *
 * - AUTHORIZED: principal 존재, error 없음
 * - UNAUTHORIZED / FORBIDDEN: principal 없음, error 존재
 */
public record IdentityResolution(Outcome outcome, AuthPrincipal principal, ErrorCode error) {

    public enum Outcome {
        AUTHORIZED,
        UNAUTHORIZED,
        FORBIDDEN
    }

    public static IdentityResolution authorized(AuthPrincipal principal) {
        if (principal == null) throw new IllegalArgumentException("principal must not be null");
        return new IdentityResolution(Outcome.AUTHORIZED, principal, null);
    }

    public static IdentityResolution unauthorized(ErrorCode error) {
        if (error == null) throw new IllegalArgumentException("error must not be null");
        return new IdentityResolution(Outcome.UNAUTHORIZED, null, error);
    }

    public static IdentityResolution forbidden(ErrorCode error) {
        if (error == null) throw new IllegalArgumentException("error must not be null");
        return new IdentityResolution(Outcome.FORBIDDEN, null, error);
    }

    public boolean isAuthorized() {
        return outcome == Outcome.AUTHORIZED;
    }

    /** 요청 경계에서 예외 형태로 바꿀 때 사용 */
    public AuthPrincipal orElseThrow() {
        if (isAuthorized()) return principal;
        throw new ApiException(error);
    }
}
