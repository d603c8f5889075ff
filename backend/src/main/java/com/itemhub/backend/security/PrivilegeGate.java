package com.itemhub.backend.security;

import org.springframework.stereotype.Component;

import com.itemhub.backend.global.ApiException;
import com.itemhub.backend.global.ErrorCode;

/**
 * 관리자(superuser) 전용 기능 앞에 두는 관문.
 * - 인증 실패는 그대로 통과시키고(401 유지), 인증은 됐지만 권한이 없을 때만 403.
 */
@Component
public class PrivilegeGate {

    public IdentityResolution check(IdentityResolution resolution) {
        if (resolution == null) throw new IllegalArgumentException("resolution must not be null");
        if (!resolution.isAuthorized()) return resolution;

        return resolution.principal().superuser()
                ? resolution
                : IdentityResolution.forbidden(ErrorCode.NOT_ENOUGH_PERMISSIONS);
    }

    public AuthPrincipal requirePrivileged(AuthPrincipal principal) {
        if (principal == null) throw new ApiException(ErrorCode.AUTH_REQUIRED);
        return check(IdentityResolution.authorized(principal)).orElseThrow();
    }
}
