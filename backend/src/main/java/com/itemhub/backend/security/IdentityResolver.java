package com.itemhub.backend.security;

import java.util.Optional;

import org.springframework.stereotype.Component;

import com.itemhub.backend.auth.repo.UserLookup;
import com.itemhub.backend.global.ErrorCode;
import com.itemhub.backend.security.jwt.TokenClaims;
import com.itemhub.backend.security.jwt.TokenCodec;
import com.itemhub.backend.security.jwt.TokenDecodeResult;
import com.itemhub.backend.security.jwt.TokenKind;
import com.itemhub.backend.user.domain.User;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Bearer access token -> 현재 사용자(AuthPrincipal)
 *
 * 순서 (먼저 걸린 실패가 결과):
 * 1) 토큰 없음                    -> AUTH_REQUIRED
 * 2) 디코드 실패 / access 아님     -> ACCESS_INVALID
 * 3) sub가 양의 정수 아님          -> ACCESS_INVALID
 * 4) 사용자 없음                  -> PRINCIPAL_NOT_FOUND
 * 5) 비활성 사용자                 -> ACCOUNT_INACTIVE
 *
 * 전부 401. 사용자는 매번 새로 조회한다.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class IdentityResolver {

    private final TokenCodec tokenCodec;
    private final UserLookup userLookup;

    public IdentityResolution resolve(String bearerToken) {
        if (bearerToken == null || bearerToken.isBlank()) {
            return IdentityResolution.unauthorized(ErrorCode.AUTH_REQUIRED);
        }

        TokenDecodeResult decoded = tokenCodec.decode(bearerToken);
        Optional<TokenClaims> claims = decoded.claimsOfKind(TokenKind.ACCESS);
        if (claims.isEmpty()) {
            log.debug("access token rejected: failure={}, valid={}", decoded.failure(), decoded.isValid());
            return IdentityResolution.unauthorized(ErrorCode.ACCESS_INVALID);
        }

        Optional<Long> userId = claims.get().subjectAsUserId();
        if (userId.isEmpty()) {
            log.debug("access token rejected: non-numeric subject");
            return IdentityResolution.unauthorized(ErrorCode.ACCESS_INVALID);
        }

        Optional<User> user = userLookup.findUserById(userId.get());
        if (user.isEmpty()) {
            log.debug("access token rejected: userId={} not found", userId.get());
            return IdentityResolution.unauthorized(ErrorCode.PRINCIPAL_NOT_FOUND);
        }

        if (!user.get().isActive()) {
            log.debug("access token rejected: userId={} inactive", userId.get());
            return IdentityResolution.unauthorized(ErrorCode.ACCOUNT_INACTIVE);
        }

        return IdentityResolution.authorized(AuthPrincipal.from(user.get()));
    }

    /** 실패 시 ApiException(401)을 던지는 형태 */
    public AuthPrincipal resolveIdentity(String bearerToken) {
        return resolve(bearerToken).orElseThrow();
    }
}
