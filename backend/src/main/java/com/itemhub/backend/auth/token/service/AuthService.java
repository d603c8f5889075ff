package com.itemhub.backend.auth.token.service;

import java.util.Optional;

import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import com.itemhub.backend.auth.repo.UserLookup;
import com.itemhub.backend.global.ApiException;
import com.itemhub.backend.global.ErrorCode;
import com.itemhub.backend.security.jwt.TokenClaims;
import com.itemhub.backend.security.jwt.TokenCodec;
import com.itemhub.backend.security.jwt.TokenIssuer;
import com.itemhub.backend.security.jwt.TokenKind;
import com.itemhub.backend.security.jwt.TokenPair;
import com.itemhub.backend.security.password.PasswordHasher;
import com.itemhub.backend.user.domain.User;
import com.itemhub.backend.user.support.EmailNormalizer;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * 로그인 / 토큰 재발급 유스케이스
 *
 * 로그인 계약:
 * - 이메일은 normalize(trim + 소문자) 후 조회한다.
 * - 빈 입력, "이메일 없음", "비밀번호 불일치"는 전부 INVALID_CREDENTIALS (계정 유무 추측 방지)
 * - 비활성 계정은 ACCOUNT_INACTIVE
 *
 * 재발급 계약:
 * - refresh 토큰이 아니거나 검증 실패, 사용자 없음 -> 전부 REFRESH_INVALID
 * - 성공 시 access + refresh 둘 다 새로 발급한다.
 *   서버 저장소가 없으므로 이전 refresh 토큰은 만료될 때까지 유효하다.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class AuthService {

    private final UserLookup userLookup;
    private final PasswordHasher passwordHasher;
    private final TokenIssuer tokenIssuer;
    private final TokenCodec tokenCodec;

    @Transactional(readOnly = true)
    public TokenPair login(String rawEmail, String rawPassword) {
        // 컨트롤러 @Valid가 있어도 서비스는 방어적으로 체크한다.
        if (isBlank(rawEmail) || isBlank(rawPassword)) {
            throw new ApiException(ErrorCode.INVALID_CREDENTIALS);
        }

        String email = EmailNormalizer.normalize(rawEmail);

        User user = userLookup.findUserByEmail(email)
                .filter(u -> passwordHasher.verify(rawPassword, u.getHashedPassword()))
                .orElseThrow(() -> new ApiException(ErrorCode.INVALID_CREDENTIALS));

        if (!user.isActive()) {
            log.info("login rejected: userId={} inactive", user.getId());
            throw new ApiException(ErrorCode.ACCOUNT_INACTIVE);
        }

        return tokenIssuer.issuePair(user.getId());
    }

    @Transactional(readOnly = true)
    public TokenPair refresh(String refreshToken) {
        if (isBlank(refreshToken)) {
            throw new ApiException(ErrorCode.REFRESH_INVALID);
        }

        Optional<Long> userId = tokenCodec.decode(refreshToken)
                .claimsOfKind(TokenKind.REFRESH)
                .flatMap(TokenClaims::subjectAsUserId);

        User user = userId
                .flatMap(userLookup::findUserById)
                .orElseThrow(() -> new ApiException(ErrorCode.REFRESH_INVALID));

        if (!user.isActive()) {
            log.info("refresh rejected: userId={} inactive", user.getId());
            throw new ApiException(ErrorCode.ACCOUNT_INACTIVE);
        }

        return tokenIssuer.issuePair(user.getId());
    }

    private static boolean isBlank(String s) {
        return s == null || s.isBlank();
    }
}
