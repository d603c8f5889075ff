package com.itemhub.backend.user.service;

import java.time.Clock;
import java.time.LocalDateTime;

import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import com.itemhub.backend.global.ApiException;
import com.itemhub.backend.global.ErrorCode;
import com.itemhub.backend.global.page.PageResponse;
import com.itemhub.backend.security.AuthPrincipal;
import com.itemhub.backend.security.password.PasswordHasher;
import com.itemhub.backend.user.domain.User;
import com.itemhub.backend.user.dto.UserResponse;
import com.itemhub.backend.user.dto.UserUpdateRequest;
import com.itemhub.backend.user.repo.UserRepository;
import com.itemhub.backend.user.support.EmailNormalizer;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * 사용자 관리 유스케이스 (가입 / 조회 / 수정 / 삭제)
 *
 * 정책:
 * - 이메일은 정규화(trim + 소문자) 후 저장/비교한다.
 * - 이메일 중복은 선검사 + 최종은 DB unique 제약(uq_users_email)으로 차단 -> 409
 * - 수정은 본인 또는 superuser만, is_active 변경은 superuser만 가능
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class UserService {

    private final UserRepository userRepository;
    private final PasswordHasher passwordHasher;
    private final Clock clock;

    @Transactional
    public UserResponse register(String rawEmail, String rawPassword, String fullName) {
        String email = EmailNormalizer.normalize(rawEmail);

        if (userRepository.existsByEmail(email))
            throw new ApiException(ErrorCode.EMAIL_ALREADY_EXISTS);

        User user = User.create(email, passwordHasher.hash(rawPassword), fullName, LocalDateTime.now(clock));
        User saved = saveOrConflict(user, email);

        log.info("user registered: userId={}", saved.getId());
        return UserResponse.from(saved);
    }

    @Transactional(readOnly = true)
    public UserResponse get(Long userId) {
        return UserResponse.from(loadUserOrThrow(userId));
    }

    @Transactional(readOnly = true)
    public PageResponse<UserResponse> list(int skip, int limit) {
        return PageResponse.of(
                userRepository.findSlice(skip, limit),
                userRepository.count(),
                skip,
                limit,
                UserResponse::from
        );
    }

    @Transactional
    public UserResponse update(AuthPrincipal actor, Long userId, UserUpdateRequest req) {
        User user = loadUserOrThrow(userId);

        if (!actor.superuser() && !actor.userId().equals(userId))
            throw new ApiException(ErrorCode.NOT_ENOUGH_PERMISSIONS);

        if (req.active() != null && !actor.superuser())
            throw new ApiException(ErrorCode.NOT_ENOUGH_PERMISSIONS);

        if (req.isEmpty())
            return UserResponse.from(user);

        LocalDateTime now = LocalDateTime.now(clock);

        String email = null;
        if (req.email() != null) {
            email = EmailNormalizer.normalize(req.email());
            if (email.isEmpty())
                throw new ApiException(ErrorCode.VALIDATION_ERROR, "email must not be blank");
            if (!email.equals(user.getEmail())) {
                if (userRepository.existsByEmail(email))
                    throw new ApiException(ErrorCode.EMAIL_ALREADY_EXISTS);
                user.changeEmail(email, now);
            }
        }
        if (req.fullName() != null) user.changeFullName(req.fullName(), now);
        if (req.password() != null) user.changePassword(passwordHasher.hash(req.password()), now);
        if (req.active() != null) user.changeActive(req.active(), now);

        User saved = saveOrConflict(user, email);
        log.info("user updated: userId={}, by={}", userId, actor.userId());
        return UserResponse.from(saved);
    }

    @Transactional
    public void delete(Long userId) {
        User user = loadUserOrThrow(userId);
        userRepository.delete(user);
        log.info("user deleted: userId={}", userId);
    }

    private User loadUserOrThrow(Long userId) {
        return userRepository.findById(userId)
                .orElseThrow(() -> new ApiException(ErrorCode.USER_NOT_FOUND));
    }

    /**
     * 레이스로 같은 이메일이 동시에 들어온 경우 DB unique 제약에서 최종 차단된다.
     * - 이메일 충돌이면 409, 다른 무결성 문제면 그대로 던진다.
     */
    private User saveOrConflict(User user, String email) {
        try {
            return userRepository.saveAndFlush(user);
        } catch (DataIntegrityViolationException e) {
            if (email != null && userRepository.existsByEmail(email)) {
                throw new ApiException(ErrorCode.EMAIL_ALREADY_EXISTS);
            }
            throw e;
        }
    }
}
