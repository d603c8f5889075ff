package com.itemhub.backend.auth.repo;

import java.util.Optional;

import com.itemhub.backend.user.domain.User;

/**
 * 인증 계층이 사용자 저장소에 요구하는 최소 조회 계약.
 *
 * - 없으면 Optional.empty() (예외 아님)
 * - 캐시하지 않는다. 호출할 때마다 현재 상태(active/superuser)를 읽는다.
 */
public interface UserLookup {

    Optional<User> findUserById(Long id);

    /** email은 호출 측에서 정규화(trim + 소문자)해서 넘긴다. */
    Optional<User> findUserByEmail(String email);
}
