package com.itemhub.backend.security;

import java.util.ArrayList;
import java.util.List;

import org.springframework.security.core.authority.SimpleGrantedAuthority;

import com.itemhub.backend.user.domain.User;

/**
 * SecurityContext에 저장되는 "인증된 사용자"의 최소 정보(Principal).
 *
 * - IdentityResolver가 매 요청마다 DB에서 다시 읽은 User로 만든다. (캐시 없음)
 * - 컨트롤러는 @AuthenticationPrincipal로 받는다.
 */
public record AuthPrincipal(Long userId, String email, boolean active, boolean superuser) {

    public static final String ROLE_USER = "ROLE_USER";
    public static final String ROLE_SUPERUSER = "ROLE_SUPERUSER";

    public AuthPrincipal {
        if (userId == null) throw new IllegalArgumentException("userId must not be null");
        if (email == null) throw new IllegalArgumentException("email must not be null");
    }

    public static AuthPrincipal from(User user) {
        return new AuthPrincipal(user.getId(), user.getEmail(), user.isActive(), user.isSuperuser());
    }

    /** Spring Security 권한 문자열 규칙(ROLE_*) */
    public List<SimpleGrantedAuthority> authorities() {
        List<SimpleGrantedAuthority> authorities = new ArrayList<>();
        authorities.add(new SimpleGrantedAuthority(ROLE_USER));
        if (superuser) authorities.add(new SimpleGrantedAuthority(ROLE_SUPERUSER));
        return authorities;
    }
}
