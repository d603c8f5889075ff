package com.itemhub.backend.security;

import java.io.IOException;

import org.springframework.http.HttpHeaders;
import org.springframework.security.authentication.UsernamePasswordAuthenticationToken;
import org.springframework.security.core.context.SecurityContextHolder;
import org.springframework.security.web.authentication.WebAuthenticationDetailsSource;
import org.springframework.web.filter.OncePerRequestFilter;

import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lombok.RequiredArgsConstructor;

/**
 * "Security Filter Chain"에서 Bearer access token 인증을 수행하는 필터
 *
 * 정책:
 * - 토큰이 "없으면" 통과한다. (차단은 SecurityConfig의 인가 규칙 + EntryPoint가 담당)
 * - 토큰이 "있는데" IdentityResolver가 거절하면 여기서 401(ApiError 포맷)로 종료한다.
 * - 성공하면 AuthPrincipal + ROLE_USER(+ ROLE_SUPERUSER)를 SecurityContext에 넣는다.
 */
@RequiredArgsConstructor
public class JwtAuthenticationFilter extends OncePerRequestFilter {

    private static final String BEARER_SCHEME = "Bearer";

    private final IdentityResolver identityResolver;
    private final SecurityErrorWriter errorWriter;

    @Override
    protected void doFilterInternal(
            HttpServletRequest request,
            HttpServletResponse response,
            FilterChain filterChain
    ) throws ServletException, IOException {

        // 이미 인증이 만들어진 요청이면 중복 처리하지 않는다.
        if (SecurityContextHolder.getContext().getAuthentication() != null) {
            filterChain.doFilter(request, response);
            return;
        }

        String token = resolveBearerToken(request);
        if (token == null) {
            filterChain.doFilter(request, response);
            return;
        }

        IdentityResolution resolution = identityResolver.resolve(token);
        if (!resolution.isAuthorized()) {
            SecurityContextHolder.clearContext();
            errorWriter.write(response, resolution.error());
            return;
        }

        AuthPrincipal principal = resolution.principal();
        var authentication = new UsernamePasswordAuthenticationToken(
                principal,
                null,
                principal.authorities()
        );
        authentication.setDetails(new WebAuthenticationDetailsSource().buildDetails(request));

        SecurityContextHolder.getContext().setAuthentication(authentication);
        filterChain.doFilter(request, response);
    }

    /**
     * Authorization: Bearer <token> 형태에서 <token>만 추출한다.
     * - scheme은 대소문자 무시 ("bearer", "BEARER" 허용)
     * - 없거나 형식이 다르거나 토큰이 비어 있으면 null
     */
    static String resolveBearerToken(HttpServletRequest request) {
        String authHeader = request.getHeader(HttpHeaders.AUTHORIZATION);
        if (authHeader == null || authHeader.isBlank()) return null;

        String header = authHeader.trim();
        if (header.length() <= BEARER_SCHEME.length()) return null;
        if (!header.regionMatches(true, 0, BEARER_SCHEME, 0, BEARER_SCHEME.length())) return null;
        if (!Character.isWhitespace(header.charAt(BEARER_SCHEME.length()))) return null;

        String token = header.substring(BEARER_SCHEME.length()).trim();
        return token.isBlank() ? null : token;
    }
}
