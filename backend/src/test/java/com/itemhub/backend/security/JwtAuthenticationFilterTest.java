package com.itemhub.backend.security;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.BDDMockito.given;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.http.HttpHeaders;
import org.springframework.mock.web.MockFilterChain;
import org.springframework.mock.web.MockHttpServletRequest;
import org.springframework.mock.web.MockHttpServletResponse;
import org.springframework.security.core.Authentication;
import org.springframework.security.core.context.SecurityContextHolder;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.itemhub.backend.global.ErrorCode;

@ExtendWith(MockitoExtension.class)
@DisplayName("[Security] JwtAuthenticationFilter")
class JwtAuthenticationFilterTest {

    private static final ObjectMapper om = new ObjectMapper();

    @Mock
    private IdentityResolver identityResolver;

    private JwtAuthenticationFilter filter;
    private MockHttpServletRequest request;
    private MockHttpServletResponse response;
    private MockFilterChain chain;

    @BeforeEach
    void setUp() {
        filter = new JwtAuthenticationFilter(identityResolver, new SecurityErrorWriter(om));
        request = new MockHttpServletRequest("GET", "/api/v1/auth/me");
        response = new MockHttpServletResponse();
        chain = new MockFilterChain();
    }

    @AfterEach
    void tearDown() {
        SecurityContextHolder.clearContext();
    }

    @Test
    @DisplayName("Authorization 없음 → 인증 없이 다음 필터로 (차단은 EntryPoint 몫)")
    void passes_through_without_header() throws Exception {
        filter.doFilter(request, response, chain);

        assertThat(chain.getRequest()).isNotNull();
        assertThat(SecurityContextHolder.getContext().getAuthentication()).isNull();
        verify(identityResolver, never()).resolve(anyString());
    }

    @Test
    @DisplayName("scheme 대소문자 무시: 'bearer <token>' → principal + ROLE_* 세팅")
    void authenticates_case_insensitive_scheme() throws Exception {
        AuthPrincipal principal = new AuthPrincipal(3L, "s@example.com", true, true);
        given(identityResolver.resolve("tok")).willReturn(IdentityResolution.authorized(principal));
        request.addHeader(HttpHeaders.AUTHORIZATION, "bearer tok");

        filter.doFilter(request, response, chain);

        Authentication auth = SecurityContextHolder.getContext().getAuthentication();
        assertThat(chain.getRequest()).isNotNull();
        assertThat(auth).isNotNull();
        assertThat(auth.getPrincipal()).isEqualTo(principal);
        assertThat(auth.getAuthorities()).extracting(Object::toString)
                .containsExactlyInAnyOrder(AuthPrincipal.ROLE_USER, AuthPrincipal.ROLE_SUPERUSER);
    }

    @Test
    @DisplayName("토큰은 있는데 거절 → 401 ApiError + WWW-Authenticate: Bearer, 체인 중단")
    void rejects_invalid_token() throws Exception {
        given(identityResolver.resolve("bad")).willReturn(IdentityResolution.unauthorized(ErrorCode.ACCESS_INVALID));
        request.addHeader(HttpHeaders.AUTHORIZATION, "Bearer bad");

        filter.doFilter(request, response, chain);

        assertThat(chain.getRequest()).isNull();
        assertThat(response.getStatus()).isEqualTo(401);
        assertThat(response.getHeader(HttpHeaders.WWW_AUTHENTICATE)).isEqualTo("Bearer");
        assertThat(response.getHeader(HttpHeaders.CACHE_CONTROL)).isEqualTo("no-store");

        JsonNode body = om.readTree(response.getContentAsString());
        assertThat(body.get("code").asText()).isEqualTo("ACCESS_INVALID");
        assertThat(body.get("message").asText()).isEqualTo("Could not validate credentials");
    }

    @Test
    @DisplayName("비활성 사용자 → 401 ACCOUNT_INACTIVE")
    void rejects_inactive_user() throws Exception {
        given(identityResolver.resolve("tok")).willReturn(IdentityResolution.unauthorized(ErrorCode.ACCOUNT_INACTIVE));
        request.addHeader(HttpHeaders.AUTHORIZATION, "Bearer tok");

        filter.doFilter(request, response, chain);

        assertThat(response.getStatus()).isEqualTo(401);
        assertThat(om.readTree(response.getContentAsString()).get("code").asText()).isEqualTo("ACCOUNT_INACTIVE");
    }

    @Test
    @DisplayName("Bearer 토큰 추출 규칙")
    void bearer_token_extraction() {
        assertThat(extract("Bearer abc")).isEqualTo("abc");
        assertThat(extract("BEARER   abc  ")).isEqualTo("abc");
        assertThat(extract("Basic abc")).isNull();
        assertThat(extract("Bearer ")).isNull();
        assertThat(extract("Bearerabc")).isNull();
        assertThat(extract("")).isNull();
    }

    private static String extract(String header) {
        MockHttpServletRequest req = new MockHttpServletRequest();
        req.addHeader(HttpHeaders.AUTHORIZATION, header);
        return JwtAuthenticationFilter.resolveBearerToken(req);
    }
}
