package com.itemhub.backend.security;

import java.io.IOException;

import org.springframework.security.core.AuthenticationException;
import org.springframework.security.web.AuthenticationEntryPoint;

import com.itemhub.backend.global.ErrorCode;

import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lombok.RequiredArgsConstructor;

/**
 * 인증이 필요한 리소스에 "인증 없이" 접근했을 때 호출되는 EntryPoint.
 *
 * - Authorization 헤더가 없거나 Bearer 형식이 아니면 여기로 온다. (401 AUTH_REQUIRED)
 * - 헤더는 있는데 토큰이 틀린 경우는 JwtAuthenticationFilter가 먼저 응답한다.
 */
@RequiredArgsConstructor
public class RestAuthEntryPoint implements AuthenticationEntryPoint {

    private final SecurityErrorWriter errorWriter;

    @Override
    public void commence(
            HttpServletRequest request,
            HttpServletResponse response,
            AuthenticationException authException) throws IOException {

        errorWriter.write(response, ErrorCode.AUTH_REQUIRED);
    }
}
