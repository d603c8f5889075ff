package com.itemhub.backend.security;

import java.io.IOException;
import java.nio.charset.StandardCharsets;

import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Component;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.itemhub.backend.global.ApiError;
import com.itemhub.backend.global.ErrorCode;

import jakarta.servlet.http.HttpServletResponse;
import lombok.RequiredArgsConstructor;

/**
 * Security 레이어(필터/EntryPoint)에서 "일관된 JSON 에러 응답"을 내려주는 유틸
 *
 * - GlobalExceptionHandler는 @Controller 이후 예외를 처리한다.
 * - Security Filter Chain에서 차단되는 요청은 @Controller까지 안 오므로
 *   여기서 같은 ApiError 포맷을 만든다.
 */
@Component
@RequiredArgsConstructor
public class SecurityErrorWriter {

    private final ObjectMapper objectMapper;

    public void write(HttpServletResponse response, ErrorCode errorCode) throws IOException {
        write(response, errorCode, errorCode.defaultMessage());
    }

    public void write(HttpServletResponse response, ErrorCode errorCode, String messageOverride) throws IOException {

        // 이미 다른 필터가 응답을 만들어버린 경우라면 건드리지 않음
        if (response.isCommitted())
            return;

        response.setHeader(HttpHeaders.CACHE_CONTROL, "no-store");
        response.setHeader(HttpHeaders.PRAGMA, "no-cache");

        if (errorCode.status() == HttpStatus.UNAUTHORIZED) {
            response.setHeader(HttpHeaders.WWW_AUTHENTICATE, "Bearer");
        }

        response.setStatus(errorCode.status().value());
        response.setCharacterEncoding(StandardCharsets.UTF_8.name());
        response.setContentType("application/json;charset=UTF-8");

        objectMapper.writeValue(
                response.getWriter(),
                ApiError.of(errorCode, messageOverride)
        );
    }
}
