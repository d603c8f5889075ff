package com.itemhub.backend.global;

import org.springframework.http.HttpStatus;

/**
 * 에러 코드(클라이언트 분기용) + HTTP 상태 + 기본 메시지의 단일 소스.
 *
 * 원칙:
 * - code = enum name() (변경 시 API 계약 깨짐)
 * - 인증 실패 계열은 내부 원인이 달라도 전부 401로 뭉갠다. (어느 단계에서 실패했는지 노출 금지)
 */
public enum ErrorCode {

    // Login / Register
    INVALID_CREDENTIALS(HttpStatus.UNAUTHORIZED,
            "Incorrect email or password"),
    ACCOUNT_INACTIVE(HttpStatus.UNAUTHORIZED,
            "User is inactive"),
    EMAIL_ALREADY_EXISTS(HttpStatus.CONFLICT,
            "User with this email already exists"),

    // Auth / Security
    AUTH_REQUIRED(HttpStatus.UNAUTHORIZED,
            "Not authenticated"),
    ACCESS_INVALID(HttpStatus.UNAUTHORIZED,
            "Could not validate credentials"),
    PRINCIPAL_NOT_FOUND(HttpStatus.UNAUTHORIZED,
            "User not found"),
    NOT_ENOUGH_PERMISSIONS(HttpStatus.FORBIDDEN,
            "Not enough permissions"),

    // Refresh token
    REFRESH_INVALID(HttpStatus.UNAUTHORIZED,
            "Invalid refresh token"),

    // Resources
    USER_NOT_FOUND(HttpStatus.NOT_FOUND,
            "User not found"),
    ITEM_NOT_FOUND(HttpStatus.NOT_FOUND,
            "Item not found"),
    ITEM_ACCESS_DENIED(HttpStatus.FORBIDDEN,
            "Not authorized to access this item"),

    // Validation / Common
    VALIDATION_ERROR(HttpStatus.BAD_REQUEST,
            "Invalid request"),
    RESOURCE_NOT_FOUND(HttpStatus.NOT_FOUND,
            "Not Found"),
    METHOD_NOT_ALLOWED(HttpStatus.METHOD_NOT_ALLOWED,
            "Method Not Allowed"),
    INTERNAL_ERROR(HttpStatus.INTERNAL_SERVER_ERROR,
            "Internal server error");

    private final HttpStatus status;
    private final String defaultMessage;

    ErrorCode(HttpStatus status, String defaultMessage) {
        this.status = status;
        this.defaultMessage = defaultMessage;
    }

    public HttpStatus status() {
        return status;
    }

    public String defaultMessage() {
        return defaultMessage;
    }
}
