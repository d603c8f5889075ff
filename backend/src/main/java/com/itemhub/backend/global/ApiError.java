package com.itemhub.backend.global;

import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * 공통 API 에러 응답 DTO
 *
 * 원칙:
 * - 모든 레이어(ControllerAdvice / EntryPoint / Filter)에서 동일한 JSON 스키마를 유지한다.
 * - 인증 실패는 내부 원인이 달라도 같은 모양({code, message})으로 내려간다.
 *
 * 필드:
 * - code: 클라이언트 분기용 안정 식별자 (ErrorCode.name())
 * - message: 사용자 메시지
 * - details: 추가 정보(필요 시만, 보통 null)
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ApiError(
        String code,    // ex: "INVALID_CREDENTIALS"
        String message, // ex: "Incorrect email or password"
        Object details
) {
    public static ApiError of(ErrorCode errorCode) {
        return new ApiError(errorCode.name(), errorCode.defaultMessage(), null);
    }

    public static ApiError of(ErrorCode errorCode, String messageOverride) {
        return new ApiError(errorCode.name(), messageOverride, null);
    }

    public static ApiError from(ApiException e) {
        return new ApiError(e.getCode(), e.getMessage(), e.getDetails());
    }
}
