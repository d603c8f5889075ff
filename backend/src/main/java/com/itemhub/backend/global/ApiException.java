package com.itemhub.backend.global;

import org.springframework.http.HttpStatus;

import lombok.Getter;

/**
 * 서비스/보안 계층이 의도적으로 던지는 예외 (중앙화된 ErrorCode 기반)
 *
 * - 내부 계층은 결과 타입(Optional, TokenDecodeResult, IdentityResolution)으로 실패를 주고받고,
 *   요청 처리 경계(서비스 공개 메서드/컨트롤러)에서만 이 예외로 바꿔 던진다.
 * - GlobalExceptionHandler / SecurityErrorWriter가 ApiError로 직렬화해 응답 포맷을 고정한다.
 *
 * => throw new ApiException(ErrorCode.REFRESH_INVALID);
 */
@Getter
public class ApiException extends RuntimeException {

    private final ErrorCode errorCode;
    private final HttpStatus status;
    private final String code;
    private final Object details;

    public ApiException(ErrorCode errorCode) {
        this(errorCode, errorCode.defaultMessage(), null);
    }

    public ApiException(ErrorCode errorCode, String messageOverride) {
        this(errorCode, messageOverride, null);
    }

    public ApiException(ErrorCode errorCode, String messageOverride, Object details) {
        // super(...)는 첫 줄이어야 해서 errorCode null 검사보다 앞에 둘 수밖에 없음.
        super(resolveMessage(errorCode, messageOverride));

        if (errorCode == null)
            throw new IllegalArgumentException("ErrorCode must not be null");

        this.errorCode = errorCode;
        this.status = errorCode.status();
        this.code = errorCode.name();
        this.details = details;
    }

    private static String resolveMessage(ErrorCode errorCode, String messageOverride) {
        if (messageOverride != null && !messageOverride.isBlank()) {
            return messageOverride;
        }
        return (errorCode == null) ? null : errorCode.defaultMessage();
    }
}
