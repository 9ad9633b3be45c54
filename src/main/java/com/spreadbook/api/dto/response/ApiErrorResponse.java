package com.spreadbook.api.dto.response;

import com.spreadbook.exception.ErrorCode;
import java.time.Instant;
import java.util.Map;
import lombok.Builder;
import lombok.Getter;

/**
 * Error body rendered by {@link com.spreadbook.exception.GlobalExceptionHandler}.
 * {@code details} holds field errors for validation failures and run context (mode, counts) for
 * rejected imports.
 */
@Getter
@Builder
public class ApiErrorResponse {

    @Builder.Default
    private final boolean success = false;

    private final String code;
    private final int status;
    private final String message;
    private final Map<String, Object> details;
    private final String path;
    private final Instant timestamp;

    public static ApiErrorResponse of(ErrorCode errorCode, String message, Map<String, Object> details, String path) {
        return ApiErrorResponse.builder()
                .code(errorCode.getCode())
                .status(errorCode.getHttpStatus())
                .message(message)
                .details(details == null || details.isEmpty() ? null : details)
                .path(path)
                .timestamp(Instant.now())
                .build();
    }
}
