package com.tradedesk.api.dto.response;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.tradedesk.exception.ErrorCode;
import java.time.Instant;
import java.util.Map;
import lombok.Builder;
import lombok.Getter;

/**
 * Error envelope: {@code {"success":false,"error":{...}}}.
 *
 * <p>retryable tells a client whether resending the same command is safe. details carries
 * field errors for validation failures and order_id/status when an order command failed after
 * the order was written to the ledger.
 */
@Getter
public class ApiErrorResponse {

    private final boolean success = false;
    private final ErrorDetail error;

    private ApiErrorResponse(ErrorDetail error) {
        this.error = error;
    }

    public static ApiErrorResponse of(ErrorCode errorCode, String message, Map<String, Object> details, String path) {
        return new ApiErrorResponse(ErrorDetail.builder()
                .code(errorCode.getCode())
                .message(message)
                .retryable(errorCode.isRetryable())
                .details(details)
                .timestamp(Instant.now())
                .path(path)
                .build());
    }

    @Getter
    @Builder
    public static class ErrorDetail {
        private final String code;
        private final String message;
        private final boolean retryable;

        @JsonInclude(JsonInclude.Include.NON_EMPTY)
        private final Map<String, Object> details;

        private final Instant timestamp;
        private final String path;
    }
}
