package com.tradedesk.api.dto.response;

import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import java.time.Instant;
import lombok.Getter;

/**
 * Success envelope: {@code {"success":true,"data":...,"timestamp":...}}.
 * A refused cancel or modify is still a success here; its data carries ok=false.
 */
@Getter
@JsonPropertyOrder({"success", "data", "timestamp"})
public class ApiResponse<T> {

    private final boolean success = true;
    private final T data;
    private final Instant timestamp;

    private ApiResponse(T data, Instant timestamp) {
        this.data = data;
        this.timestamp = timestamp;
    }

    public static <T> ApiResponse<T> ok(T data) {
        return new ApiResponse<>(data, Instant.now());
    }
}
