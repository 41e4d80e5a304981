package com.tradedesk.exception;

import com.tradedesk.domain.enums.OrderStatus;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import lombok.Getter;

/**
 * Root of every engine failure. The {@link ErrorCode} picks the HTTP status and the details
 * are rendered under {@code error.details}.
 *
 * <p>Order commands attach the order they were working on with {@link #withOrder}, so a caller
 * that sees a broker timeout or failure still learns which order to re-query.
 */
@Getter
public abstract class BaseException extends RuntimeException {

    public static final String ORDER_ID = "order_id";
    public static final String STATUS = "status";

    private final ErrorCode errorCode;
    private final Map<String, Object> details;

    protected BaseException(ErrorCode errorCode, String message) {
        this(errorCode, message, null, null);
    }

    protected BaseException(ErrorCode errorCode, String message, Map<String, Object> details) {
        this(errorCode, message, details, null);
    }

    protected BaseException(ErrorCode errorCode, String message, Throwable cause) {
        this(errorCode, message, null, cause);
    }

    protected BaseException(ErrorCode errorCode, String message, Map<String, Object> details, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
        this.details = details != null ? new LinkedHashMap<>(details) : new LinkedHashMap<>();
    }

    /** Records the order id and its ledger status at the time of the failure. */
    public BaseException withOrder(long orderId, OrderStatus status) {
        details.put(ORDER_ID, orderId);
        if (status != null) {
            details.put(STATUS, status.name());
        }
        return this;
    }

    public Map<String, Object> getDetails() {
        return Collections.unmodifiableMap(details);
    }

    /** Whether resubmitting the same command is safe once the cause clears. */
    public boolean isRetryable() {
        return errorCode.isRetryable();
    }
}
