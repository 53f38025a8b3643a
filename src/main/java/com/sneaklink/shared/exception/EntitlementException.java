package com.sneaklink.shared.exception;

import lombok.Getter;

import java.util.Map;

/**
 * 訂閱引擎的業務例外
 *
 * 都不是致命錯誤：呼叫端依 {@link ErrorCode} 決定重試（GATEWAY_TIMEOUT）或放棄。
 */
@Getter
public class EntitlementException extends RuntimeException {

    private final ErrorCode errorCode;

    public EntitlementException(ErrorCode errorCode) {
        this(errorCode, errorCode.getDefaultMessage());
    }

    public EntitlementException(ErrorCode errorCode, String message) {
        super(message);
        this.errorCode = errorCode;
    }

    public EntitlementException(ErrorCode errorCode, String message, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
    }

    /**
     * 額外給前端的欄位（例如 limit / used），預設沒有
     */
    public Map<String, Object> getDetails() {
        return Map.of();
    }
}
