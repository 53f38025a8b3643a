package com.sneaklink.shared.exception;

import lombok.Getter;
import org.springframework.http.HttpStatus;

/**
 * 訂閱 / 配額 / 付款相關的錯誤種類
 *
 * 每個錯誤對應一個 HTTP 狀態碼，由 GlobalExceptionHandler 統一轉成 ErrorResponse。
 */
@Getter
public enum ErrorCode {

    INVALID_PLAN(HttpStatus.BAD_REQUEST, "方案不存在或不可購買"),
    ALREADY_ON_PLAN(HttpStatus.CONFLICT, "已經是此方案"),
    NO_ACTIVE_SUBSCRIPTION(HttpStatus.NOT_FOUND, "沒有有效訂閱"),
    UNKNOWN_REFERENCE(HttpStatus.NOT_FOUND, "找不到付款參考編號"),
    AMOUNT_MISMATCH(HttpStatus.CONFLICT, "付款金額與方案價格不符"),
    GATEWAY_TIMEOUT(HttpStatus.GATEWAY_TIMEOUT, "金流閘道逾時，請稍後以同一參考編號重試"),
    GATEWAY_REJECTED(HttpStatus.BAD_GATEWAY, "金流閘道拒絕請求"),
    PAYMENT_FAILED(HttpStatus.PAYMENT_REQUIRED, "付款失敗"),
    PAYMENT_NOT_COMPLETED(HttpStatus.CONFLICT, "付款尚未完成"),
    SUPERSEDED(HttpStatus.CONFLICT, "此付款已被新的方案選擇取代"),
    QUOTA_EXCEEDED(HttpStatus.FORBIDDEN, "已達用量上限"),
    NO_SUCH_PAYMENT(HttpStatus.NOT_FOUND, "找不到可退款的付款"),
    REFUND_EXCEEDS_PAYMENT(HttpStatus.UNPROCESSABLE_ENTITY, "退款金額超過原付款金額"),
    INVALID_AMOUNT(HttpStatus.BAD_REQUEST, "金額必須為正整數"),
    DISPUTE_NOT_FOUND(HttpStatus.NOT_FOUND, "找不到待處理的爭議");

    private final HttpStatus httpStatus;
    private final String defaultMessage;

    ErrorCode(HttpStatus httpStatus, String defaultMessage) {
        this.httpStatus = httpStatus;
        this.defaultMessage = defaultMessage;
    }
}
