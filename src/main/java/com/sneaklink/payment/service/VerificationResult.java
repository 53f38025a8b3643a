package com.sneaklink.payment.service;

import com.sneaklink.shared.exception.ErrorCode;
import com.sneaklink.subscription.entity.PaymentAttempt;
import com.sneaklink.subscription.entity.Subscription;

/**
 * 付款驗證結果
 *
 * @param status             付款最新狀態
 * @param errorCode          未成功時的原因；成功時為 null
 * @param subscriptionStatus 驗證後的訂閱狀態
 * @param planId             這筆付款對應的方案
 */
public record VerificationResult(
        String reference,
        PaymentAttempt.Status status,
        ErrorCode errorCode,
        Subscription.Status subscriptionStatus,
        String planId
) {

    public boolean succeeded() {
        return status == PaymentAttempt.Status.SUCCEEDED;
    }

    /** 可以用同一個 reference 再驗證一次 */
    public boolean retryable() {
        return status == PaymentAttempt.Status.TIMED_OUT || status == PaymentAttempt.Status.INITIALIZED;
    }
}
