package com.sneaklink.subscription.entity;

import com.sneaklink.plan.BillingCycle;
import com.sneaklink.shared.config.AppConstants;
import jakarta.persistence.*;
import lombok.*;

import java.time.LocalDateTime;

/**
 * 一次付款嘗試
 *
 * reference 由金流閘道產生（Stripe Checkout Session ID），原樣保存、原樣比對。
 * 同一個帳號同時最多只有一筆 INITIALIZED / VERIFYING / TIMED_OUT。
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Entity
@Table(name = "payment_attempts", indexes = {
        @Index(name = "idx_attempt_reference", columnList = "reference", unique = true),
        @Index(name = "idx_attempt_account_status", columnList = "accountId, status"),
        @Index(name = "idx_attempt_gateway_payment", columnList = "gatewayPaymentId")
})
public class PaymentAttempt {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false)
    private String reference;

    @Column(nullable = false)
    private String accountId;

    @Column(nullable = false)
    private String planId;

    @Enumerated(EnumType.STRING)
    private BillingCycle billingCycle;

    /** 預期金額（最小貨幣單位） */
    private long amountMinorUnits;

    /** ISO 4217，小寫（usd） */
    private String currency;

    @Enumerated(EnumType.STRING)
    @Builder.Default
    private Status status = Status.INITIALIZED;

    /** 失敗原因（ErrorCode 名稱） */
    private String failureCode;

    /** 付款頁 URL */
    @Column(length = 1024)
    private String redirectUrl;

    /** 閘道端的付款 ID（Stripe PaymentIntent pi_xxx / Invoice in_xxx），退款與爭議對應用 */
    private String gatewayPaymentId;

    private LocalDateTime verifiedAt;
    private LocalDateTime createdAt;
    private LocalDateTime updatedAt;

    public enum Status {
        INITIALIZED,  // 已建立付款頁，等待付款 / 驗證
        VERIFYING,    // 正在向閘道查詢
        SUCCEEDED,    // 已確認付款
        FAILED,       // 失敗或被新選擇取代
        TIMED_OUT;    // 閘道逾時，可用同一 reference 重試

        public boolean isTerminal() {
            return this == SUCCEEDED || this == FAILED;
        }

        public boolean isInFlight() {
            return !isTerminal();
        }
    }

    @PrePersist
    protected void onCreate() {
        createdAt = LocalDateTime.now(AppConstants.ZONE_ID);
        updatedAt = LocalDateTime.now(AppConstants.ZONE_ID);
    }

    @PreUpdate
    protected void onUpdate() {
        updatedAt = LocalDateTime.now(AppConstants.ZONE_ID);
    }
}
