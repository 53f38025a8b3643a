package com.sneaklink.subscription.entity;

import com.sneaklink.plan.BillingCycle;
import com.sneaklink.shared.config.AppConstants;
import jakarta.persistence.*;
import lombok.*;

import java.time.LocalDateTime;

/**
 * 帳號訂閱（每個帳號一筆，首次選方案時建立，之後只由 SubscriptionService 修改，不刪除）
 *
 * nextBillingDate 只有在 NONE / CANCELLED / REFUNDED 時為 null；
 * PENDING 記錄帶的是「付款成功後」預計的下次計費日。
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Entity
@Table(name = "subscriptions", indexes = {
        @Index(name = "idx_sub_account_id", columnList = "accountId", unique = true),
        @Index(name = "idx_sub_pending_ref", columnList = "pendingPaymentReference"),
        @Index(name = "idx_sub_gateway_sub_id", columnList = "gatewaySubscriptionId")
})
public class Subscription {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false)
    private String accountId;

    /** 方案 ID（free / starter / pro / enterprise） */
    @Column(nullable = false)
    private String planId;

    @Enumerated(EnumType.STRING)
    @Builder.Default
    private BillingCycle billingCycle = BillingCycle.MONTHLY;

    @Enumerated(EnumType.STRING)
    @Builder.Default
    private Status status = Status.NONE;

    private LocalDateTime startDate;

    private LocalDateTime nextBillingDate;

    @Builder.Default
    private boolean autoRenew = false;

    /** 最後一筆確認成功的付款 */
    private String lastPaymentReference;

    /** 目前進行中的付款（只有這一筆可以啟用訂閱） */
    private String pendingPaymentReference;

    /** 閘道端的定期扣款訂閱（Stripe sub_xxx）；取消 / 退款後清空 */
    private String gatewaySubscriptionId;

    private LocalDateTime createdAt;
    private LocalDateTime updatedAt;

    public enum Status {
        NONE,       // 沒有付費方案
        PENDING,    // 等待付款確認
        ACTIVE,     // 付費生效中
        EXPIRING,   // 已關閉自動續費，即將到期
        CANCELLED,  // 到期未續費
        REFUNDED;   // 已退款，權益撤銷

        /** 是否享有付費方案權益 */
        public boolean isEntitled() {
            return this == ACTIVE || this == EXPIRING;
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
