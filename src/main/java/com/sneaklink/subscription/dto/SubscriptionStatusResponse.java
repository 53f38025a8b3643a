package com.sneaklink.subscription.dto;

import com.sneaklink.plan.BillingCycle;
import lombok.Builder;
import lombok.Data;

import java.time.LocalDateTime;

@Data
@Builder
public class SubscriptionStatusResponse {

    /** 訂閱記錄上的方案 */
    private String planId;
    private String planName;

    /** 實際套用限制的方案（非 ACTIVE / EXPIRING 時為 free） */
    private String effectivePlanId;

    private String status;
    private BillingCycle billingCycle;
    private LocalDateTime startDate;
    private LocalDateTime nextBillingDate;
    private boolean autoRenew;
    private boolean active;

    /** 進行中的付款參考編號 */
    private String pendingPaymentReference;
}
