package com.sneaklink.subscription.dto;

import com.sneaklink.plan.BillingCycle;
import lombok.Builder;
import lombok.Data;

/**
 * 選擇方案的結果：前端導向 redirectUrl 付款，完成後帶 reference 呼叫 verify
 */
@Data
@Builder
public class PlanSelection {

    private String reference;
    private String redirectUrl;
    private long amountMinorUnits;
    private String currency;
    private String planId;
    private BillingCycle billingCycle;
}
