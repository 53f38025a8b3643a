package com.sneaklink.subscription.dto;

import com.sneaklink.plan.BillingCycle;
import jakarta.validation.constraints.NotBlank;
import lombok.Data;

/**
 * 選擇方案請求
 */
@Data
public class SelectPlanRequest {

    /** 目標方案 ID，例如 "starter", "pro" */
    @NotBlank(message = "planId 不可為空")
    private String planId;

    /** 未指定時為 MONTHLY */
    private BillingCycle billingCycle;
}
