package com.sneaklink.payment.gateway;

import com.sneaklink.plan.BillingCycle;

import java.util.Map;

/**
 * 建立付款頁的請求（定期扣款：付款完成後閘道依 billingCycle 自動續扣）
 *
 * @param amountMinorUnits 最小貨幣單位
 * @param accountRef       帳號識別（回傳到閘道的 client reference）
 * @param metadata         方案、週期等，原樣帶回 webhook
 */
public record ChargeRequest(
        long amountMinorUnits,
        String currency,
        BillingCycle billingCycle,
        String accountRef,
        String description,
        Map<String, String> metadata
) {
}
