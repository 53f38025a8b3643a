package com.sneaklink.account;

import com.sneaklink.plan.QuotaLimits;
import com.sneaklink.subscription.entity.Subscription;

import java.time.LocalDateTime;

/**
 * 帳號目前實際生效的權益（已套用到期 / 取消的 lazy 判斷）
 *
 * @param planId          生效方案；非 ACTIVE / EXPIRING 時一律是 free
 * @param nextBillingDate 月配額窗口的錨點，沒有時為 null
 */
public record Entitlement(
        String accountId,
        String planId,
        Subscription.Status status,
        QuotaLimits limits,
        LocalDateTime nextBillingDate,
        LocalDateTime evaluatedAt
) {
}
