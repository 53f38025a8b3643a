package com.sneaklink.plan;

/**
 * 方案定義（目錄內建，執行期不會修改）
 *
 * 價格一律為最小貨幣單位（USD cents）。年繳 = 月繳 × 10。
 *
 * @param tier 排序用，數字越大方案越高
 */
public record Plan(
        String id,
        String displayName,
        long monthlyPrice,
        long annualPrice,
        QuotaLimits limits,
        int tier
) {

    public static final String FREE = "free";

    public boolean isFree() {
        return FREE.equals(id);
    }

    public long priceFor(BillingCycle cycle) {
        return cycle == BillingCycle.ANNUAL ? annualPrice : monthlyPrice;
    }
}
