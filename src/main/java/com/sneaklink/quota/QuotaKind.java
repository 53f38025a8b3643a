package com.sneaklink.quota;

import com.sneaklink.plan.QuotaLimits;

/**
 * 可計量的用量種類
 *
 * QUERIES 以計費週期（月）為窗口，EXPORTS / COPIES 以 UTC 日為窗口。
 */
public enum QuotaKind {

    QUERIES(true),
    EXPORTS(false),
    COPIES(false);

    private final boolean monthly;

    QuotaKind(boolean monthly) {
        this.monthly = monthly;
    }

    public boolean isMonthly() {
        return monthly;
    }

    public long limitOf(QuotaLimits limits) {
        return switch (this) {
            case QUERIES -> limits.queriesPerMonth();
            case EXPORTS -> limits.exportsPerDay();
            case COPIES -> limits.copiesPerDay();
        };
    }
}
