package com.sneaklink.plan;

/**
 * 方案的用量上限，-1 代表不限
 */
public record QuotaLimits(
        long queriesPerMonth,
        long exportsPerDay,
        long copiesPerDay,
        long maxDevices,
        long maxLinksPerExport
) {

    public static final long UNLIMITED = -1;

    public static boolean isUnlimited(long limit) {
        return limit == UNLIMITED;
    }
}
