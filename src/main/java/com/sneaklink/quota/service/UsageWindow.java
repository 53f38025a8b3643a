package com.sneaklink.quota.service;

import com.sneaklink.quota.QuotaKind;

import java.time.LocalDateTime;
import java.time.YearMonth;

/**
 * 用量窗口計算
 *
 * - 每日窗口：UTC 00:00 到隔天 00:00
 * - 每月窗口：以計費日的「日」為錨點（超過當月天數時取月底），沒有計費日時用每月 1 號
 */
record UsageWindow(LocalDateTime start, LocalDateTime end) {

    static UsageWindow containing(QuotaKind kind, LocalDateTime now, LocalDateTime billingAnchor) {
        if (!kind.isMonthly()) {
            LocalDateTime start = now.toLocalDate().atStartOfDay();
            return new UsageWindow(start, start.plusDays(1));
        }
        int anchorDay = billingAnchor != null ? billingAnchor.getDayOfMonth() : 1;
        YearMonth month = YearMonth.from(now);
        LocalDateTime start = anchorIn(month, anchorDay);
        if (start.isAfter(now)) {
            month = month.minusMonths(1);
            start = anchorIn(month, anchorDay);
        }
        return new UsageWindow(start, anchorIn(month.plusMonths(1), anchorDay));
    }

    private static LocalDateTime anchorIn(YearMonth month, int anchorDay) {
        return month.atDay(Math.min(anchorDay, month.lengthOfMonth())).atStartOfDay();
    }
}
