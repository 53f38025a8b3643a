package com.sneaklink.plan;

import java.time.LocalDateTime;

/**
 * 計費週期
 */
public enum BillingCycle {

    MONTHLY {
        @Override
        public LocalDateTime advance(LocalDateTime from) {
            return from.plusMonths(1);
        }
    },
    ANNUAL {
        @Override
        public LocalDateTime advance(LocalDateTime from) {
            return from.plusYears(1);
        }
    };

    /**
     * 往後推一個週期（1/31 + 1 個月 = 2/28，由 java.time 處理月底）
     */
    public abstract LocalDateTime advance(LocalDateTime from);
}
