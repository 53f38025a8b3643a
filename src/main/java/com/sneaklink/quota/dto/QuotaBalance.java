package com.sneaklink.quota.dto;

import com.sneaklink.quota.QuotaKind;
import lombok.Builder;
import lombok.Data;

import java.time.LocalDateTime;

/**
 * 單一用量種類的餘額；limit / remaining 為 -1 代表不限
 */
@Data
@Builder
public class QuotaBalance {

    private QuotaKind kind;
    private long limit;
    private long used;
    private long remaining;

    /** 下次歸零時間（UTC） */
    private LocalDateTime windowEnd;
}
