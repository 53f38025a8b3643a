package com.sneaklink.quota.dto;

import com.sneaklink.quota.QuotaKind;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import lombok.Data;

/**
 * 扣減用量請求
 */
@Data
public class ConsumeQuotaRequest {

    @NotNull(message = "kind 不可為空")
    private QuotaKind kind;

    @Min(value = 1, message = "amount 至少為 1")
    private long amount = 1;

    /** 匯出時附帶的連結數，檢查單次匯出上限用 */
    private Integer linkCount;
}
