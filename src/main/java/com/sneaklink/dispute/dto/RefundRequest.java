package com.sneaklink.dispute.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.Data;

/**
 * 管理員退款請求
 */
@Data
public class RefundRequest {

    /** 付款所屬帳號 */
    @NotBlank(message = "accountId 不可為空")
    private String accountId;

    /** 退款金額（最小貨幣單位） */
    @NotNull(message = "amountMinorUnits 不可為空")
    private Long amountMinorUnits;

    private String note;
}
