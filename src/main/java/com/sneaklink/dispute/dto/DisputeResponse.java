package com.sneaklink.dispute.dto;

import com.sneaklink.dispute.entity.DisputeOrRefund;
import lombok.Builder;
import lombok.Data;

import java.math.BigDecimal;
import java.time.LocalDateTime;

/**
 * 爭議 / 退款紀錄（管理後台用），displayAmount 為讀取時換算的報表幣別金額
 */
@Data
@Builder
public class DisputeResponse {

    private Long id;
    private String paymentReference;
    private String accountId;
    private DisputeOrRefund.Kind kind;
    private long amountMinorUnits;
    private BigDecimal displayAmount;
    private String displayCurrency;
    private String reasonNote;
    private DisputeOrRefund.Resolution resolution;
    private String gatewayReference;
    private LocalDateTime createdAt;
    private LocalDateTime resolvedAt;
}
