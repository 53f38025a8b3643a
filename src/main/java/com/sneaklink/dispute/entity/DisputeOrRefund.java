package com.sneaklink.dispute.entity;

import com.sneaklink.shared.config.AppConstants;
import jakarta.persistence.*;
import lombok.*;

import java.time.LocalDateTime;

/**
 * 爭議或退款紀錄
 *
 * DISPUTE 來自閘道 webhook，只記錄不動權益；
 * REFUND 由管理員發起，閘道確認後才寫入（resolution = RESOLVED）。
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Entity
@Table(name = "disputes_refunds", indexes = {
        @Index(name = "idx_dr_payment_ref", columnList = "paymentReference"),
        @Index(name = "idx_dr_resolution", columnList = "resolution")
})
public class DisputeOrRefund {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false)
    private String paymentReference;

    private String accountId;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    private Kind kind;

    private long amountMinorUnits;

    @Column(columnDefinition = "TEXT")
    private String reasonNote;

    @Enumerated(EnumType.STRING)
    @Builder.Default
    private Resolution resolution = Resolution.PENDING;

    /** 閘道端 ID（dp_xxx / re_xxx） */
    private String gatewayReference;

    private LocalDateTime resolvedAt;
    private LocalDateTime createdAt;

    public enum Kind {
        DISPUTE,
        REFUND
    }

    public enum Resolution {
        PENDING,
        RESOLVED,
        REJECTED
    }

    @PrePersist
    protected void onCreate() {
        if (createdAt == null) {
            createdAt = LocalDateTime.now(AppConstants.ZONE_ID);
        }
    }
}
