package com.sneaklink.shared.entity;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

/**
 * 審計日誌實體
 *
 * 所有動到錢或權益的狀態轉換都留一筆：
 * - accountId=acc-1, action=SELECT_PLAN, reference=cs_test_123, result=SUCCESS
 * - accountId=acc-1, action=ACTIVATE, reference=cs_test_123, result=SUCCESS
 * - accountId=acc-1, action=REFUND, reference=cs_test_123, result=FAILED (GATEWAY_REJECTED)
 */
@Entity
@Table(name = "audit_logs", indexes = {
        @Index(name = "idx_audit_account_id", columnList = "account_id"),
        @Index(name = "idx_audit_timestamp", columnList = "timestamp"),
        @Index(name = "idx_audit_action", columnList = "action"),
        @Index(name = "idx_audit_reference", columnList = "reference")
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AuditLog {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    /** 受影響的帳號（webhook 找不到帳號時可為 null） */
    @Column(name = "account_id", length = 64)
    private String accountId;

    /**
     * 操作類型
     * - SELECT_PLAN / ACTIVATE / VERIFY_FAILED
     * - RENEWAL / REFUND / DISPUTE / DISPUTE_REJECTED
     */
    @Column(name = "action", length = 50, nullable = false)
    private String action;

    /** 付款參考編號或爭議 ID */
    @Column(name = "reference", length = 255)
    private String reference;

    /** SUCCESS 或 FAILED */
    @Column(name = "result", length = 20, nullable = false)
    private String result;

    @Column(name = "timestamp", nullable = false)
    private LocalDateTime timestamp;

    /** 失敗原因或額外上下文（方案、金額） */
    @Column(name = "details", columnDefinition = "TEXT")
    private String details;
}
