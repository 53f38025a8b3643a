package com.sneaklink.shared.service;

import com.sneaklink.shared.config.AppConstants;
import com.sneaklink.shared.entity.AuditLog;
import com.sneaklink.shared.repository.AuditLogRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Async;
import org.springframework.stereotype.Service;

import java.time.LocalDateTime;

/**
 * 審計服務
 *
 * 記錄方案選擇、啟用、續費、退款、爭議等動到權益的操作。
 * 所有記錄都是非同步的，不會阻礙主業務邏輯。
 *
 * 使用範例：
 * - auditService.success(accountId, "ACTIVATE", reference, "plan=pro cycle=MONTHLY");
 * - auditService.failure(accountId, "REFUND", reference, "GATEWAY_REJECTED");
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class AuditService {

    public static final String SUCCESS = "SUCCESS";
    public static final String FAILED = "FAILED";

    private final AuditLogRepository auditLogRepository;

    /**
     * 記錄審計日誌（非同步）
     *
     * @param accountId 受影響帳號
     * @param action    操作類型（SELECT_PLAN, ACTIVATE, REFUND 等）
     * @param reference 付款參考編號 / 爭議 ID
     * @param result    SUCCESS 或 FAILED
     * @param details   詳細信息
     */
    @Async
    public void log(String accountId, String action, String reference,
                    String result, String details) {
        try {
            AuditLog auditLog = AuditLog.builder()
                    .accountId(accountId)
                    .action(action)
                    .reference(reference)
                    .result(result)
                    .timestamp(LocalDateTime.now(AppConstants.ZONE_ID))
                    .details(details)
                    .build();

            auditLogRepository.save(auditLog);
            log.debug("審計日誌記錄: action={} result={} accountId={} ref={}", action, result, accountId, reference);
        } catch (Exception e) {
            // 審計失敗不應中斷主業務，但要記錄
            log.error("審計日誌記錄失敗: action={} ref={}", action, reference, e);
        }
    }

    @Async
    public void success(String accountId, String action, String reference, String details) {
        this.log(accountId, action, reference, SUCCESS, details);
    }

    @Async
    public void failure(String accountId, String action, String reference, String reason) {
        this.log(accountId, action, reference, FAILED, reason);
    }
}
