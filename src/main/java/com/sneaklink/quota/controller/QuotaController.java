package com.sneaklink.quota.controller;

import com.sneaklink.quota.QuotaKind;
import com.sneaklink.quota.dto.ConsumeQuotaRequest;
import com.sneaklink.quota.dto.ConsumeQuotaResponse;
import com.sneaklink.quota.dto.QuotaBalance;
import com.sneaklink.quota.service.UsageQuotaLedger;
import com.sneaklink.shared.util.SecurityUtil;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

/**
 * 用量配額 API
 *
 * - GET  /api/quota         → 所有用量種類的餘額
 * - POST /api/quota/consume → 扣減用量（超額回 403 QUOTA_EXCEEDED）
 */
@RestController
@RequestMapping("/api/quota")
@RequiredArgsConstructor
public class QuotaController {

    private final UsageQuotaLedger ledger;

    @GetMapping
    public ResponseEntity<List<QuotaBalance>> balances() {
        String accountId = SecurityUtil.getCurrentAccountId();
        return ResponseEntity.ok(ledger.balances(accountId));
    }

    @PostMapping("/consume")
    public ResponseEntity<ConsumeQuotaResponse> consume(@Valid @RequestBody ConsumeQuotaRequest request) {
        String accountId = SecurityUtil.getCurrentAccountId();
        if (request.getKind() == QuotaKind.EXPORTS && request.getLinkCount() != null) {
            ledger.checkExportSize(accountId, request.getLinkCount());
        }
        long remaining = ledger.tryConsume(accountId, request.getKind(), request.getAmount());
        return ResponseEntity.ok(new ConsumeQuotaResponse(request.getKind(), remaining));
    }
}
