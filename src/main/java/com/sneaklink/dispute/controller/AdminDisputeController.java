package com.sneaklink.dispute.controller;

import com.sneaklink.dispute.dto.DisputeResponse;
import com.sneaklink.dispute.dto.RefundRequest;
import com.sneaklink.dispute.dto.RejectDisputeRequest;
import com.sneaklink.dispute.entity.DisputeOrRefund;
import com.sneaklink.dispute.service.DisputeRefundReconciler;
import com.sneaklink.shared.util.SecurityUtil;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

/**
 * 管理員爭議 / 退款 API（ROLE_ADMIN）
 *
 * - GET  /api/admin/disputes?resolution=PENDING   → 爭議列表
 * - POST /api/admin/payments/{reference}/refund   → 退款並撤銷權益
 * - POST /api/admin/disputes/{id}/reject          → 駁回爭議
 */
@Slf4j
@RestController
@RequestMapping("/api/admin")
@RequiredArgsConstructor
public class AdminDisputeController {

    private final DisputeRefundReconciler reconciler;

    @GetMapping("/disputes")
    public ResponseEntity<List<DisputeResponse>> listDisputes(
            @RequestParam(required = false) DisputeOrRefund.Resolution resolution) {
        return ResponseEntity.ok(reconciler.listDisputes(resolution));
    }

    @PostMapping("/payments/{reference}/refund")
    public ResponseEntity<DisputeResponse> refund(@PathVariable String reference,
                                                  @Valid @RequestBody RefundRequest request) {
        log.info("管理員發起退款: admin={} accountId={} ref={} amount={}",
                SecurityUtil.getCurrentAccountId(), request.getAccountId(), reference, request.getAmountMinorUnits());
        DisputeOrRefund refund = reconciler.applyRefund(
                request.getAccountId(), reference, request.getAmountMinorUnits(), request.getNote());
        return ResponseEntity.ok(reconciler.toResponse(refund));
    }

    @PostMapping("/disputes/{id}/reject")
    public ResponseEntity<DisputeResponse> reject(@PathVariable Long id,
                                                  @RequestBody(required = false) RejectDisputeRequest request) {
        String note = request != null ? request.getNote() : null;
        return ResponseEntity.ok(reconciler.toResponse(reconciler.rejectDispute(id, note)));
    }
}
