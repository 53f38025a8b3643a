package com.sneaklink.subscription.controller;

import com.sneaklink.account.EntitlementCache;
import com.sneaklink.payment.service.PaymentVerificationCoordinator;
import com.sneaklink.payment.service.StripeWebhookService;
import com.sneaklink.payment.service.VerificationResult;
import com.sneaklink.plan.PlanCatalog;
import com.sneaklink.plan.dto.PlanResponse;
import com.sneaklink.quota.service.UsageQuotaLedger;
import com.sneaklink.shared.dto.ErrorResponse;
import com.sneaklink.shared.util.SecurityUtil;
import com.sneaklink.subscription.dto.*;
import com.sneaklink.subscription.service.SubscriptionService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Map;

/**
 * 訂閱管理 API
 *
 * 路徑：/api/subscription
 *
 * 端點：
 * - GET  /plans             → 方案列表（current 標記目前生效方案）
 * - GET  /status            → 當前訂閱狀態
 * - POST /select            → 選擇方案，回傳付款頁 URL 與 reference
 * - POST /verify            → 付款完成後驗證（可用同一 reference 重試）
 * - POST /toggle-auto-renew → 切換自動續費
 * - POST /cancel            → 立即取消訂閱（停止扣款，權益回到 free，不退款）
 * - POST /webhook           → Stripe Webhook 回調（公開端點，Stripe 伺服器直接呼叫）
 */
@Slf4j
@RestController
@RequestMapping("/api/subscription")
@RequiredArgsConstructor
public class SubscriptionController {

    private final SubscriptionService subscriptionService;
    private final PaymentVerificationCoordinator coordinator;
    private final StripeWebhookService webhookService;
    private final EntitlementCache entitlementCache;
    private final UsageQuotaLedger ledger;
    private final PlanCatalog planCatalog;

    @GetMapping("/plans")
    public ResponseEntity<List<PlanResponse>> getPlans() {
        String accountId = SecurityUtil.getCurrentAccountId();
        return ResponseEntity.ok(subscriptionService.listPlans(accountId));
    }

    @GetMapping("/status")
    public ResponseEntity<SubscriptionStatusResponse> getStatus() {
        String accountId = SecurityUtil.getCurrentAccountId();
        return ResponseEntity.ok(subscriptionService.getSubscription(accountId));
    }

    /**
     * 選擇方案
     * POST /api/subscription/select
     * Body: {@link SelectPlanRequest}
     */
    @PostMapping("/select")
    public ResponseEntity<PlanSelection> selectPlan(@Valid @RequestBody SelectPlanRequest request) {
        String accountId = SecurityUtil.getCurrentAccountId();
        return ResponseEntity.ok(subscriptionService.selectPlan(
                accountId, request.getPlanId(), request.getBillingCycle()));
    }

    /**
     * 驗證付款
     * POST /api/subscription/verify
     *
     * 未成功時 HTTP 狀態碼對應 errorCode（例如逾時 504、金額不符 409），body 仍是驗證結果。
     */
    @PostMapping("/verify")
    public ResponseEntity<VerificationResult> verify(@Valid @RequestBody VerifyPaymentRequest request) {
        VerificationResult result = coordinator.verify(request.getReference());
        if (result.errorCode() != null) {
            return ResponseEntity.status(result.errorCode().getHttpStatus()).body(result);
        }
        return ResponseEntity.ok(result);
    }

    @PostMapping("/toggle-auto-renew")
    public ResponseEntity<AutoRenewResponse> toggleAutoRenew() {
        String accountId = SecurityUtil.getCurrentAccountId();
        return ResponseEntity.ok(new AutoRenewResponse(subscriptionService.toggleAutoRenew(accountId)));
    }

    /**
     * 取消訂閱
     * POST /api/subscription/cancel
     */
    @PostMapping("/cancel")
    public ResponseEntity<SubscriptionStatusResponse> cancel() {
        String accountId = SecurityUtil.getCurrentAccountId();
        subscriptionService.cancelSubscription(accountId);
        entitlementCache.invalidate(accountId);
        ledger.applyPlanLimits(accountId, planCatalog.free());
        return ResponseEntity.ok(subscriptionService.getSubscription(accountId));
    }

    /**
     * Stripe Webhook 回調（公開端點，Stripe 伺服器直接呼叫）
     * POST /api/subscription/webhook
     */
    @PostMapping("/webhook")
    public ResponseEntity<?> stripeWebhook(
            @RequestBody String payload,
            @RequestHeader("Stripe-Signature") String sigHeader) {
        try {
            webhookService.handleStripeWebhook(payload, sigHeader);
            return ResponseEntity.ok(Map.of("received", true));
        } catch (IllegalArgumentException e) {
            log.error("Stripe Webhook 處理失敗: {}", e.getMessage());
            return ResponseEntity.badRequest()
                    .body(ErrorResponse.builder()
                            .error("Webhook 處理失敗")
                            .message(e.getMessage())
                            .build());
        }
    }
}
