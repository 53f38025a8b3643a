package com.sneaklink.dispute.service;

import com.sneaklink.account.AccountStore;
import com.sneaklink.account.EntitlementCache;
import com.sneaklink.dispute.dto.DisputeResponse;
import com.sneaklink.dispute.entity.DisputeOrRefund;
import com.sneaklink.notification.event.EventType;
import com.sneaklink.notification.service.EntitlementEventPublisher;
import com.sneaklink.payment.gateway.GatewayException;
import com.sneaklink.payment.gateway.GatewayRefund;
import com.sneaklink.payment.gateway.GatewayTransaction;
import com.sneaklink.payment.gateway.PaymentGatewayClient;
import com.sneaklink.payment.service.DisplayCurrencyConverter;
import com.sneaklink.plan.PlanCatalog;
import com.sneaklink.quota.service.UsageQuotaLedger;
import com.sneaklink.shared.exception.EntitlementException;
import com.sneaklink.shared.exception.ErrorCode;
import com.sneaklink.shared.service.AccountLockRegistry;
import com.sneaklink.shared.service.AuditService;
import com.sneaklink.subscription.entity.PaymentAttempt;
import com.sneaklink.subscription.service.SubscriptionService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;

/**
 * 爭議 / 退款對帳
 *
 * - 退款：閘道確認後才撤銷權益（訂閱 → REFUNDED、配額降回 free），部分退款也整筆撤銷
 * - 被取代但已收款的付款（FAILED / SUPERSEDED）也可退款，只退錢不動目前的訂閱
 * - 爭議：只記錄，不動權益；管理員之後退款（自動結案）或駁回
 *
 * 同一筆付款的退款與爭議以 refund:{reference} 鎖串行。
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class DisputeRefundReconciler {

    private final AccountStore accountStore;
    private final SubscriptionService subscriptionService;
    private final PaymentGatewayClient gatewayClient;
    private final UsageQuotaLedger ledger;
    private final PlanCatalog planCatalog;
    private final EntitlementCache entitlementCache;
    private final AccountLockRegistry lockRegistry;
    private final EntitlementEventPublisher eventPublisher;
    private final AuditService auditService;
    private final DisplayCurrencyConverter currencyConverter;
    private final Clock clock;

    /**
     * 退款並撤銷權益
     *
     * 付款若是被取代的（沒有啟用過訂閱），只退款，不撤銷目前方案。
     *
     * @throws EntitlementException INVALID_AMOUNT / NO_SUCH_PAYMENT / REFUND_EXCEEDS_PAYMENT / GATEWAY_REJECTED
     */
    public DisputeOrRefund applyRefund(String accountId, String paymentReference,
                                       long amountMinorUnits, String note) {
        if (amountMinorUnits <= 0) {
            throw new EntitlementException(ErrorCode.INVALID_AMOUNT, "退款金額必須為正整數: " + amountMinorUnits);
        }

        ReentrantLock lock = lockRegistry.refundLock(paymentReference);
        lock.lock();
        try {
            PaymentAttempt payment = accountStore.findAttempt(paymentReference)
                    .filter(a -> accountId.equals(a.getAccountId()))
                    .filter(a -> a.getStatus() == PaymentAttempt.Status.SUCCEEDED || isSuperseded(a))
                    .orElseThrow(() -> new EntitlementException(ErrorCode.NO_SUCH_PAYMENT,
                            "帳號 " + accountId + " 沒有成功的付款 " + paymentReference));
            boolean revokesEntitlement = payment.getStatus() == PaymentAttempt.Status.SUCCEEDED;
            if (!revokesEntitlement) {
                confirmCapturedAtGateway(payment);
            }

            long alreadyRefunded = accountStore.sumResolvedRefunds(paymentReference);
            if (alreadyRefunded + amountMinorUnits > payment.getAmountMinorUnits()) {
                throw new EntitlementException(ErrorCode.REFUND_EXCEEDS_PAYMENT, String.format(
                        "退款金額 %d 超過可退金額 %d（付款 %d，已退 %d）",
                        amountMinorUnits, payment.getAmountMinorUnits() - alreadyRefunded,
                        payment.getAmountMinorUnits(), alreadyRefunded));
            }

            GatewayRefund refund;
            try {
                refund = gatewayClient.refund(paymentReference, amountMinorUnits, note);
            } catch (GatewayException e) {
                auditService.failure(accountId, "REFUND", paymentReference, e.getMessage());
                ErrorCode code = e.isTransientFailure() ? ErrorCode.GATEWAY_TIMEOUT : ErrorCode.GATEWAY_REJECTED;
                throw new EntitlementException(code, "閘道退款失敗: " + e.getMessage(), e);
            }
            if (!refund.confirmed()) {
                auditService.failure(accountId, "REFUND", paymentReference, "status=" + refund.rawStatus());
                throw new EntitlementException(ErrorCode.GATEWAY_REJECTED,
                        "閘道未接受退款: status=" + refund.rawStatus());
            }

            if (revokesEntitlement) {
                subscriptionService.revoke(accountId, paymentReference);
                entitlementCache.invalidate(accountId);
                ledger.applyPlanLimits(accountId, planCatalog.free());
            }

            LocalDateTime now = LocalDateTime.now(clock);
            for (DisputeOrRefund dispute : accountStore.findPendingDisputes(paymentReference)) {
                dispute.setResolution(DisputeOrRefund.Resolution.RESOLVED);
                dispute.setResolvedAt(now);
                accountStore.putDisputeOrRefund(dispute);
                log.info("爭議已隨退款結案: disputeId={} ref={}", dispute.getId(), paymentReference);
            }

            DisputeOrRefund record = accountStore.putDisputeOrRefund(DisputeOrRefund.builder()
                    .paymentReference(paymentReference)
                    .accountId(accountId)
                    .kind(DisputeOrRefund.Kind.REFUND)
                    .amountMinorUnits(amountMinorUnits)
                    .reasonNote(note)
                    .resolution(DisputeOrRefund.Resolution.RESOLVED)
                    .gatewayReference(refund.refundId())
                    .createdAt(now)
                    .resolvedAt(now)
                    .build());

            boolean partial = alreadyRefunded + amountMinorUnits < payment.getAmountMinorUnits();
            if (revokesEntitlement) {
                log.info("退款完成，權益已撤銷: accountId={} ref={} amount={} refundId={} partial={}",
                        accountId, paymentReference, amountMinorUnits, refund.refundId(), partial);
            } else {
                log.info("被取代付款已退款，訂閱不變: accountId={} ref={} amount={} refundId={} partial={}",
                        accountId, paymentReference, amountMinorUnits, refund.refundId(), partial);
            }
            eventPublisher.publish(EventType.SUBSCRIPTION_REFUNDED, accountId, Map.of(
                    "reference", paymentReference,
                    "amount", amountMinorUnits,
                    "refundId", refund.refundId(),
                    "partial", partial,
                    "entitlementRevoked", revokesEntitlement));
            auditService.success(accountId, "REFUND", paymentReference,
                    "amount=" + amountMinorUnits + " refundId=" + refund.refundId());
            return record;
        } finally {
            lock.unlock();
        }
    }

    private static boolean isSuperseded(PaymentAttempt attempt) {
        return attempt.getStatus() == PaymentAttempt.Status.FAILED
                && ErrorCode.SUPERSEDED.name().equals(attempt.getFailureCode());
    }

    /**
     * 被取代的付款只有在閘道確實收款時才能退
     *
     * 驗證時已確認收款的會帶 gatewayPaymentId；選方案時就被取代的沒查過閘道，這裡補查一次並記下付款 ID。
     */
    private void confirmCapturedAtGateway(PaymentAttempt payment) {
        if (payment.getGatewayPaymentId() != null) {
            return;
        }
        GatewayTransaction tx;
        try {
            tx = gatewayClient.lookupTransaction(payment.getReference());
        } catch (GatewayException e) {
            ErrorCode code = e.isTransientFailure() ? ErrorCode.GATEWAY_TIMEOUT : ErrorCode.GATEWAY_REJECTED;
            throw new EntitlementException(code, "查詢被取代付款失敗: " + e.getMessage(), e);
        }
        if (tx.status() != GatewayTransaction.Status.PAID) {
            throw new EntitlementException(ErrorCode.NO_SUCH_PAYMENT,
                    "付款 " + payment.getReference() + " 已被取代且閘道未收款，無需退款");
        }
        payment.setGatewayPaymentId(tx.paymentId());
        accountStore.putAttempt(payment);
    }

    /**
     * 記錄閘道送來的爭議（不動權益）
     *
     * 同一筆付款、同一個閘道爭議 ID 重複送達時回傳既有的 PENDING 紀錄。
     *
     * @param paymentReference 付款參考編號，或閘道端付款 ID（pi_xxx）
     * @param gatewayReference 閘道爭議 ID，可為 null
     * @param amountMinorUnits 爭議金額；不明時傳 0，改用原付款金額
     */
    public DisputeOrRefund recordDispute(String paymentReference, String reasonNote,
                                         String gatewayReference, long amountMinorUnits) {
        Optional<PaymentAttempt> payment = accountStore.findAttempt(paymentReference)
                .or(() -> accountStore.findAttemptByGatewayPaymentId(paymentReference));
        String reference = payment.map(PaymentAttempt::getReference).orElse(paymentReference);
        String accountId = payment.map(PaymentAttempt::getAccountId).orElse(null);

        ReentrantLock lock = lockRegistry.refundLock(reference);
        lock.lock();
        try {
            Optional<DisputeOrRefund> existing = accountStore.findPendingDisputes(reference).stream()
                    .filter(d -> gatewayReference == null || gatewayReference.equals(d.getGatewayReference()))
                    .findFirst();
            if (existing.isPresent()) {
                log.info("爭議重複送達，沿用既有紀錄: disputeId={} ref={}", existing.get().getId(), reference);
                return existing.get();
            }
            if (payment.isEmpty()) {
                log.warn("爭議對應不到任何付款，仍先記錄: ref={} gatewayRef={}", paymentReference, gatewayReference);
            }

            long amount = amountMinorUnits > 0
                    ? amountMinorUnits
                    : payment.map(PaymentAttempt::getAmountMinorUnits).orElse(0L);
            DisputeOrRefund dispute = accountStore.putDisputeOrRefund(DisputeOrRefund.builder()
                    .paymentReference(reference)
                    .accountId(accountId)
                    .kind(DisputeOrRefund.Kind.DISPUTE)
                    .amountMinorUnits(amount)
                    .reasonNote(reasonNote)
                    .resolution(DisputeOrRefund.Resolution.PENDING)
                    .gatewayReference(gatewayReference)
                    .createdAt(LocalDateTime.now(clock))
                    .build());

            log.warn("收到付款爭議: disputeId={} accountId={} ref={} amount={} reason={}",
                    dispute.getId(), accountId, reference, amount, reasonNote);
            Map<String, Object> attrs = new HashMap<>();
            attrs.put("reference", reference);
            attrs.put("amount", amount);
            attrs.put("reason", reasonNote != null ? reasonNote : "");
            eventPublisher.publish(EventType.DISPUTE_RECORDED, accountId, attrs);
            auditService.success(accountId, "DISPUTE", reference, reasonNote);
            return dispute;
        } finally {
            lock.unlock();
        }
    }

    public DisputeOrRefund recordDispute(String paymentReference, String reasonNote) {
        return recordDispute(paymentReference, reasonNote, null, 0);
    }

    /**
     * 駁回爭議（只改 resolution，不動權益）
     *
     * @throws EntitlementException DISPUTE_NOT_FOUND 不存在或已不是 PENDING
     */
    public DisputeOrRefund rejectDispute(Long disputeId, String note) {
        DisputeOrRefund dispute = accountStore.findDisputeOrRefund(disputeId)
                .filter(d -> d.getKind() == DisputeOrRefund.Kind.DISPUTE)
                .orElseThrow(() -> new EntitlementException(ErrorCode.DISPUTE_NOT_FOUND,
                        "找不到爭議: " + disputeId));

        ReentrantLock lock = lockRegistry.refundLock(dispute.getPaymentReference());
        lock.lock();
        try {
            DisputeOrRefund current = accountStore.findDisputeOrRefund(disputeId).orElse(dispute);
            if (current.getResolution() != DisputeOrRefund.Resolution.PENDING) {
                throw new EntitlementException(ErrorCode.DISPUTE_NOT_FOUND,
                        "爭議 " + disputeId + " 已是 " + current.getResolution());
            }
            current.setResolution(DisputeOrRefund.Resolution.REJECTED);
            current.setResolvedAt(LocalDateTime.now(clock));
            if (note != null && !note.isBlank()) {
                current.setReasonNote(current.getReasonNote() == null
                        ? note
                        : current.getReasonNote() + "\n[駁回] " + note);
            }
            DisputeOrRefund saved = accountStore.putDisputeOrRefund(current);
            log.info("爭議已駁回: disputeId={} ref={}", disputeId, current.getPaymentReference());
            auditService.success(current.getAccountId(), "DISPUTE_REJECTED", current.getPaymentReference(), note);
            return saved;
        } finally {
            lock.unlock();
        }
    }

    /**
     * 爭議列表
     *
     * @param resolution null = 全部
     */
    public List<DisputeResponse> listDisputes(DisputeOrRefund.Resolution resolution) {
        return accountStore.listDisputes(resolution).stream()
                .map(this::toResponse)
                .toList();
    }

    public DisputeResponse toResponse(DisputeOrRefund record) {
        return DisputeResponse.builder()
                .id(record.getId())
                .paymentReference(record.getPaymentReference())
                .accountId(record.getAccountId())
                .kind(record.getKind())
                .amountMinorUnits(record.getAmountMinorUnits())
                .displayAmount(currencyConverter.displayAmount(record.getAmountMinorUnits()))
                .displayCurrency(currencyConverter.getDisplayCurrency())
                .reasonNote(record.getReasonNote())
                .resolution(record.getResolution())
                .gatewayReference(record.getGatewayReference())
                .createdAt(record.getCreatedAt())
                .resolvedAt(record.getResolvedAt())
                .build();
    }
}
