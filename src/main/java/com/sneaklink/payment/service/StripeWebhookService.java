package com.sneaklink.payment.service;

import com.sneaklink.account.AccountStore;
import com.sneaklink.account.EntitlementCache;
import com.sneaklink.dispute.service.DisputeRefundReconciler;
import com.sneaklink.payment.config.StripeConfig;
import com.sneaklink.shared.exception.EntitlementException;
import com.sneaklink.shared.exception.ErrorCode;
import com.sneaklink.subscription.entity.PaymentAttempt;
import com.sneaklink.subscription.entity.Subscription;
import com.sneaklink.subscription.service.SubscriptionService;
import com.stripe.exception.SignatureVerificationException;
import com.stripe.model.Dispute;
import com.stripe.model.Event;
import com.stripe.model.Invoice;
import com.stripe.model.StripeObject;
import com.stripe.model.checkout.Session;
import com.stripe.net.Webhook;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.Optional;

/**
 * Stripe Webhook 處理
 *
 * 事件路由：
 * - checkout.session.completed    → PaymentVerificationCoordinator.verify(session id)
 * - invoice.payment_succeeded     → SubscriptionService.recordRenewal（第一期帳單由上面的 verify 處理，略過）
 * - invoice.payment_failed        → SubscriptionService.recordRenewalFailure（寬限期內權益不變）
 * - customer.subscription.deleted → SubscriptionService.endGatewaySubscription
 * - charge.dispute.created        → DisputeRefundReconciler.recordDispute
 *
 * 帳單找帳號：先看 metadata.accountId，沒有時用帳單所屬的閘道訂閱 ID 對應。
 *
 * 業務上的拒絕（金額不符、找不到訂閱）只記 log 並回應 200，避免 Stripe 無限重送；
 * 簽章錯誤回 400。
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class StripeWebhookService {

    private static final String BILLING_REASON_CREATE = "subscription_create";

    private final StripeConfig stripeConfig;
    private final PaymentVerificationCoordinator coordinator;
    private final SubscriptionService subscriptionService;
    private final DisputeRefundReconciler reconciler;
    private final EntitlementCache entitlementCache;
    private final AccountStore accountStore;

    /**
     * @throws IllegalArgumentException 簽章驗證失敗
     */
    public void handleStripeWebhook(String payload, String sigHeader) {
        Event event;
        try {
            event = Webhook.constructEvent(payload, sigHeader, stripeConfig.getWebhookSecret());
        } catch (SignatureVerificationException e) {
            log.error("Stripe Webhook 簽名驗證失敗: {}", e.getMessage());
            throw new IllegalArgumentException("Webhook 簽名驗證失敗", e);
        }
        dispatch(event);
    }

    void dispatch(Event event) {
        String eventType = event.getType();
        log.info("收到 Stripe Webhook 事件: {} (id={})", eventType, event.getId());

        try {
            switch (eventType) {
                case "checkout.session.completed" -> dataObject(event, Session.class)
                        .ifPresent(this::handleCheckoutCompleted);
                case "invoice.payment_succeeded" -> dataObject(event, Invoice.class)
                        .ifPresent(this::handleInvoicePaymentSucceeded);
                case "invoice.payment_failed" -> dataObject(event, Invoice.class)
                        .ifPresent(this::handleInvoicePaymentFailed);
                case "customer.subscription.deleted" -> dataObject(event, com.stripe.model.Subscription.class)
                        .ifPresent(this::handleSubscriptionDeleted);
                case "charge.dispute.created" -> dataObject(event, Dispute.class)
                        .ifPresent(this::handleDisputeCreated);
                default -> log.debug("忽略未處理的事件類型: {}", eventType);
            }
        } catch (EntitlementException e) {
            log.warn("Webhook 事件被拒: type={} id={} code={} message={}",
                    eventType, event.getId(), e.getErrorCode(), e.getMessage());
        }
    }

    /**
     * checkout.session.completed
     * 使用者完成付款頁 → 主動驗證（與前端 verify 呼叫合併）
     */
    void handleCheckoutCompleted(Session session) {
        String reference = session.getId();
        Optional<PaymentAttempt> attempt = accountStore.findAttempt(reference);
        if (attempt.isEmpty()) {
            log.warn("checkout.session.completed: 找不到對應的付款 ref={}", reference);
            return;
        }
        // 選方案時就被取代的付款不會再驗證，activate 也不會經手它建立的定期扣款
        boolean supersededBeforeVerify = attempt.get().getStatus() == PaymentAttempt.Status.FAILED
                && ErrorCode.SUPERSEDED.name().equals(attempt.get().getFailureCode());
        VerificationResult result = coordinator.verify(reference);
        log.info("Webhook 觸發驗證完成: ref={} status={} code={}",
                reference, result.status(), result.errorCode());
        if (supersededBeforeVerify && session.getSubscription() != null) {
            // 使用者付了已被取代的付款頁：停掉它建立的定期扣款，款項由管理員退款
            subscriptionService.releaseGatewaySubscription(attempt.get().getAccountId(), session.getSubscription());
        }
    }

    /**
     * invoice.payment_succeeded
     * 續費成功 → 計費日往後推一期
     */
    void handleInvoicePaymentSucceeded(Invoice invoice) {
        if (BILLING_REASON_CREATE.equals(invoice.getBillingReason())) {
            log.debug("invoice.payment_succeeded: 第一期帳單由 checkout.session.completed 處理 (invoice={})",
                    invoice.getId());
            return;
        }
        Optional<String> accountId = resolveAccount(invoice);
        if (accountId.isEmpty()) {
            log.warn("invoice.payment_succeeded: 無法對應帳號 (invoice={} subscription={})",
                    invoice.getId(), invoice.getSubscription());
            return;
        }
        long amount = invoice.getAmountPaid() != null ? invoice.getAmountPaid() : 0L;
        boolean applied = subscriptionService.recordRenewal(accountId.get(), invoice.getId(), amount,
                invoice.getCurrency(), invoice.getPaymentIntent(), invoice.getSubscription());
        if (applied) {
            entitlementCache.invalidate(accountId.get());
        }
    }

    /**
     * invoice.payment_failed
     * 續費扣款失敗 → 記錄，閘道會自動重試
     */
    void handleInvoicePaymentFailed(Invoice invoice) {
        Optional<String> accountId = resolveAccount(invoice);
        if (accountId.isEmpty()) {
            log.warn("invoice.payment_failed: 無法對應帳號 (invoice={} subscription={})",
                    invoice.getId(), invoice.getSubscription());
            return;
        }
        subscriptionService.recordRenewalFailure(accountId.get(), invoice.getId(), invoice.getAttemptCount());
    }

    /**
     * customer.subscription.deleted
     * 閘道端定期扣款結束 → 本地訂閱 CANCELLED
     */
    void handleSubscriptionDeleted(com.stripe.model.Subscription stripeSub) {
        subscriptionService.endGatewaySubscription(stripeSub.getId())
                .ifPresent(entitlementCache::invalidate);
    }

    /**
     * charge.dispute.created
     * 記錄爭議，不動權益
     */
    void handleDisputeCreated(Dispute dispute) {
        String paymentRef = dispute.getPaymentIntent() != null ? dispute.getPaymentIntent() : dispute.getCharge();
        if (paymentRef == null) {
            log.warn("charge.dispute.created: 缺少 payment_intent / charge (dispute={})", dispute.getId());
            return;
        }
        long amount = dispute.getAmount() != null ? dispute.getAmount() : 0L;
        reconciler.recordDispute(paymentRef, dispute.getReason(), dispute.getId(), amount);
    }

    private Optional<String> resolveAccount(Invoice invoice) {
        String accountId = invoice.getMetadata() != null ? invoice.getMetadata().get("accountId") : null;
        if (accountId != null && !accountId.isBlank()) {
            return Optional.of(accountId);
        }
        if (invoice.getSubscription() == null) {
            return Optional.empty();
        }
        return accountStore.findSubscriptionByGatewayId(invoice.getSubscription())
                .map(Subscription::getAccountId);
    }

    private <T extends StripeObject> Optional<T> dataObject(Event event, Class<T> type) {
        Optional<StripeObject> object = event.getDataObjectDeserializer().getObject();
        if (object.isEmpty() || !type.isInstance(object.get())) {
            log.warn("{}: 無法解析 {} 物件（API 版本不符？）", event.getType(), type.getSimpleName());
            return Optional.empty();
        }
        return Optional.of(type.cast(object.get()));
    }
}
