package com.sneaklink.payment.gateway;

import com.sneaklink.payment.config.PaymentConfig;
import com.sneaklink.plan.BillingCycle;
import com.stripe.exception.ApiConnectionException;
import com.stripe.exception.RateLimitException;
import com.stripe.exception.StripeException;
import com.stripe.model.Balance;
import com.stripe.model.Invoice;
import com.stripe.model.Refund;
import com.stripe.model.checkout.Session;
import com.stripe.param.RefundCreateParams;
import com.stripe.param.SubscriptionCancelParams;
import com.stripe.param.SubscriptionUpdateParams;
import com.stripe.param.checkout.SessionCreateParams;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Stripe 實作
 *
 * 付款參考編號 = Checkout Session ID（cs_xxx），Session 為訂閱模式，付款後由 Stripe 依週期自動續扣。
 * 續費付款以 Invoice ID（in_xxx）當參考編號，退款時再換成 PaymentIntent。
 * 自動續費開關對應 Stripe 的 cancel_at_period_end。
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class StripeGatewayClient implements PaymentGatewayClient {

    private final PaymentConfig paymentConfig;

    @Override
    public GatewayCharge initializeCharge(ChargeRequest request) throws GatewayException {
        SessionCreateParams params = SessionCreateParams.builder()
                .setMode(SessionCreateParams.Mode.SUBSCRIPTION)
                .setSuccessUrl(paymentConfig.getSuccessUrl())
                .setCancelUrl(paymentConfig.getCancelUrl())
                .setClientReferenceId(request.accountRef())
                .putAllMetadata(request.metadata())
                .setSubscriptionData(SessionCreateParams.SubscriptionData.builder()
                        .putAllMetadata(request.metadata())
                        .build())
                .addLineItem(SessionCreateParams.LineItem.builder()
                        .setQuantity(1L)
                        .setPriceData(SessionCreateParams.LineItem.PriceData.builder()
                                .setCurrency(request.currency())
                                .setUnitAmount(request.amountMinorUnits())
                                .setRecurring(SessionCreateParams.LineItem.PriceData.Recurring.builder()
                                        .setInterval(intervalOf(request.billingCycle()))
                                        .build())
                                .setProductData(SessionCreateParams.LineItem.PriceData.ProductData.builder()
                                        .setName(request.description())
                                        .build())
                                .build())
                        .build())
                .build();
        try {
            Session session = Session.create(params);
            log.info("Stripe Checkout Session 已建立: ref={} account={} amount={} {} cycle={}",
                    session.getId(), request.accountRef(), request.amountMinorUnits(), request.currency(),
                    request.billingCycle());
            return new GatewayCharge(session.getId(), session.getUrl());
        } catch (StripeException e) {
            throw translate("建立 Checkout Session 失敗", e);
        }
    }

    @Override
    public GatewayTransaction lookupTransaction(String reference) throws GatewayException {
        try {
            Session session = Session.retrieve(reference);
            GatewayTransaction.Status status = mapStatus(session);
            String paymentIntent = session.getPaymentIntent();
            if (paymentIntent == null && status == GatewayTransaction.Status.PAID && session.getInvoice() != null) {
                // 訂閱模式的 Session 本身沒有 PaymentIntent，第一期帳單上才有
                paymentIntent = Invoice.retrieve(session.getInvoice()).getPaymentIntent();
            }
            return new GatewayTransaction(
                    session.getId(),
                    status,
                    session.getAmountTotal() != null ? session.getAmountTotal() : 0L,
                    session.getCurrency(),
                    paymentIntent,
                    session.getSubscription());
        } catch (StripeException e) {
            throw translate("查詢 Checkout Session 失敗: " + reference, e);
        }
    }

    @Override
    public GatewayRefund refund(String reference, long amountMinorUnits, String note) throws GatewayException {
        try {
            String paymentIntent = resolvePaymentIntent(reference);
            if (paymentIntent == null) {
                throw new GatewayException("找不到可退款的 PaymentIntent: " + reference, false);
            }
            RefundCreateParams.Builder builder = RefundCreateParams.builder()
                    .setPaymentIntent(paymentIntent)
                    .setAmount(amountMinorUnits)
                    .putMetadata("reference", reference);
            if (note != null && !note.isBlank()) {
                builder.putMetadata("note", note);
            }
            Refund refund = Refund.create(builder.build());
            String status = refund.getStatus();
            boolean confirmed = "succeeded".equals(status) || "pending".equals(status);
            log.info("Stripe 退款回應: ref={} refundId={} status={}", reference, refund.getId(), status);
            return new GatewayRefund(refund.getId(), confirmed, status);
        } catch (StripeException e) {
            throw translate("退款失敗: " + reference, e);
        }
    }

    @Override
    public void setAutoRenew(String gatewaySubscriptionId, boolean autoRenew) throws GatewayException {
        try {
            com.stripe.model.Subscription stripeSub =
                    com.stripe.model.Subscription.retrieve(gatewaySubscriptionId);
            stripeSub.update(SubscriptionUpdateParams.builder()
                    .setCancelAtPeriodEnd(!autoRenew)
                    .build());
            log.info("Stripe 訂閱自動續費已更新: subId={} autoRenew={}", gatewaySubscriptionId, autoRenew);
        } catch (StripeException e) {
            throw translate("更新 Stripe 訂閱失敗: " + gatewaySubscriptionId, e);
        }
    }

    @Override
    public void cancelSubscription(String gatewaySubscriptionId) throws GatewayException {
        try {
            com.stripe.model.Subscription stripeSub =
                    com.stripe.model.Subscription.retrieve(gatewaySubscriptionId);
            stripeSub.cancel(SubscriptionCancelParams.builder().build());
            log.info("Stripe 訂閱已立即取消: subId={}", gatewaySubscriptionId);
        } catch (StripeException e) {
            throw translate("取消 Stripe 訂閱失敗: " + gatewaySubscriptionId, e);
        }
    }

    @Override
    public void ping() throws GatewayException {
        try {
            Balance.retrieve();
        } catch (StripeException e) {
            throw translate("Stripe 連線檢查失敗", e);
        }
    }

    // ===================== 工具方法 =====================

    static GatewayTransaction.Status mapStatus(Session session) {
        String paymentStatus = session.getPaymentStatus();
        if ("paid".equals(paymentStatus) || "no_payment_required".equals(paymentStatus)) {
            return GatewayTransaction.Status.PAID;
        }
        if ("expired".equals(session.getStatus())) {
            return GatewayTransaction.Status.FAILED;
        }
        return GatewayTransaction.Status.OPEN;
    }

    static SessionCreateParams.LineItem.PriceData.Recurring.Interval intervalOf(BillingCycle cycle) {
        return cycle == BillingCycle.ANNUAL
                ? SessionCreateParams.LineItem.PriceData.Recurring.Interval.YEAR
                : SessionCreateParams.LineItem.PriceData.Recurring.Interval.MONTH;
    }

    private String resolvePaymentIntent(String reference) throws StripeException {
        if (reference.startsWith("cs_")) {
            Session session = Session.retrieve(reference);
            if (session.getPaymentIntent() != null || session.getInvoice() == null) {
                return session.getPaymentIntent();
            }
            return Invoice.retrieve(session.getInvoice()).getPaymentIntent();
        }
        if (reference.startsWith("in_")) {
            return Invoice.retrieve(reference).getPaymentIntent();
        }
        return reference;
    }

    /**
     * 網路錯誤、限流、5xx 視為暫時性；其餘為閘道明確拒絕
     */
    static GatewayException translate(String message, StripeException e) {
        Integer status = e.getStatusCode();
        boolean transientFailure = e instanceof ApiConnectionException
                || e instanceof RateLimitException
                || (status != null && status >= 500);
        log.error("{}: code={} status={} transient={} err={}",
                message, e.getCode(), status, transientFailure, e.getMessage());
        return new GatewayException(message + ": " + e.getMessage(), transientFailure, e);
    }
}
