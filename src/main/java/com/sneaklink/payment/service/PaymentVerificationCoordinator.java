package com.sneaklink.payment.service;

import com.sneaklink.account.AccountStore;
import com.sneaklink.account.EntitlementCache;
import com.sneaklink.notification.event.EventType;
import com.sneaklink.notification.service.EntitlementEventPublisher;
import com.sneaklink.payment.config.PaymentConfig;
import com.sneaklink.payment.gateway.GatewayException;
import com.sneaklink.payment.gateway.GatewayTransaction;
import com.sneaklink.payment.gateway.PaymentGatewayClient;
import com.sneaklink.plan.Plan;
import com.sneaklink.plan.PlanCatalog;
import com.sneaklink.quota.service.UsageQuotaLedger;
import com.sneaklink.shared.exception.EntitlementException;
import com.sneaklink.shared.exception.ErrorCode;
import com.sneaklink.subscription.entity.PaymentAttempt;
import com.sneaklink.subscription.entity.Subscription;
import com.sneaklink.subscription.service.SubscriptionService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.util.Map;
import java.util.concurrent.*;

/**
 * 付款驗證協調器
 *
 * 流程：
 * 1. reference 不存在 → UNKNOWN_REFERENCE
 * 2. 已是 SUCCEEDED / FAILED → 直接回傳記錄的結果，不呼叫閘道
 * 3. 同一個 reference 已有驗證在跑 → 等同一個結果（合併）
 * 4. 否則標記 VERIFYING，在期限內向閘道查詢（暫時性錯誤線性退避重試）
 *    - 已付款且金額 / 幣別相符 → 啟用訂閱、套用新方案配額、發 subscription.activated
 *    - 金額或幣別不符 → FAILED (AMOUNT_MISMATCH)，訂閱維持原狀
 *    - 閘道回報失敗 → FAILED (PAYMENT_FAILED)
 *    - 尚未付款 → 回到 INITIALIZED (PAYMENT_NOT_COMPLETED)
 *    - 逾時 → TIMED_OUT (GATEWAY_TIMEOUT)，可用同一 reference 重試
 *
 * 重試與逾時只在這裡決定，呼叫端不需要自己重試。
 */
@Slf4j
@Service
public class PaymentVerificationCoordinator {

    private final AccountStore accountStore;
    private final SubscriptionService subscriptionService;
    private final PaymentGatewayClient gatewayClient;
    private final UsageQuotaLedger ledger;
    private final EntitlementCache entitlementCache;
    private final PlanCatalog planCatalog;
    private final EntitlementEventPublisher eventPublisher;
    private final ExecutorService gatewayExecutor;
    private final PaymentConfig.VerifySettings settings;

    /** reference → 進行中的驗證 */
    private final ConcurrentHashMap<String, CompletableFuture<VerificationResult>> inFlight =
            new ConcurrentHashMap<>();

    public PaymentVerificationCoordinator(AccountStore accountStore,
                                          SubscriptionService subscriptionService,
                                          PaymentGatewayClient gatewayClient,
                                          UsageQuotaLedger ledger,
                                          EntitlementCache entitlementCache,
                                          PlanCatalog planCatalog,
                                          EntitlementEventPublisher eventPublisher,
                                          @Qualifier("gatewayExecutor") ExecutorService gatewayExecutor,
                                          PaymentConfig paymentConfig) {
        this.accountStore = accountStore;
        this.subscriptionService = subscriptionService;
        this.gatewayClient = gatewayClient;
        this.ledger = ledger;
        this.entitlementCache = entitlementCache;
        this.planCatalog = planCatalog;
        this.eventPublisher = eventPublisher;
        this.gatewayExecutor = gatewayExecutor;
        this.settings = paymentConfig.getVerify();
    }

    /**
     * 驗證付款
     *
     * @throws EntitlementException UNKNOWN_REFERENCE
     */
    public VerificationResult verify(String reference) {
        PaymentAttempt attempt = accountStore.findAttempt(reference)
                .orElseThrow(() -> new EntitlementException(ErrorCode.UNKNOWN_REFERENCE,
                        "找不到付款參考編號: " + reference));
        if (attempt.getStatus().isTerminal()) {
            return resultOf(attempt);
        }

        CompletableFuture<VerificationResult> mine = new CompletableFuture<>();
        CompletableFuture<VerificationResult> existing = inFlight.putIfAbsent(reference, mine);
        if (existing != null) {
            log.debug("同一筆付款已在驗證中，等待結果: ref={}", reference);
            return await(existing);
        }

        try {
            VerificationResult result = runVerification(reference);
            mine.complete(result);
            return result;
        } catch (RuntimeException e) {
            mine.completeExceptionally(e);
            throw e;
        } finally {
            inFlight.remove(reference, mine);
        }
    }

    /**
     * 閘道健康檢查（短期限，不重試）
     */
    public boolean gatewayHealthy() {
        try {
            callWithDeadline(() -> {
                gatewayClient.ping();
                return Boolean.TRUE;
            }, settings.getHealthTimeoutMs(), 1);
            return true;
        } catch (GatewayException e) {
            log.warn("金流閘道健康檢查失敗: {}", e.getMessage());
            return false;
        }
    }

    /** 目前進行中的驗證數 */
    public int inFlightCount() {
        return inFlight.size();
    }

    // ===================== 內部流程 =====================

    private VerificationResult runVerification(String reference) {
        PaymentAttempt attempt = subscriptionService.beginVerification(reference);
        if (attempt.getStatus().isTerminal()) {
            return resultOf(attempt);
        }

        GatewayTransaction tx;
        try {
            tx = callWithDeadline(() -> gatewayClient.lookupTransaction(reference),
                    settings.getTimeoutMs(), settings.getMaxAttempts());
        } catch (GatewayException e) {
            if (e.isTransientFailure()) {
                return fail(attempt, ErrorCode.GATEWAY_TIMEOUT, PaymentAttempt.Status.TIMED_OUT);
            }
            return fail(attempt, ErrorCode.GATEWAY_REJECTED, PaymentAttempt.Status.INITIALIZED);
        }

        switch (tx.status()) {
            case FAILED:
                return fail(attempt, ErrorCode.PAYMENT_FAILED, PaymentAttempt.Status.FAILED);
            case OPEN:
                return fail(attempt, ErrorCode.PAYMENT_NOT_COMPLETED, PaymentAttempt.Status.INITIALIZED);
            default:
                break;
        }

        if (tx.amountMinorUnits() != attempt.getAmountMinorUnits()
                || tx.currency() == null
                || !tx.currency().equalsIgnoreCase(attempt.getCurrency())) {
            log.error("付款金額不符: ref={} accountId={} 預期 {} {} 實際 {} {}",
                    reference, attempt.getAccountId(),
                    attempt.getAmountMinorUnits(), attempt.getCurrency(),
                    tx.amountMinorUnits(), tx.currency());
            return fail(attempt, ErrorCode.AMOUNT_MISMATCH, PaymentAttempt.Status.FAILED);
        }

        String accountId = attempt.getAccountId();
        if (!subscriptionService.activate(reference, tx.paymentId(), tx.subscriptionId())) {
            return result(attempt, PaymentAttempt.Status.FAILED, ErrorCode.SUPERSEDED);
        }

        Plan plan = planCatalog.require(attempt.getPlanId());
        entitlementCache.invalidate(accountId);
        ledger.applyPlanLimits(accountId, plan);
        eventPublisher.publish(EventType.SUBSCRIPTION_ACTIVATED, accountId, Map.of(
                "reference", reference,
                "planId", plan.id(),
                "billingCycle", attempt.getBillingCycle().name(),
                "amount", attempt.getAmountMinorUnits(),
                "currency", attempt.getCurrency()));
        return result(attempt, PaymentAttempt.Status.SUCCEEDED, null);
    }

    private VerificationResult fail(PaymentAttempt attempt, ErrorCode code, PaymentAttempt.Status status) {
        subscriptionService.failAttempt(attempt.getReference(), code, status);
        return result(attempt, status, code);
    }

    private VerificationResult result(PaymentAttempt attempt, PaymentAttempt.Status status, ErrorCode code) {
        Subscription.Status subStatus = accountStore.getSubscription(attempt.getAccountId())
                .map(Subscription::getStatus)
                .orElse(Subscription.Status.NONE);
        return new VerificationResult(attempt.getReference(), status, code, subStatus, attempt.getPlanId());
    }

    private VerificationResult resultOf(PaymentAttempt attempt) {
        ErrorCode code = attempt.getFailureCode() != null ? ErrorCode.valueOf(attempt.getFailureCode()) : null;
        return result(attempt, attempt.getStatus(), code);
    }

    private VerificationResult await(CompletableFuture<VerificationResult> future) {
        try {
            return future.join();
        } catch (CompletionException e) {
            if (e.getCause() instanceof RuntimeException cause) {
                throw cause;
            }
            throw e;
        }
    }

    /**
     * 在期限內呼叫閘道；暫時性錯誤線性退避重試（第 n 次失敗後等 backoff × n）
     *
     * 期限用完或重試次數用完時丟出 transientFailure=true 的 GatewayException。
     * 線程池滿載（RejectedExecutionException）也當成暫時性錯誤，不會改在呼叫者線程上無期限地跑。
     */
    <T> T callWithDeadline(Callable<T> call, long timeoutMs, int maxAttempts) throws GatewayException {
        long deadline = System.nanoTime() + TimeUnit.MILLISECONDS.toNanos(timeoutMs);
        int attempt = 0;
        while (true) {
            attempt++;
            long remaining = deadline - System.nanoTime();
            if (remaining <= 0) {
                throw new GatewayException("閘道查詢超過期限 " + timeoutMs + "ms", true);
            }

            Future<T> future;
            try {
                future = gatewayExecutor.submit(call);
            } catch (RejectedExecutionException e) {
                GatewayException saturated = new GatewayException("閘道查詢線程池已滿", true, e);
                if (attempt >= maxAttempts) {
                    throw new GatewayException("閘道查詢線程池已滿，重試次數用完", true, e);
                }
                backoffWithinDeadline(saturated, attempt, maxAttempts, deadline, timeoutMs);
                continue;
            }
            try {
                return future.get(remaining, TimeUnit.NANOSECONDS);
            } catch (TimeoutException e) {
                future.cancel(true);
                log.warn("閘道查詢逾時: timeout={}ms attempt={}", timeoutMs, attempt);
                throw new GatewayException("閘道查詢超過期限 " + timeoutMs + "ms", true, e);
            } catch (InterruptedException e) {
                future.cancel(true);
                Thread.currentThread().interrupt();
                throw new GatewayException("閘道查詢被中斷", true, e);
            } catch (ExecutionException e) {
                GatewayException failure = e.getCause() instanceof GatewayException ge
                        ? ge
                        : new GatewayException("閘道呼叫失敗: " + e.getCause(), false, e.getCause());
                if (!failure.isTransientFailure() || attempt >= maxAttempts) {
                    throw failure;
                }
                backoffWithinDeadline(failure, attempt, maxAttempts, deadline, timeoutMs);
            }
        }
    }

    /**
     * 線性退避；等完會超過期限就直接丟出逾時
     */
    private void backoffWithinDeadline(GatewayException failure, int attempt, int maxAttempts,
                                       long deadline, long timeoutMs) throws GatewayException {
        long backoffMs = settings.getBackoffMs() * attempt;
        if (System.nanoTime() + TimeUnit.MILLISECONDS.toNanos(backoffMs) >= deadline) {
            throw new GatewayException("閘道查詢超過期限 " + timeoutMs + "ms", true, failure);
        }
        log.warn("閘道暫時性錯誤，{}ms 後重試 ({}/{}): {}",
                backoffMs, attempt, maxAttempts, failure.getMessage());
        sleep(backoffMs);
    }

    private void sleep(long ms) throws GatewayException {
        try {
            Thread.sleep(ms);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new GatewayException("閘道重試等待被中斷", true, e);
        }
    }
}
