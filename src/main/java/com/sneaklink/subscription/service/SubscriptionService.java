package com.sneaklink.subscription.service;

import com.sneaklink.account.AccountStore;
import com.sneaklink.account.Entitlement;
import com.sneaklink.payment.config.PaymentConfig;
import com.sneaklink.payment.gateway.ChargeRequest;
import com.sneaklink.payment.gateway.GatewayCharge;
import com.sneaklink.payment.gateway.GatewayException;
import com.sneaklink.payment.gateway.PaymentGatewayClient;
import com.sneaklink.plan.BillingCycle;
import com.sneaklink.plan.Plan;
import com.sneaklink.plan.PlanCatalog;
import com.sneaklink.plan.dto.PlanResponse;
import com.sneaklink.shared.config.EntitlementConfig;
import com.sneaklink.shared.exception.EntitlementException;
import com.sneaklink.shared.exception.ErrorCode;
import com.sneaklink.shared.service.AccountLockRegistry;
import com.sneaklink.shared.service.AuditService;
import com.sneaklink.subscription.dto.PlanSelection;
import com.sneaklink.subscription.dto.SubscriptionStatusResponse;
import com.sneaklink.subscription.entity.PaymentAttempt;
import com.sneaklink.subscription.entity.Subscription;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;

/**
 * 訂閱狀態機
 *
 * 狀態轉換：
 * - NONE → PENDING（選擇方案）→ ACTIVE（付款確認）
 * - ACTIVE → EXPIRING（autoRenew=false 且接近計費日）→ CANCELLED（過了計費日）
 * - EXPIRING → ACTIVE（重新開啟 autoRenew 或收到續費）
 * - ACTIVE / EXPIRING → CANCELLED（使用者取消，或閘道端定期扣款結束）
 * - ACTIVE / EXPIRING / CANCELLED → REFUNDED（退款）
 * - PENDING → NONE（驗證失敗或逾時）
 *
 * 到期 / 取消沒有排程器，每次讀取訂閱時在帳號鎖內判斷。
 * 已在付費方案中的帳號升級時不進 PENDING，原權益維持到新付款確認為止。
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class SubscriptionService {

    private final AccountStore accountStore;
    private final PlanCatalog planCatalog;
    private final PaymentGatewayClient gatewayClient;
    private final AccountLockRegistry lockRegistry;
    private final EntitlementConfig entitlementConfig;
    private final PaymentConfig paymentConfig;
    private final AuditService auditService;
    private final Clock clock;

    // ===================== 查詢方法 =====================

    /**
     * 方案列表，current 標記帳號目前實際生效的方案
     */
    public List<PlanResponse> listPlans(String accountId) {
        String effective = effectivePlan(accountId).id();
        return planCatalog.all().stream()
                .map(plan -> PlanResponse.of(plan, plan.id().equals(effective)))
                .toList();
    }

    /**
     * 查詢訂閱狀態（已套用到期判斷）
     */
    public SubscriptionStatusResponse getSubscription(String accountId) {
        Optional<Subscription> subOpt = loadEvaluated(accountId);
        if (subOpt.isEmpty()) {
            Plan free = planCatalog.free();
            return SubscriptionStatusResponse.builder()
                    .planId(free.id())
                    .planName(free.displayName())
                    .effectivePlanId(free.id())
                    .status(Subscription.Status.NONE.name())
                    .active(false)
                    .build();
        }

        Subscription sub = subOpt.get();
        Plan plan = planCatalog.find(sub.getPlanId()).orElse(planCatalog.free());
        boolean entitled = sub.getStatus().isEntitled();

        return SubscriptionStatusResponse.builder()
                .planId(plan.id())
                .planName(plan.displayName())
                .effectivePlanId(entitled ? plan.id() : planCatalog.free().id())
                .status(sub.getStatus().name())
                .billingCycle(sub.getBillingCycle())
                .startDate(sub.getStartDate())
                .nextBillingDate(sub.getNextBillingDate())
                .autoRenew(sub.isAutoRenew())
                .active(entitled)
                .pendingPaymentReference(sub.getPendingPaymentReference())
                .build();
    }

    /**
     * 目前套用限制的方案：ACTIVE / EXPIRING 時是訂閱方案，其他一律 free
     */
    public Plan effectivePlan(String accountId) {
        return loadEvaluated(accountId)
                .filter(sub -> sub.getStatus().isEntitled())
                .flatMap(sub -> planCatalog.find(sub.getPlanId()))
                .orElse(planCatalog.free());
    }

    /**
     * 目前的權益快照（供 EntitlementCache 載入）
     */
    public Entitlement currentEntitlement(String accountId) {
        Optional<Subscription> subOpt = loadEvaluated(accountId);
        Subscription.Status status = subOpt.map(Subscription::getStatus).orElse(Subscription.Status.NONE);
        Plan plan = subOpt
                .filter(sub -> sub.getStatus().isEntitled())
                .flatMap(sub -> planCatalog.find(sub.getPlanId()))
                .orElse(planCatalog.free());
        LocalDateTime anchor = status.isEntitled()
                ? subOpt.map(Subscription::getNextBillingDate).orElse(null)
                : null;
        return new Entitlement(accountId, plan.id(), status, plan.limits(), anchor, LocalDateTime.now(clock));
    }

    // ===================== 選擇方案 =====================

    /**
     * 選擇方案：向閘道建立付款頁，並取代該帳號所有進行中的付款
     *
     * @throws EntitlementException INVALID_PLAN / ALREADY_ON_PLAN / GATEWAY_TIMEOUT / GATEWAY_REJECTED
     */
    public PlanSelection selectPlan(String accountId, String planId, BillingCycle billingCycle) {
        Plan plan = planCatalog.require(planId);
        if (plan.isFree()) {
            throw new EntitlementException(ErrorCode.INVALID_PLAN, "free 方案不需付款");
        }
        BillingCycle cycle = billingCycle != null ? billingCycle : BillingCycle.MONTHLY;

        loadEvaluated(accountId).ifPresent(sub -> ensureNotAlreadyOn(sub, plan, cycle));

        long amount = plan.priceFor(cycle);
        String currency = paymentConfig.getCurrency();
        GatewayCharge charge;
        try {
            charge = gatewayClient.initializeCharge(new ChargeRequest(
                    amount, currency, cycle, accountId,
                    "SneakLink " + plan.displayName() + " (" + cycle.name().toLowerCase() + ")",
                    Map.of("accountId", accountId, "planId", plan.id(), "billingCycle", cycle.name())));
        } catch (GatewayException e) {
            auditService.failure(accountId, "SELECT_PLAN", null, e.getMessage());
            ErrorCode code = e.isTransientFailure() ? ErrorCode.GATEWAY_TIMEOUT : ErrorCode.GATEWAY_REJECTED;
            throw new EntitlementException(code, "無法建立付款: " + e.getMessage(), e);
        }

        ReentrantLock lock = lockRegistry.subscriptionLock(accountId);
        lock.lock();
        try {
            LocalDateTime now = LocalDateTime.now(clock);
            Subscription sub = accountStore.getSubscription(accountId).orElse(null);
            if (sub != null) {
                applyLifecycle(sub, now);
                ensureNotAlreadyOn(sub, plan, cycle);
            }

            supersedeInFlight(accountId);

            accountStore.putAttempt(PaymentAttempt.builder()
                    .reference(charge.reference())
                    .accountId(accountId)
                    .planId(plan.id())
                    .billingCycle(cycle)
                    .amountMinorUnits(amount)
                    .currency(currency)
                    .status(PaymentAttempt.Status.INITIALIZED)
                    .redirectUrl(charge.redirectUrl())
                    .build());

            if (sub == null) {
                sub = Subscription.builder()
                        .accountId(accountId)
                        .planId(plan.id())
                        .billingCycle(cycle)
                        .status(Subscription.Status.PENDING)
                        .nextBillingDate(cycle.advance(now))
                        .autoRenew(false)
                        .build();
            } else if (!sub.getStatus().isEntitled()) {
                sub.setPlanId(plan.id());
                sub.setBillingCycle(cycle);
                sub.setStatus(Subscription.Status.PENDING);
                sub.setNextBillingDate(cycle.advance(now));
            }
            sub.setPendingPaymentReference(charge.reference());
            accountStore.putSubscription(sub);
        } finally {
            lock.unlock();
        }

        log.info("方案選擇已建立: accountId={} plan={} cycle={} ref={} amount={} {}",
                accountId, plan.id(), cycle, charge.reference(), amount, currency);
        auditService.success(accountId, "SELECT_PLAN", charge.reference(),
                "plan=" + plan.id() + " cycle=" + cycle + " amount=" + amount);

        return PlanSelection.builder()
                .reference(charge.reference())
                .redirectUrl(charge.redirectUrl())
                .amountMinorUnits(amount)
                .currency(currency)
                .planId(plan.id())
                .billingCycle(cycle)
                .build();
    }

    // ===================== 自動續費 =====================

    /**
     * 切換自動續費，回傳切換後的值
     *
     * 只有 ACTIVE / EXPIRING 會真的切換；其他狀態原值回傳。
     * 有閘道訂閱時先同步閘道（cancel_at_period_end），閘道失敗則本地不變。
     * 閘道呼叫在訂閱鎖內進行，同帳號的切換順序與閘道端一致。
     *
     * @throws EntitlementException NO_ACTIVE_SUBSCRIPTION 帳號沒有任何訂閱記錄；GATEWAY_TIMEOUT / GATEWAY_REJECTED
     */
    public boolean toggleAutoRenew(String accountId) {
        ReentrantLock lock = lockRegistry.subscriptionLock(accountId);
        lock.lock();
        try {
            Subscription sub = accountStore.getSubscription(accountId)
                    .orElseThrow(() -> new EntitlementException(ErrorCode.NO_ACTIVE_SUBSCRIPTION));
            LocalDateTime now = LocalDateTime.now(clock);
            boolean changed = applyLifecycle(sub, now);

            if (!sub.getStatus().isEntitled()) {
                if (changed) {
                    accountStore.putSubscription(sub);
                }
                return sub.isAutoRenew();
            }

            boolean next = !sub.isAutoRenew();
            if (sub.getGatewaySubscriptionId() != null) {
                try {
                    gatewayClient.setAutoRenew(sub.getGatewaySubscriptionId(), next);
                } catch (GatewayException e) {
                    if (changed) {
                        accountStore.putSubscription(sub);
                    }
                    auditService.failure(accountId, "TOGGLE_AUTO_RENEW", sub.getLastPaymentReference(), e.getMessage());
                    throw gatewayFailure("無法更新自動續費", e);
                }
            }
            sub.setAutoRenew(next);
            if (next && sub.getStatus() == Subscription.Status.EXPIRING) {
                sub.setStatus(Subscription.Status.ACTIVE);
            } else if (!next) {
                applyLifecycle(sub, now);
            }
            accountStore.putSubscription(sub);
            log.info("自動續費已切換: accountId={} autoRenew={} status={}", accountId, next, sub.getStatus());
            return next;
        } finally {
            lock.unlock();
        }
    }

    // ===================== 取消 =====================

    /**
     * 立即取消訂閱：閘道端停止扣款，ACTIVE / EXPIRING → CANCELLED，權益回到 free
     *
     * 不自動退款；需要退款時由管理員對付款另外退款。
     *
     * @return 取消後的訂閱
     * @throws EntitlementException NO_ACTIVE_SUBSCRIPTION / GATEWAY_TIMEOUT / GATEWAY_REJECTED
     */
    public Subscription cancelSubscription(String accountId) {
        ReentrantLock lock = lockRegistry.subscriptionLock(accountId);
        lock.lock();
        try {
            Subscription sub = accountStore.getSubscription(accountId)
                    .orElseThrow(() -> new EntitlementException(ErrorCode.NO_ACTIVE_SUBSCRIPTION));
            if (applyLifecycle(sub, LocalDateTime.now(clock))) {
                accountStore.putSubscription(sub);
            }
            if (!sub.getStatus().isEntitled()) {
                throw new EntitlementException(ErrorCode.NO_ACTIVE_SUBSCRIPTION,
                        "訂閱狀態 " + sub.getStatus() + " 無法取消");
            }

            if (sub.getGatewaySubscriptionId() != null) {
                try {
                    gatewayClient.cancelSubscription(sub.getGatewaySubscriptionId());
                } catch (GatewayException e) {
                    auditService.failure(accountId, "CANCEL", sub.getLastPaymentReference(), e.getMessage());
                    throw gatewayFailure("無法取消閘道訂閱", e);
                }
            }

            Subscription.Status before = sub.getStatus();
            cancel(sub);
            sub.setGatewaySubscriptionId(null);
            Subscription saved = accountStore.putSubscription(sub);
            log.info("訂閱已取消: accountId={} {} → CANCELLED plan={}", accountId, before, sub.getPlanId());
            auditService.success(accountId, "CANCEL", sub.getLastPaymentReference(), "plan=" + sub.getPlanId());
            return saved;
        } finally {
            lock.unlock();
        }
    }

    // ===================== 付款確認（PaymentVerificationCoordinator 呼叫） =====================

    /**
     * 標記付款為 VERIFYING；已是終態時原樣回傳，不變更
     *
     * @throws EntitlementException UNKNOWN_REFERENCE
     */
    public PaymentAttempt beginVerification(String reference) {
        String accountId = requireAttempt(reference).getAccountId();
        ReentrantLock lock = lockRegistry.subscriptionLock(accountId);
        lock.lock();
        try {
            PaymentAttempt attempt = requireAttempt(reference);
            if (attempt.getStatus().isTerminal()) {
                return attempt;
            }
            attempt.setStatus(PaymentAttempt.Status.VERIFYING);
            attempt.setFailureCode(null);
            return accountStore.putAttempt(attempt);
        } finally {
            lock.unlock();
        }
    }

    /**
     * 付款確認成功後啟用訂閱
     *
     * 啟用成功時，前一個閘道訂閱（換方案前的定期扣款）在鎖外取消；
     * 付款已被取代時，這筆付款建立的閘道訂閱也在鎖外取消，款項由管理員退款。
     *
     * @param gatewaySubscriptionId 這筆付款建立的定期扣款訂閱，可為 null
     * @return false = 這筆付款已被新的方案選擇取代，訂閱沒有變更
     */
    public boolean activate(String reference, String gatewayPaymentId, String gatewaySubscriptionId) {
        String accountId = requireAttempt(reference).getAccountId();
        boolean activated;
        String replacedGatewaySubscription = null;
        ReentrantLock lock = lockRegistry.subscriptionLock(accountId);
        lock.lock();
        try {
            PaymentAttempt attempt = requireAttempt(reference);
            Subscription sub = accountStore.getSubscription(accountId).orElse(null);

            if (attempt.getStatus() != PaymentAttempt.Status.VERIFYING
                    || sub == null
                    || !reference.equals(sub.getPendingPaymentReference())) {
                if (attempt.getStatus() == PaymentAttempt.Status.VERIFYING) {
                    attempt.setStatus(PaymentAttempt.Status.FAILED);
                    attempt.setFailureCode(ErrorCode.SUPERSEDED.name());
                }
                // 驗證途中被 selectPlan 取代的付款也記下閘道付款編號，退款時用得到
                if (ErrorCode.SUPERSEDED.name().equals(attempt.getFailureCode())
                        && attempt.getGatewayPaymentId() == null) {
                    attempt.setGatewayPaymentId(gatewayPaymentId);
                    accountStore.putAttempt(attempt);
                }
                log.warn("付款已確認但已被取代，訂閱不變更，請以 POST /api/admin/payments/{}/refund 退款: "
                                + "accountId={} paymentId={}",
                        reference, accountId, gatewayPaymentId);
                auditService.failure(accountId, "ACTIVATE", reference, ErrorCode.SUPERSEDED.name());
                activated = false;
            } else {
                LocalDateTime now = LocalDateTime.now(clock);
                attempt.setStatus(PaymentAttempt.Status.SUCCEEDED);
                attempt.setFailureCode(null);
                attempt.setGatewayPaymentId(gatewayPaymentId);
                attempt.setVerifiedAt(now);
                accountStore.putAttempt(attempt);

                replacedGatewaySubscription = sub.getGatewaySubscriptionId();
                sub.setStatus(Subscription.Status.ACTIVE);
                sub.setPlanId(attempt.getPlanId());
                sub.setBillingCycle(attempt.getBillingCycle());
                sub.setStartDate(now);
                sub.setNextBillingDate(attempt.getBillingCycle().advance(now));
                sub.setAutoRenew(true);
                sub.setLastPaymentReference(reference);
                sub.setPendingPaymentReference(null);
                sub.setGatewaySubscriptionId(gatewaySubscriptionId);
                accountStore.putSubscription(sub);

                log.info("訂閱已啟用: accountId={} plan={} cycle={} nextBilling={} ref={} gatewaySub={}",
                        accountId, sub.getPlanId(), sub.getBillingCycle(), sub.getNextBillingDate(), reference,
                        gatewaySubscriptionId);
                auditService.success(accountId, "ACTIVATE", reference,
                        "plan=" + sub.getPlanId() + " cycle=" + sub.getBillingCycle());
                activated = true;
            }
        } finally {
            lock.unlock();
        }

        if (!activated) {
            // 被取代：停掉這筆付款自己建立的定期扣款
            releaseGatewaySubscription(accountId, gatewaySubscriptionId);
            return false;
        }
        if (replacedGatewaySubscription != null && !replacedGatewaySubscription.equals(gatewaySubscriptionId)) {
            releaseGatewaySubscription(accountId, replacedGatewaySubscription);
        }
        return true;
    }

    /**
     * 驗證沒有成功：寫入付款的新狀態，必要時讓 PENDING 訂閱回到 NONE
     *
     * 只處理仍是 VERIFYING 的付款；已被取代的付款不再變更。
     *
     * @param status FAILED（不可重試）、TIMED_OUT 或 INITIALIZED（可用同一 reference 重試）
     */
    public void failAttempt(String reference, ErrorCode code, PaymentAttempt.Status status) {
        String accountId = requireAttempt(reference).getAccountId();
        ReentrantLock lock = lockRegistry.subscriptionLock(accountId);
        lock.lock();
        try {
            PaymentAttempt attempt = requireAttempt(reference);
            if (attempt.getStatus() != PaymentAttempt.Status.VERIFYING) {
                return;
            }
            attempt.setStatus(status);
            attempt.setFailureCode(code.name());
            accountStore.putAttempt(attempt);

            if (status == PaymentAttempt.Status.FAILED || status == PaymentAttempt.Status.TIMED_OUT) {
                abandonPending(attempt);
            }
            log.warn("付款驗證未成功: accountId={} ref={} code={} attempt={}",
                    accountId, reference, code, status);
            if (status == PaymentAttempt.Status.FAILED) {
                auditService.failure(accountId, "VERIFY", reference, code.name());
            }
        } finally {
            lock.unlock();
        }
    }

    /**
     * PENDING → NONE（付款仍是目前進行中的那一筆時）
     *
     * 逾時的付款保留 pendingPaymentReference，之後用同一 reference 重試仍可啟用；
     * 明確失敗的付款則清掉。呼叫端需持有帳號的訂閱鎖。
     */
    void abandonPending(PaymentAttempt attempt) {
        Subscription sub = accountStore.getSubscription(attempt.getAccountId()).orElse(null);
        if (sub == null || !attempt.getReference().equals(sub.getPendingPaymentReference())) {
            return;
        }
        if (attempt.getStatus() == PaymentAttempt.Status.FAILED) {
            sub.setPendingPaymentReference(null);
        }
        if (sub.getStatus() == Subscription.Status.PENDING) {
            sub.setStatus(Subscription.Status.NONE);
            sub.setPlanId(planCatalog.free().id());
            sub.setNextBillingDate(null);
            log.info("待付款訂閱已放棄: accountId={} ref={}", sub.getAccountId(), attempt.getReference());
        }
        accountStore.putSubscription(sub);
    }

    // ===================== 續費 / 撤銷 =====================

    /**
     * 記錄續費付款：計費日往後推一個週期，狀態回到 ACTIVE
     *
     * 同一個 paymentReference 重複送達時直接忽略。
     * 續費同時留下一筆 SUCCEEDED 的 PaymentAttempt，之後可以對它退款。
     *
     * @param gatewaySubscriptionId 帳單所屬的閘道訂閱，與帳號目前的不同時拒絕；可為 null
     * @return false = 重複的續費通知
     * @throws EntitlementException NO_ACTIVE_SUBSCRIPTION / AMOUNT_MISMATCH / SUPERSEDED
     */
    public boolean recordRenewal(String accountId, String paymentReference, long amountMinorUnits,
                                 String currency, String gatewayPaymentId, String gatewaySubscriptionId) {
        ReentrantLock lock = lockRegistry.subscriptionLock(accountId);
        lock.lock();
        try {
            Subscription sub = accountStore.getSubscription(accountId)
                    .orElseThrow(() -> new EntitlementException(ErrorCode.NO_ACTIVE_SUBSCRIPTION));
            if (paymentReference.equals(sub.getLastPaymentReference())
                    || accountStore.findAttempt(paymentReference).isPresent()) {
                log.info("續費通知重複，略過: accountId={} ref={}", accountId, paymentReference);
                return false;
            }
            if (gatewaySubscriptionId != null && sub.getGatewaySubscriptionId() != null
                    && !gatewaySubscriptionId.equals(sub.getGatewaySubscriptionId())) {
                auditService.failure(accountId, "RENEWAL", paymentReference, "gatewaySub=" + gatewaySubscriptionId);
                throw new EntitlementException(ErrorCode.SUPERSEDED, String.format(
                        "續費帳單來自已被取代的閘道訂閱 %s（目前為 %s）",
                        gatewaySubscriptionId, sub.getGatewaySubscriptionId()));
            }

            LocalDateTime now = LocalDateTime.now(clock);
            applyLifecycle(sub, now);
            if (!sub.getStatus().isEntitled()) {
                accountStore.putSubscription(sub);
                throw new EntitlementException(ErrorCode.NO_ACTIVE_SUBSCRIPTION,
                        "訂閱狀態 " + sub.getStatus() + " 無法續費");
            }

            Plan plan = planCatalog.require(sub.getPlanId());
            long expected = plan.priceFor(sub.getBillingCycle());
            if (amountMinorUnits != expected || !paymentConfig.getCurrency().equalsIgnoreCase(currency)) {
                auditService.failure(accountId, "RENEWAL", paymentReference,
                        "expected=" + expected + " actual=" + amountMinorUnits + " " + currency);
                throw new EntitlementException(ErrorCode.AMOUNT_MISMATCH, String.format(
                        "續費金額不符: 預期 %d %s，實際 %d %s",
                        expected, paymentConfig.getCurrency(), amountMinorUnits, currency));
            }

            BillingCycle cycle = sub.getBillingCycle();
            LocalDateTime base = sub.getNextBillingDate() != null ? sub.getNextBillingDate() : now;
            LocalDateTime next = cycle.advance(base);
            if (!next.isAfter(now)) {
                next = cycle.advance(now);
            }
            sub.setStatus(Subscription.Status.ACTIVE);
            sub.setNextBillingDate(next);
            sub.setLastPaymentReference(paymentReference);
            accountStore.putSubscription(sub);

            accountStore.putAttempt(PaymentAttempt.builder()
                    .reference(paymentReference)
                    .accountId(accountId)
                    .planId(plan.id())
                    .billingCycle(cycle)
                    .amountMinorUnits(amountMinorUnits)
                    .currency(paymentConfig.getCurrency())
                    .status(PaymentAttempt.Status.SUCCEEDED)
                    .gatewayPaymentId(gatewayPaymentId)
                    .verifiedAt(now)
                    .build());

            log.info("續費成功: accountId={} plan={} nextBilling={} ref={}",
                    accountId, plan.id(), next, paymentReference);
            auditService.success(accountId, "RENEWAL", paymentReference, "nextBilling=" + next);
            return true;
        } finally {
            lock.unlock();
        }
    }

    /**
     * 退款後撤銷權益：ACTIVE / EXPIRING / CANCELLED → REFUNDED
     *
     * @return 撤銷後的訂閱；帳號沒有訂閱記錄時為 empty
     */
    public Optional<Subscription> revoke(String accountId, String paymentReference) {
        String releasedGatewaySubscription;
        Subscription revoked;
        ReentrantLock lock = lockRegistry.subscriptionLock(accountId);
        lock.lock();
        try {
            Optional<Subscription> subOpt = accountStore.getSubscription(accountId);
            if (subOpt.isEmpty()) {
                log.warn("撤銷權益時找不到訂閱: accountId={} ref={}", accountId, paymentReference);
                return Optional.empty();
            }
            Subscription sub = subOpt.get();
            applyLifecycle(sub, LocalDateTime.now(clock));

            Subscription.Status status = sub.getStatus();
            releasedGatewaySubscription = sub.getGatewaySubscriptionId();
            if (status.isEntitled() || status == Subscription.Status.CANCELLED) {
                sub.setStatus(Subscription.Status.REFUNDED);
                sub.setNextBillingDate(null);
                sub.setAutoRenew(false);
                sub.setGatewaySubscriptionId(null);
                log.info("訂閱已撤銷: accountId={} {} → REFUNDED ref={}", accountId, status, paymentReference);
            } else {
                releasedGatewaySubscription = null;
                log.info("訂閱狀態 {} 不需撤銷: accountId={} ref={}", status, accountId, paymentReference);
            }
            revoked = accountStore.putSubscription(sub);
        } finally {
            lock.unlock();
        }

        releaseGatewaySubscription(accountId, releasedGatewaySubscription);
        return Optional.of(revoked);
    }

    // ===================== 閘道訂閱 =====================

    /**
     * 續費扣款失敗：只記錄，狀態不變
     *
     * 訂閱仍在寬限期（renewalGraceDays）內享有權益，閘道會自動重試扣款；
     * 寬限期過後仍未收到續費，讀取時自動轉為 CANCELLED。
     */
    public void recordRenewalFailure(String accountId, String invoiceReference, Long attemptCount) {
        log.warn("續費扣款失敗，進入寬限期: accountId={} invoice={} attempt={}",
                accountId, invoiceReference, attemptCount);
        auditService.failure(accountId, "RENEWAL", invoiceReference,
                "payment_failed attempt=" + attemptCount);
    }

    /**
     * 閘道端的定期扣款已結束（到期停止、後台取消、扣款重試用完）
     *
     * 只處理帳號目前的閘道訂閱；已被取代或本地已取消的直接略過。
     *
     * @return 有變更時回傳 accountId（呼叫端負責讓權益快取失效）
     */
    public Optional<String> endGatewaySubscription(String gatewaySubscriptionId) {
        Optional<String> accountOpt = accountStore.findSubscriptionByGatewayId(gatewaySubscriptionId)
                .map(Subscription::getAccountId);
        if (accountOpt.isEmpty()) {
            log.info("閘道訂閱已結束，但不是任何帳號目前的訂閱，略過: gatewaySub={}", gatewaySubscriptionId);
            return Optional.empty();
        }
        String accountId = accountOpt.get();

        ReentrantLock lock = lockRegistry.subscriptionLock(accountId);
        lock.lock();
        try {
            Subscription sub = accountStore.getSubscription(accountId).orElse(null);
            if (sub == null || !gatewaySubscriptionId.equals(sub.getGatewaySubscriptionId())) {
                return Optional.empty();
            }
            Subscription.Status before = sub.getStatus();
            sub.setGatewaySubscriptionId(null);
            sub.setAutoRenew(false);
            applyLifecycle(sub, LocalDateTime.now(clock));
            if (sub.getStatus().isEntitled()) {
                cancel(sub);
            }
            accountStore.putSubscription(sub);
            log.info("閘道訂閱已結束: accountId={} gatewaySub={} {} → {}",
                    accountId, gatewaySubscriptionId, before, sub.getStatus());
            auditService.success(accountId, "GATEWAY_SUBSCRIPTION_ENDED", gatewaySubscriptionId,
                    before + " → " + sub.getStatus());
            return Optional.of(accountId);
        } finally {
            lock.unlock();
        }
    }

    /**
     * 取消不再屬於帳號的閘道訂閱（換方案後的舊訂閱、被取代付款建立的訂閱、退款後的訂閱）
     *
     * 仍是帳號目前的閘道訂閱時不動。閘道失敗只記錄，需人工到 Stripe 後台取消。
     */
    public void releaseGatewaySubscription(String accountId, String gatewaySubscriptionId) {
        if (gatewaySubscriptionId == null) {
            return;
        }
        boolean stillCurrent = accountStore.getSubscription(accountId)
                .map(Subscription::getGatewaySubscriptionId)
                .filter(gatewaySubscriptionId::equals)
                .isPresent();
        if (stillCurrent) {
            log.warn("閘道訂閱仍在使用中，不取消: accountId={} gatewaySub={}", accountId, gatewaySubscriptionId);
            return;
        }
        try {
            gatewayClient.cancelSubscription(gatewaySubscriptionId);
            auditService.success(accountId, "GATEWAY_SUBSCRIPTION_RELEASED", gatewaySubscriptionId, null);
        } catch (GatewayException e) {
            log.error("取消閘道訂閱失敗，需人工處理: accountId={} gatewaySub={} err={}",
                    accountId, gatewaySubscriptionId, e.getMessage());
            auditService.failure(accountId, "GATEWAY_SUBSCRIPTION_RELEASED", gatewaySubscriptionId, e.getMessage());
        }
    }

    // ===================== 工具方法 =====================

    /**
     * 在帳號鎖內讀取訂閱並套用到期判斷，有變更時寫回
     */
    Optional<Subscription> loadEvaluated(String accountId) {
        ReentrantLock lock = lockRegistry.subscriptionLock(accountId);
        lock.lock();
        try {
            Optional<Subscription> subOpt = accountStore.getSubscription(accountId);
            subOpt.ifPresent(sub -> {
                if (applyLifecycle(sub, LocalDateTime.now(clock))) {
                    accountStore.putSubscription(sub);
                }
            });
            return subOpt;
        } finally {
            lock.unlock();
        }
    }

    /**
     * 時間驅動的狀態轉換
     *
     * @return true = 狀態有變更
     */
    boolean applyLifecycle(Subscription sub, LocalDateTime now) {
        LocalDateTime billing = sub.getNextBillingDate();
        if (billing == null) {
            return false;
        }
        Subscription.Status before = sub.getStatus();

        if (before == Subscription.Status.ACTIVE) {
            if (!sub.isAutoRenew()) {
                if (!now.isBefore(billing)) {
                    cancel(sub);
                } else if (!now.isBefore(billing.minusDays(entitlementConfig.getExpiringWarningDays()))) {
                    sub.setStatus(Subscription.Status.EXPIRING);
                }
            } else if (!now.isBefore(billing.plusDays(entitlementConfig.getRenewalGraceDays()))) {
                cancel(sub);
            }
        } else if (before == Subscription.Status.EXPIRING && !now.isBefore(billing)) {
            cancel(sub);
        }

        if (sub.getStatus() != before) {
            log.info("訂閱狀態變更: accountId={} {} → {} (nextBilling={})",
                    sub.getAccountId(), before, sub.getStatus(), billing);
            return true;
        }
        return false;
    }

    private void cancel(Subscription sub) {
        sub.setStatus(Subscription.Status.CANCELLED);
        sub.setNextBillingDate(null);
        sub.setAutoRenew(false);
    }

    private EntitlementException gatewayFailure(String message, GatewayException e) {
        ErrorCode code = e.isTransientFailure() ? ErrorCode.GATEWAY_TIMEOUT : ErrorCode.GATEWAY_REJECTED;
        return new EntitlementException(code, message + ": " + e.getMessage(), e);
    }

    private void ensureNotAlreadyOn(Subscription sub, Plan plan, BillingCycle cycle) {
        if (sub.getStatus() == Subscription.Status.ACTIVE
                && plan.id().equals(sub.getPlanId())
                && cycle == sub.getBillingCycle()
                && sub.isAutoRenew()) {
            throw new EntitlementException(ErrorCode.ALREADY_ON_PLAN,
                    "已經是 " + plan.displayName() + " (" + cycle + ")，無需變更");
        }
    }

    /**
     * 把帳號所有進行中的付款標記為 SUPERSEDED，呼叫端需持有帳號的訂閱鎖
     */
    private void supersedeInFlight(String accountId) {
        for (PaymentAttempt previous : accountStore.findInFlightAttempts(accountId)) {
            previous.setStatus(PaymentAttempt.Status.FAILED);
            previous.setFailureCode(ErrorCode.SUPERSEDED.name());
            accountStore.putAttempt(previous);
            log.info("舊付款已被取代: accountId={} ref={}", accountId, previous.getReference());
        }
    }

    private PaymentAttempt requireAttempt(String reference) {
        return accountStore.findAttempt(reference)
                .orElseThrow(() -> new EntitlementException(ErrorCode.UNKNOWN_REFERENCE,
                        "找不到付款參考編號: " + reference));
    }
}
