package com.sneaklink.quota.service;

import com.sneaklink.account.AccountStore;
import com.sneaklink.account.Entitlement;
import com.sneaklink.account.EntitlementCache;
import com.sneaklink.notification.event.EventType;
import com.sneaklink.notification.service.EntitlementEventPublisher;
import com.sneaklink.plan.Plan;
import com.sneaklink.plan.QuotaLimits;
import com.sneaklink.quota.QuotaKind;
import com.sneaklink.quota.dto.QuotaBalance;
import com.sneaklink.quota.entity.UsageCounter;
import com.sneaklink.shared.exception.EntitlementException;
import com.sneaklink.shared.exception.ErrorCode;
import com.sneaklink.shared.exception.QuotaExceededException;
import com.sneaklink.shared.service.AccountLockRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.concurrent.locks.ReentrantLock;

/**
 * 用量配額帳本
 *
 * 每個 accountId × kind 一把鎖，讀-判斷-寫在鎖內完成，count 永遠不會被扣超過 limit。
 * 超額時不寫任何東西。limit 每次存取都跟著生效方案更新；方案變更時 count 沿用，不倒扣。
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class UsageQuotaLedger {

    public static final String LINKS_PER_EXPORT = "LINKS_PER_EXPORT";

    private final AccountStore accountStore;
    private final EntitlementCache entitlementCache;
    private final AccountLockRegistry lockRegistry;
    private final EntitlementEventPublisher eventPublisher;
    private final Clock clock;

    /**
     * 扣減用量
     *
     * @return 扣減後剩餘量；不限時為 -1
     * @throws QuotaExceededException 超過上限（帶 limit / used），計數器不變
     */
    public long tryConsume(String accountId, QuotaKind kind, long amount) {
        if (amount <= 0) {
            throw new EntitlementException(ErrorCode.INVALID_AMOUNT, "amount 必須為正整數: " + amount);
        }
        Entitlement entitlement = entitlementCache.get(accountId);
        long limit = kind.limitOf(entitlement.limits());

        long exceededUsed;
        ReentrantLock lock = lockRegistry.quotaLock(accountId, kind.name());
        lock.lock();
        try {
            LocalDateTime now = LocalDateTime.now(clock);
            UsageCounter counter = accountStore.getOrCreateCounter(accountId, kind);
            rollIfExpired(counter, kind, now, entitlement.nextBillingDate());
            counter.setLimit(limit);

            boolean unlimited = QuotaLimits.isUnlimited(limit);
            if (unlimited || counter.getCount() + amount <= limit) {
                counter.setCount(counter.getCount() + amount);
                accountStore.putCounter(counter);
                log.debug("配額扣減: accountId={} kind={} count={}/{}", accountId, kind, counter.getCount(), limit);
                return unlimited ? QuotaLimits.UNLIMITED : limit - counter.getCount();
            }
            exceededUsed = counter.getCount();
        } finally {
            lock.unlock();
        }

        // 事件在鎖外發，監聽者（同步轉發 / webhook）不會卡住同帳號的扣減
        log.warn("配額不足: accountId={} kind={} limit={} used={} requested={}",
                accountId, kind, limit, exceededUsed, amount);
        eventPublisher.publish(EventType.QUOTA_EXCEEDED, accountId, Map.of(
                "kind", kind.name(), "limit", limit, "used", exceededUsed, "plan", entitlement.planId()));
        throw new QuotaExceededException(kind.name(), limit, exceededUsed);
    }

    public long tryConsume(String accountId, QuotaKind kind) {
        return tryConsume(accountId, kind, 1);
    }

    /**
     * 查詢餘額（套用窗口歸零，但不寫回）
     */
    public QuotaBalance balance(String accountId, QuotaKind kind) {
        Entitlement entitlement = entitlementCache.get(accountId);
        long limit = kind.limitOf(entitlement.limits());

        ReentrantLock lock = lockRegistry.quotaLock(accountId, kind.name());
        lock.lock();
        try {
            UsageCounter counter = accountStore.getOrCreateCounter(accountId, kind);
            rollIfExpired(counter, kind, LocalDateTime.now(clock), entitlement.nextBillingDate());
            long used = counter.getCount();
            long remaining = QuotaLimits.isUnlimited(limit)
                    ? QuotaLimits.UNLIMITED
                    : Math.max(0, limit - used);
            return QuotaBalance.builder()
                    .kind(kind)
                    .limit(limit)
                    .used(used)
                    .remaining(remaining)
                    .windowEnd(counter.getWindowEnd())
                    .build();
        } finally {
            lock.unlock();
        }
    }

    public List<QuotaBalance> balances(String accountId) {
        return Arrays.stream(QuotaKind.values())
                .map(kind -> balance(accountId, kind))
                .toList();
    }

    /**
     * 啟用 / 退款後立即把所有計數器的 limit 換成新方案的值（count 不動）
     */
    public void applyPlanLimits(String accountId, Plan plan) {
        Entitlement entitlement = entitlementCache.get(accountId);
        for (QuotaKind kind : QuotaKind.values()) {
            ReentrantLock lock = lockRegistry.quotaLock(accountId, kind.name());
            lock.lock();
            try {
                UsageCounter counter = accountStore.getOrCreateCounter(accountId, kind);
                rollIfExpired(counter, kind, LocalDateTime.now(clock), entitlement.nextBillingDate());
                counter.setLimit(kind.limitOf(plan.limits()));
                accountStore.putCounter(counter);
            } finally {
                lock.unlock();
            }
        }
        log.info("配額上限已套用: accountId={} plan={}", accountId, plan.id());
    }

    /**
     * 單次匯出的連結數檢查
     *
     * @throws QuotaExceededException limit = 單次上限，used = 本次連結數
     */
    public void checkExportSize(String accountId, int linkCount) {
        Entitlement entitlement = entitlementCache.get(accountId);
        long limit = entitlement.limits().maxLinksPerExport();
        if (!QuotaLimits.isUnlimited(limit) && linkCount > limit) {
            log.warn("單次匯出連結數超過上限: accountId={} limit={} links={}", accountId, limit, linkCount);
            eventPublisher.publish(EventType.QUOTA_EXCEEDED, accountId, Map.of(
                    "kind", LINKS_PER_EXPORT, "limit", limit, "used", (long) linkCount,
                    "plan", entitlement.planId()));
            throw new QuotaExceededException(LINKS_PER_EXPORT, limit, linkCount);
        }
    }

    /**
     * 窗口不存在或已過期時開新窗口並歸零
     */
    private void rollIfExpired(UsageCounter counter, QuotaKind kind, LocalDateTime now, LocalDateTime anchor) {
        if (counter.getWindowEnd() != null && now.isBefore(counter.getWindowEnd())) {
            return;
        }
        UsageWindow window = UsageWindow.containing(kind, now, anchor);
        if (counter.getWindowEnd() != null) {
            log.debug("配額窗口歸零: accountId={} kind={} prevCount={} newWindow={}~{}",
                    counter.getAccountId(), kind, counter.getCount(), window.start(), window.end());
        }
        counter.setWindowStart(window.start());
        counter.setWindowEnd(window.end());
        counter.setCount(0);
    }
}
