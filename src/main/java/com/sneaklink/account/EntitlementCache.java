package com.sneaklink.account;

import com.sneaklink.shared.config.EntitlementConfig;
import com.sneaklink.subscription.service.SubscriptionService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * 權益快取
 *
 * 熱路徑（配額扣減、裝置登記）不必每次都重算訂閱狀態。
 * 條目在 TTL 到期或到達 nextBillingDate 時失效；
 * 登入、登出、啟用、退款後由呼叫端明確 invalidate。
 */
@Slf4j
@Component
public class EntitlementCache {

    private final SubscriptionService subscriptionService;
    private final Clock clock;
    private final long ttlSeconds;

    private final Map<String, CachedEntry> cache = new ConcurrentHashMap<>();

    public EntitlementCache(SubscriptionService subscriptionService, Clock clock, EntitlementConfig config) {
        this.subscriptionService = subscriptionService;
        this.clock = clock;
        this.ttlSeconds = config.getCacheTtlSeconds();
    }

    public Entitlement get(String accountId) {
        LocalDateTime now = LocalDateTime.now(clock);
        CachedEntry entry = cache.get(accountId);
        if (entry != null && now.isBefore(entry.expiresAt())) {
            return entry.entitlement();
        }
        Entitlement loaded = subscriptionService.currentEntitlement(accountId);
        cache.put(accountId, new CachedEntry(loaded, expiryOf(loaded, now)));
        return loaded;
    }

    public void invalidate(String accountId) {
        if (cache.remove(accountId) != null) {
            log.debug("權益快取已清除: accountId={}", accountId);
        }
    }

    /** 目前快取筆數 */
    public int size() {
        return cache.size();
    }

    private LocalDateTime expiryOf(Entitlement entitlement, LocalDateTime now) {
        LocalDateTime expiry = now.plusSeconds(ttlSeconds);
        LocalDateTime billing = entitlement.nextBillingDate();
        if (billing != null && billing.isAfter(now) && billing.isBefore(expiry)) {
            return billing;
        }
        return expiry;
    }

    private record CachedEntry(Entitlement entitlement, LocalDateTime expiresAt) {
    }
}
