package com.sneaklink.shared.config;

import lombok.Getter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

/**
 * 訂閱生命週期 / 裝置 / 快取設定
 *
 * 對應 application.yml:
 * entitlement:
 *   expiring-warning-days: 7
 *   renewal-grace-days: 3
 *   cache-ttl-seconds: 60
 *   device:
 *     max-tracked: 50
 *     stale-after-days: 30
 */
@Getter
@ConfigurationProperties(prefix = "entitlement")
public class EntitlementConfig {

    /** nextBillingDate 前幾天（且 autoRenew=false）進入 EXPIRING */
    private final int expiringWarningDays;

    /** autoRenew=true 但過了計費日仍未收到續費款項，寬限幾天後 CANCELLED */
    private final int renewalGraceDays;

    /** EntitlementCache 的 TTL */
    private final long cacheTtlSeconds;

    private final DeviceSettings device;

    public EntitlementConfig(
            @DefaultValue("7") int expiringWarningDays,
            @DefaultValue("3") int renewalGraceDays,
            @DefaultValue("60") long cacheTtlSeconds,
            @DefaultValue DeviceSettings device) {
        this.expiringWarningDays = expiringWarningDays;
        this.renewalGraceDays = renewalGraceDays;
        this.cacheTtlSeconds = cacheTtlSeconds;
        this.device = device != null ? device : new DeviceSettings(50, 30);
    }

    @Getter
    public static class DeviceSettings {

        /** 每個帳號最多保留幾筆 DeviceRecord（不限裝置數的方案也適用） */
        private final int maxTracked;

        /** 超過幾天沒出現的裝置在下次登入時清掉 */
        private final int staleAfterDays;

        public DeviceSettings(
                @DefaultValue("50") int maxTracked,
                @DefaultValue("30") int staleAfterDays) {
            this.maxTracked = maxTracked;
            this.staleAfterDays = staleAfterDays;
        }
    }
}
