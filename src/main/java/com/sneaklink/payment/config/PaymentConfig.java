package com.sneaklink.payment.config;

import lombok.Getter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

/**
 * 付款流程設定
 *
 * 對應 application.yml:
 * payment:
 *   currency: usd
 *   success-url: https://app.sneaklink.io/billing/success?reference={CHECKOUT_SESSION_ID}
 *   cancel-url: https://app.sneaklink.io/billing/cancel
 *   verify:
 *     timeout-ms: 25000
 *     health-timeout-ms: 5000
 *     max-attempts: 3
 *     backoff-ms: 1000
 *   display:
 *     currency: NGN
 *     rate: 1500
 */
@Getter
@ConfigurationProperties(prefix = "payment")
public class PaymentConfig {

    /** 收款幣別（ISO 4217 小寫），所有方案價格都以此幣別的最小單位計 */
    private final String currency;
    private final String successUrl;
    private final String cancelUrl;
    private final VerifySettings verify;
    private final DisplaySettings display;

    public PaymentConfig(
            @DefaultValue("usd") String currency,
            @DefaultValue("http://localhost:3000/billing/success?reference={CHECKOUT_SESSION_ID}") String successUrl,
            @DefaultValue("http://localhost:3000/billing/cancel") String cancelUrl,
            @DefaultValue VerifySettings verify,
            @DefaultValue DisplaySettings display) {
        this.currency = currency;
        this.successUrl = successUrl;
        this.cancelUrl = cancelUrl;
        this.verify = verify != null ? verify : new VerifySettings(25000, 5000, 3, 1000);
        this.display = display != null ? display : new DisplaySettings("NGN", 1500);
    }

    @Getter
    public static class VerifySettings {

        /** verify() 查詢閘道的總期限 */
        private final long timeoutMs;

        /** 健康檢查的期限 */
        private final long healthTimeoutMs;

        /** 暫時性錯誤最多嘗試次數（含第一次） */
        private final int maxAttempts;

        /** 線性退避：第 n 次失敗後等 backoffMs × n */
        private final long backoffMs;

        public VerifySettings(
                @DefaultValue("25000") long timeoutMs,
                @DefaultValue("5000") long healthTimeoutMs,
                @DefaultValue("3") int maxAttempts,
                @DefaultValue("1000") long backoffMs) {
            this.timeoutMs = timeoutMs;
            this.healthTimeoutMs = healthTimeoutMs;
            this.maxAttempts = maxAttempts;
            this.backoffMs = backoffMs;
        }
    }

    /**
     * 管理後台報表用的顯示幣別（只在讀取時換算，不落地）
     */
    @Getter
    public static class DisplaySettings {

        private final String currency;

        /** 1 單位收款幣別 = rate 單位顯示幣別 */
        private final long rate;

        public DisplaySettings(
                @DefaultValue("NGN") String currency,
                @DefaultValue("1500") long rate) {
            this.currency = currency;
            this.rate = rate;
        }
    }
}
