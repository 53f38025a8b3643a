package com.sneaklink.notification.config;

import lombok.Getter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

/**
 * 營運通知 webhook（Slack / Discord 相容的 incoming webhook）
 */
@Getter
@ConfigurationProperties(prefix = "ops.webhook")
public class OpsWebhookConfig {

    private final String url;
    private final boolean enabled;

    public OpsWebhookConfig(String url, @DefaultValue("false") boolean enabled) {
        this.url = url;
        this.enabled = enabled;
    }
}
