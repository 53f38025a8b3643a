package com.sneaklink.notification.service;

import com.sneaklink.notification.event.EntitlementEvent;
import com.sneaklink.notification.event.EventType;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.Map;

/**
 * 事件發送入口
 *
 * 監聽者（RabbitEventForwarder、OpsWebhookService）出錯不影響呼叫端。
 */
@Slf4j
@Component
public class EntitlementEventPublisher {

    private final ApplicationEventPublisher publisher;
    private final Clock clock;

    public EntitlementEventPublisher(ApplicationEventPublisher publisher, Clock clock) {
        this.publisher = publisher;
        this.clock = clock;
    }

    public void publish(EventType type, String accountId, Map<String, Object> attributes) {
        EntitlementEvent event = new EntitlementEvent(
                type, accountId, Map.copyOf(attributes), LocalDateTime.now(clock));
        try {
            publisher.publishEvent(event);
            log.debug("事件已發送: type={} accountId={}", type.getRoutingKey(), accountId);
        } catch (Exception e) {
            log.error("事件發送失敗: type={} accountId={}", type.getRoutingKey(), accountId, e);
        }
    }
}
