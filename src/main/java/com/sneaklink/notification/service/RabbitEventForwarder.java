package com.sneaklink.notification.service;

import com.sneaklink.notification.config.RabbitMQConfig;
import com.sneaklink.notification.event.EntitlementEvent;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.amqp.AmqpException;
import org.springframework.amqp.rabbit.core.RabbitTemplate;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 將權益事件轉送到 RabbitMQ topic exchange
 */
@Slf4j
@Component
@RequiredArgsConstructor
@ConditionalOnProperty(name = "entitlement.events.rabbitmq.enabled", havingValue = "true")
public class RabbitEventForwarder {

    private final RabbitTemplate rabbitTemplate;

    @EventListener
    public void forward(EntitlementEvent event) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("type", event.type().getRoutingKey());
        payload.put("accountId", event.accountId());
        payload.put("occurredAt", event.occurredAt().toString());
        payload.put("attributes", event.attributes());
        try {
            rabbitTemplate.convertAndSend(RabbitMQConfig.ENTITLEMENT_EXCHANGE,
                    event.type().getRoutingKey(), payload);
        } catch (AmqpException e) {
            // 事件遺失不影響權益狀態，留 log 供補發
            log.error("RabbitMQ 事件轉送失敗: type={} accountId={} err={}",
                    event.type().getRoutingKey(), event.accountId(), e.getMessage());
        }
    }
}
