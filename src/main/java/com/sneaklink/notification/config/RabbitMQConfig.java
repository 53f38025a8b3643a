package com.sneaklink.notification.config;

import lombok.extern.slf4j.Slf4j;
import org.springframework.amqp.core.TopicExchange;
import org.springframework.amqp.support.converter.Jackson2JsonMessageConverter;
import org.springframework.amqp.support.converter.MessageConverter;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * RabbitMQ 設定（僅在 entitlement.events.rabbitmq.enabled=true 時啟用）
 *
 * 所有權益事件發到同一個 topic exchange，routing key = 事件類型
 * （subscription.activated / subscription.refunded / quota.exceeded / ...），
 * 下游服務自己綁定需要的 pattern，例如 "subscription.*"。
 */
@Slf4j
@Configuration
@ConditionalOnProperty(name = "entitlement.events.rabbitmq.enabled", havingValue = "true")
public class RabbitMQConfig {

    public static final String ENTITLEMENT_EXCHANGE = "entitlement.events";

    @Bean
    public TopicExchange entitlementExchange() {
        log.info("RabbitMQ 事件轉送已啟用: exchange={}", ENTITLEMENT_EXCHANGE);
        return new TopicExchange(ENTITLEMENT_EXCHANGE, true, false);
    }

    @Bean
    public MessageConverter jsonMessageConverter() {
        return new Jackson2JsonMessageConverter();
    }
}
