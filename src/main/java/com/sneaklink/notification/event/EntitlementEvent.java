package com.sneaklink.notification.event;

import java.time.LocalDateTime;
import java.util.Map;

/**
 * 權益相關事件（Spring application event，可再轉送到 RabbitMQ / ops webhook）
 *
 * attributes 只放可序列化的簡單值（字串、數字、布林、字串清單）。
 */
public record EntitlementEvent(
        EventType type,
        String accountId,
        Map<String, Object> attributes,
        LocalDateTime occurredAt
) {

    public Object attribute(String key) {
        return attributes.get(key);
    }
}
