package com.sneaklink.notification.event;

/**
 * 對外發出的事件種類；routingKey 同時作為 RabbitMQ topic routing key
 */
public enum EventType {

    SUBSCRIPTION_ACTIVATED("subscription.activated"),
    SUBSCRIPTION_REFUNDED("subscription.refunded"),
    QUOTA_EXCEEDED("quota.exceeded"),
    DEVICE_LIMIT_WARNING("device.limit.warning"),
    DISPUTE_RECORDED("dispute.recorded");

    private final String routingKey;

    EventType(String routingKey) {
        this.routingKey = routingKey;
    }

    public String getRoutingKey() {
        return routingKey;
    }
}
