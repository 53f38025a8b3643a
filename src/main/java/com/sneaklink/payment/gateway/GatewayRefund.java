package com.sneaklink.payment.gateway;

/**
 * @param confirmed 閘道已接受退款（succeeded / pending）
 */
public record GatewayRefund(String refundId, boolean confirmed, String rawStatus) {
}
