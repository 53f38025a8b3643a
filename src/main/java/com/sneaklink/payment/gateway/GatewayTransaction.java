package com.sneaklink.payment.gateway;

/**
 * 閘道端查到的交易狀態
 *
 * @param paymentId      閘道端的付款 ID（退款、爭議對應用），尚未付款時可為 null
 * @param subscriptionId 付款建立的定期扣款訂閱 ID，尚未付款時可為 null
 */
public record GatewayTransaction(
        String reference,
        Status status,
        long amountMinorUnits,
        String currency,
        String paymentId,
        String subscriptionId
) {

    public enum Status {
        PAID,    // 已付款
        OPEN,    // 尚未完成付款
        FAILED   // 明確失敗（過期 / 拒付）
    }
}
