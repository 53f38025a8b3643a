package com.sneaklink.payment.gateway;

/**
 * 金流閘道介面
 *
 * 實作不做重試也不設自己的逾時以外的期限，這兩件事只由 PaymentVerificationCoordinator 決定。
 */
public interface PaymentGatewayClient {

    GatewayCharge initializeCharge(ChargeRequest request) throws GatewayException;

    GatewayTransaction lookupTransaction(String reference) throws GatewayException;

    /**
     * @param reference 付款參考編號（initializeCharge 回傳的 reference 或續費時的閘道付款 ID）
     */
    GatewayRefund refund(String reference, long amountMinorUnits, String note) throws GatewayException;

    /**
     * 設定定期扣款在本期結束後是否繼續（關閉 = 期末停止，不立即取消）
     */
    void setAutoRenew(String gatewaySubscriptionId, boolean autoRenew) throws GatewayException;

    /**
     * 立即取消定期扣款，不再產生新的帳單
     */
    void cancelSubscription(String gatewaySubscriptionId) throws GatewayException;

    /**
     * 輕量的連線檢查，失敗時丟出 GatewayException
     */
    void ping() throws GatewayException;
}
