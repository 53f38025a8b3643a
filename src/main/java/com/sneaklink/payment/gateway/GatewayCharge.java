package com.sneaklink.payment.gateway;

/**
 * @param reference   閘道產生的付款參考編號（不透明字串，原樣保存）
 * @param redirectUrl 讓使用者完成付款的頁面
 */
public record GatewayCharge(String reference, String redirectUrl) {
}
