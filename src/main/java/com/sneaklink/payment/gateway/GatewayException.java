package com.sneaklink.payment.gateway;

import lombok.Getter;

/**
 * 金流閘道呼叫失敗
 *
 * transientFailure=true 表示網路 / 限流 / 5xx，可在期限內重試；
 * false 表示閘道明確拒絕（參數錯誤、找不到交易、退款被拒）。
 */
@Getter
public class GatewayException extends Exception {

    private final boolean transientFailure;

    public GatewayException(String message, boolean transientFailure) {
        super(message);
        this.transientFailure = transientFailure;
    }

    public GatewayException(String message, boolean transientFailure, Throwable cause) {
        super(message, cause);
        this.transientFailure = transientFailure;
    }
}
