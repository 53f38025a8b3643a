package com.sneaklink.payment.service;

import com.sneaklink.payment.config.PaymentConfig;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.math.RoundingMode;

/**
 * 管理後台顯示用的幣別換算
 *
 * 只在讀取時換算，結果不寫回資料庫；所有計算與比對都用最小貨幣單位的收款幣別。
 */
@Component
public class DisplayCurrencyConverter {

    private final String displayCurrency;
    private final long rate;

    public DisplayCurrencyConverter(PaymentConfig paymentConfig) {
        this.displayCurrency = paymentConfig.getDisplay().getCurrency();
        this.rate = paymentConfig.getDisplay().getRate();
    }

    /**
     * 7900（USD cents）→ 118500.00（NGN，rate=1500）
     */
    public BigDecimal displayAmount(long minorUnits) {
        return BigDecimal.valueOf(minorUnits)
                .multiply(BigDecimal.valueOf(rate))
                .divide(BigDecimal.valueOf(100), 2, RoundingMode.HALF_UP);
    }

    public String getDisplayCurrency() {
        return displayCurrency;
    }
}
