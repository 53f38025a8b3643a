package com.sneaklink.shared.service;

import org.springframework.stereotype.Component;

import java.util.concurrent.locks.ReentrantLock;

/**
 * 跨服務的 per-account 互斥鎖（分段鎖）
 *
 * 鎖依用途分成四組，每組固定 {@value #STRIPES} 把，key 雜湊後取其中一把：
 * - subscription  {accountId}      方案選擇 / 啟用 / 放棄 / 撤銷 / 取消
 * - quota         {accountId}:{kind} 配額扣減（每種配額各一把）
 * - device        {accountId}      裝置登記
 * - refund        {reference}      同一筆付款的退款
 *
 * 鎖的數量不隨帳號數成長。不同 key 可能落在同一把鎖上，只會多一點等待，不影響正確性。
 * 巢狀取得只有 refund → subscription、refund → quota、device → subscription 三種方向，
 * 每組各自一個陣列，所以碰撞不會形成循環等待。
 *
 * 所有 Service 注入同一個 bean，確保同一個 key 全域只有一把鎖。
 */
@Component
public class AccountLockRegistry {

    static final int STRIPES = 256;

    private final ReentrantLock[] subscriptionLocks = newStripes();
    private final ReentrantLock[] quotaLocks = newStripes();
    private final ReentrantLock[] deviceLocks = newStripes();
    private final ReentrantLock[] refundLocks = newStripes();

    public ReentrantLock subscriptionLock(String accountId) {
        return stripe(subscriptionLocks, accountId);
    }

    public ReentrantLock quotaLock(String accountId, String kind) {
        return stripe(quotaLocks, accountId + ":" + kind);
    }

    public ReentrantLock deviceLock(String accountId) {
        return stripe(deviceLocks, accountId);
    }

    public ReentrantLock refundLock(String paymentReference) {
        return stripe(refundLocks, paymentReference);
    }

    private static ReentrantLock stripe(ReentrantLock[] stripes, String key) {
        int h = key.hashCode();
        h ^= (h >>> 16);
        return stripes[h & (STRIPES - 1)];
    }

    private static ReentrantLock[] newStripes() {
        ReentrantLock[] stripes = new ReentrantLock[STRIPES];
        for (int i = 0; i < STRIPES; i++) {
            stripes[i] = new ReentrantLock();
        }
        return stripes;
    }
}
