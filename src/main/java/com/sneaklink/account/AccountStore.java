package com.sneaklink.account;

import com.sneaklink.device.entity.DeviceRecord;
import com.sneaklink.dispute.entity.DisputeOrRefund;
import com.sneaklink.quota.QuotaKind;
import com.sneaklink.quota.entity.UsageCounter;
import com.sneaklink.subscription.entity.PaymentAttempt;
import com.sneaklink.subscription.entity.Subscription;

import java.util.List;
import java.util.Optional;

/**
 * 帳號資料存取介面
 *
 * 所有服務只透過這個介面讀寫訂閱、計數器、裝置、付款與爭議。
 * 每次寫入各自提交；跨資料的一致性由 AccountLockRegistry 的 per-account 鎖保證。
 */
public interface AccountStore {

    // ===== Subscription =====

    Optional<Subscription> getSubscription(String accountId);

    Subscription putSubscription(Subscription subscription);

    /** 依閘道端訂閱 ID 找帳號的訂閱（續費 / 閘道取消通知沒有帶帳號時用） */
    Optional<Subscription> findSubscriptionByGatewayId(String gatewaySubscriptionId);

    // ===== UsageCounter =====

    /**
     * 取得計數器；不存在時回傳尚未儲存的新計數器（count = 0，沒有窗口）
     */
    UsageCounter getOrCreateCounter(String accountId, QuotaKind kind);

    UsageCounter putCounter(UsageCounter counter);

    // ===== DeviceRecord =====

    /** 依 lastSeenAt 由舊到新 */
    List<DeviceRecord> listDevices(String accountId);

    DeviceRecord upsertDevice(DeviceRecord device);

    void evictDevice(String accountId, String deviceId);

    // ===== PaymentAttempt =====

    Optional<PaymentAttempt> findAttempt(String reference);

    Optional<PaymentAttempt> findAttemptByGatewayPaymentId(String gatewayPaymentId);

    /** INITIALIZED / VERIFYING / TIMED_OUT */
    List<PaymentAttempt> findInFlightAttempts(String accountId);

    PaymentAttempt putAttempt(PaymentAttempt attempt);

    // ===== DisputeOrRefund =====

    DisputeOrRefund putDisputeOrRefund(DisputeOrRefund record);

    Optional<DisputeOrRefund> findDisputeOrRefund(Long id);

    List<DisputeOrRefund> findPendingDisputes(String paymentReference);

    /**
     * @param resolution null = 全部
     */
    List<DisputeOrRefund> listDisputes(DisputeOrRefund.Resolution resolution);

    long sumResolvedRefunds(String paymentReference);
}
