package com.sneaklink.account;

import com.sneaklink.device.entity.DeviceRecord;
import com.sneaklink.device.repository.DeviceRecordRepository;
import com.sneaklink.dispute.entity.DisputeOrRefund;
import com.sneaklink.dispute.repository.DisputeOrRefundRepository;
import com.sneaklink.quota.QuotaKind;
import com.sneaklink.quota.entity.UsageCounter;
import com.sneaklink.quota.repository.UsageCounterRepository;
import com.sneaklink.subscription.entity.PaymentAttempt;
import com.sneaklink.subscription.entity.Subscription;
import com.sneaklink.subscription.repository.PaymentAttemptRepository;
import com.sneaklink.subscription.repository.SubscriptionRepository;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.EnumSet;
import java.util.List;
import java.util.Optional;

/**
 * AccountStore 的 JPA 實作，直接委派給各模組的 Repository
 */
@Component
@RequiredArgsConstructor
public class JpaAccountStore implements AccountStore {

    private static final EnumSet<PaymentAttempt.Status> IN_FLIGHT = EnumSet.of(
            PaymentAttempt.Status.INITIALIZED,
            PaymentAttempt.Status.VERIFYING,
            PaymentAttempt.Status.TIMED_OUT);

    private final SubscriptionRepository subscriptionRepository;
    private final PaymentAttemptRepository paymentAttemptRepository;
    private final UsageCounterRepository usageCounterRepository;
    private final DeviceRecordRepository deviceRecordRepository;
    private final DisputeOrRefundRepository disputeOrRefundRepository;

    @Override
    public Optional<Subscription> getSubscription(String accountId) {
        return subscriptionRepository.findByAccountId(accountId);
    }

    @Override
    public Subscription putSubscription(Subscription subscription) {
        return subscriptionRepository.save(subscription);
    }

    @Override
    public Optional<Subscription> findSubscriptionByGatewayId(String gatewaySubscriptionId) {
        return subscriptionRepository.findByGatewaySubscriptionId(gatewaySubscriptionId);
    }

    @Override
    public UsageCounter getOrCreateCounter(String accountId, QuotaKind kind) {
        return usageCounterRepository.findByAccountIdAndKind(accountId, kind)
                .orElseGet(() -> UsageCounter.builder()
                        .accountId(accountId)
                        .kind(kind)
                        .count(0)
                        .build());
    }

    @Override
    public UsageCounter putCounter(UsageCounter counter) {
        return usageCounterRepository.save(counter);
    }

    @Override
    public List<DeviceRecord> listDevices(String accountId) {
        return deviceRecordRepository.findByAccountIdOrderByLastSeenAtAsc(accountId);
    }

    @Override
    public DeviceRecord upsertDevice(DeviceRecord device) {
        return deviceRecordRepository.save(device);
    }

    @Override
    public void evictDevice(String accountId, String deviceId) {
        deviceRecordRepository.deleteByAccountIdAndDeviceId(accountId, deviceId);
    }

    @Override
    public Optional<PaymentAttempt> findAttempt(String reference) {
        return paymentAttemptRepository.findByReference(reference);
    }

    @Override
    public Optional<PaymentAttempt> findAttemptByGatewayPaymentId(String gatewayPaymentId) {
        return paymentAttemptRepository.findByGatewayPaymentId(gatewayPaymentId);
    }

    @Override
    public List<PaymentAttempt> findInFlightAttempts(String accountId) {
        return paymentAttemptRepository.findByAccountIdAndStatusIn(accountId, IN_FLIGHT);
    }

    @Override
    public PaymentAttempt putAttempt(PaymentAttempt attempt) {
        return paymentAttemptRepository.save(attempt);
    }

    @Override
    public DisputeOrRefund putDisputeOrRefund(DisputeOrRefund record) {
        return disputeOrRefundRepository.save(record);
    }

    @Override
    public Optional<DisputeOrRefund> findDisputeOrRefund(Long id) {
        return disputeOrRefundRepository.findById(id);
    }

    @Override
    public List<DisputeOrRefund> findPendingDisputes(String paymentReference) {
        return disputeOrRefundRepository.findByPaymentReferenceAndKindAndResolution(
                paymentReference, DisputeOrRefund.Kind.DISPUTE, DisputeOrRefund.Resolution.PENDING);
    }

    @Override
    public List<DisputeOrRefund> listDisputes(DisputeOrRefund.Resolution resolution) {
        if (resolution == null) {
            return disputeOrRefundRepository.findByKindOrderByCreatedAtDesc(DisputeOrRefund.Kind.DISPUTE);
        }
        return disputeOrRefundRepository.findByKindAndResolutionOrderByCreatedAtDesc(
                DisputeOrRefund.Kind.DISPUTE, resolution);
    }

    @Override
    public long sumResolvedRefunds(String paymentReference) {
        return disputeOrRefundRepository.sumResolvedRefunds(paymentReference);
    }
}
