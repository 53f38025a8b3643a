package com.sneaklink.device.service;

import com.sneaklink.account.AccountStore;
import com.sneaklink.account.Entitlement;
import com.sneaklink.account.EntitlementCache;
import com.sneaklink.device.dto.DeviceAdmission;
import com.sneaklink.device.dto.DeviceResponse;
import com.sneaklink.device.entity.DeviceRecord;
import com.sneaklink.notification.event.EventType;
import com.sneaklink.notification.service.EntitlementEventPublisher;
import com.sneaklink.plan.QuotaLimits;
import com.sneaklink.shared.config.EntitlementConfig;
import com.sneaklink.shared.service.AccountLockRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;

/**
 * 裝置 / 連線數限制
 *
 * 不會擋登入：新裝置超過方案上限時回傳 warning，並踢掉最久沒出現的裝置騰出位置。
 * - 超過 staleAfterDays 沒出現的裝置在下次登記時清掉
 * - 不限裝置數的方案也最多保留 maxTracked 筆
 */
@Slf4j
@Service
public class DeviceLimitEnforcer {

    private final AccountStore accountStore;
    private final EntitlementCache entitlementCache;
    private final AccountLockRegistry lockRegistry;
    private final EntitlementEventPublisher eventPublisher;
    private final Clock clock;
    private final int maxTracked;
    private final int staleAfterDays;

    public DeviceLimitEnforcer(AccountStore accountStore,
                               EntitlementCache entitlementCache,
                               AccountLockRegistry lockRegistry,
                               EntitlementEventPublisher eventPublisher,
                               Clock clock,
                               EntitlementConfig config) {
        this.accountStore = accountStore;
        this.entitlementCache = entitlementCache;
        this.lockRegistry = lockRegistry;
        this.eventPublisher = eventPublisher;
        this.clock = clock;
        this.maxTracked = config.getDevice().getMaxTracked();
        this.staleAfterDays = config.getDevice().getStaleAfterDays();
    }

    /**
     * 登入：清掉權益快取後登記裝置
     */
    public DeviceAdmission login(String accountId, String deviceId) {
        entitlementCache.invalidate(accountId);
        return admitDevice(accountId, deviceId);
    }

    /**
     * 登出：移除裝置並清掉權益快取
     *
     * @return false = 裝置本來就不存在
     */
    public boolean logout(String accountId, String deviceId) {
        boolean removed = removeDevice(accountId, deviceId);
        entitlementCache.invalidate(accountId);
        return removed;
    }

    /**
     * 登記裝置
     */
    public DeviceAdmission admitDevice(String accountId, String deviceId) {
        Entitlement entitlement = entitlementCache.get(accountId);
        long maxDevices = entitlement.limits().maxDevices();
        boolean limited = !QuotaLimits.isUnlimited(maxDevices);
        int cap = limited ? (int) Math.max(1, Math.min(maxDevices, maxTracked)) : maxTracked;

        ReentrantLock lock = lockRegistry.deviceLock(accountId);
        lock.lock();
        try {
            LocalDateTime now = LocalDateTime.now(clock);
            List<DeviceRecord> devices = pruneStale(accountId, now);

            Optional<DeviceRecord> known = devices.stream()
                    .filter(d -> d.getDeviceId().equals(deviceId))
                    .findFirst();
            if (known.isPresent()) {
                DeviceRecord device = known.get();
                device.setLastSeenAt(now);
                accountStore.upsertDevice(device);
                return DeviceAdmission.builder()
                        .warning(false)
                        .evictedDeviceIds(List.of())
                        .maxDevices(maxDevices)
                        .deviceCount(devices.size())
                        .build();
            }

            boolean warning = limited && devices.size() >= maxDevices;
            List<String> evicted = new ArrayList<>();
            while (devices.size() >= cap && !devices.isEmpty()) {
                DeviceRecord oldest = devices.remove(0);
                accountStore.evictDevice(accountId, oldest.getDeviceId());
                evicted.add(oldest.getDeviceId());
            }

            accountStore.upsertDevice(DeviceRecord.builder()
                    .accountId(accountId)
                    .deviceId(deviceId)
                    .firstSeenAt(now)
                    .lastSeenAt(now)
                    .build());
            int count = devices.size() + 1;

            if (warning) {
                log.warn("裝置數超過方案上限: accountId={} plan={} max={} newDevice={} evicted={}",
                        accountId, entitlement.planId(), maxDevices, deviceId, evicted);
                eventPublisher.publish(EventType.DEVICE_LIMIT_WARNING, accountId, Map.of(
                        "deviceId", deviceId,
                        "maxDevices", maxDevices,
                        "evictedDeviceIds", List.copyOf(evicted),
                        "plan", entitlement.planId()));
            } else {
                log.info("新裝置登記: accountId={} deviceId={} count={}", accountId, deviceId, count);
            }

            return DeviceAdmission.builder()
                    .warning(warning)
                    .evictedDeviceIds(List.copyOf(evicted))
                    .maxDevices(maxDevices)
                    .deviceCount(count)
                    .build();
        } finally {
            lock.unlock();
        }
    }

    public List<DeviceResponse> listDevices(String accountId) {
        return accountStore.listDevices(accountId).stream()
                .map(d -> new DeviceResponse(d.getDeviceId(), d.getFirstSeenAt(), d.getLastSeenAt()))
                .toList();
    }

    public boolean removeDevice(String accountId, String deviceId) {
        ReentrantLock lock = lockRegistry.deviceLock(accountId);
        lock.lock();
        try {
            boolean exists = accountStore.listDevices(accountId).stream()
                    .anyMatch(d -> d.getDeviceId().equals(deviceId));
            if (exists) {
                accountStore.evictDevice(accountId, deviceId);
                log.info("裝置已移除: accountId={} deviceId={}", accountId, deviceId);
            }
            return exists;
        } finally {
            lock.unlock();
        }
    }

    /**
     * 清掉太久沒出現的裝置，回傳剩下的（依 lastSeenAt 由舊到新），呼叫端需持有裝置鎖
     */
    private List<DeviceRecord> pruneStale(String accountId, LocalDateTime now) {
        LocalDateTime staleBefore = now.minusDays(staleAfterDays);
        List<DeviceRecord> remaining = new ArrayList<>();
        for (DeviceRecord device : accountStore.listDevices(accountId)) {
            if (device.getLastSeenAt() != null && device.getLastSeenAt().isBefore(staleBefore)) {
                accountStore.evictDevice(accountId, device.getDeviceId());
                log.info("清除閒置裝置: accountId={} deviceId={} lastSeen={}",
                        accountId, device.getDeviceId(), device.getLastSeenAt());
            } else {
                remaining.add(device);
            }
        }
        remaining.sort(Comparator.comparing(DeviceRecord::getLastSeenAt,
                Comparator.nullsFirst(Comparator.naturalOrder())));
        return remaining;
    }
}
