package com.sneaklink.device.service;

import com.sneaklink.device.dto.DeviceAdmission;
import com.sneaklink.device.dto.DeviceResponse;
import com.sneaklink.notification.event.EventType;
import com.sneaklink.plan.Plan;
import com.sneaklink.plan.PlanCatalog;
import com.sneaklink.plan.QuotaLimits;
import com.sneaklink.support.EntitlementFixture;
import org.junit.jupiter.api.*;

import java.time.Duration;
import java.util.List;

import static org.assertj.core.api.Assertions.*;

/**
 * DeviceLimitEnforcer 單元測試
 *
 * 覆蓋：上限內登記、超過上限踢掉最舊裝置並警告、已知裝置刷新、閒置裝置清除、登出
 */
class DeviceLimitEnforcerTest {

    private static final String ACCOUNT = "acc-1";

    private EntitlementFixture fx;
    private DeviceLimitEnforcer enforcer;

    @BeforeEach
    void setUp() {
        PlanCatalog catalog = new PlanCatalog(List.of(
                new Plan("free", "Free", 0, 0, new QuotaLimits(0, 0, 0, QuotaLimits.UNLIMITED, 0), 0),
                new Plan("solo", "Solo", 1900, 19000, new QuotaLimits(100, 1, 1, 1, 50), 1),
                new Plan("pro", "Pro", 7900, 79000, new QuotaLimits(10000, 10, 5, 3, 500), 2)));
        fx = new EntitlementFixture(catalog);
        enforcer = fx.deviceEnforcer;
    }

    @AfterEach
    void tearDown() {
        fx.shutdown();
    }

    @Nested
    @DisplayName("admitDevice 登記裝置")
    class Admit {

        @Test
        @DisplayName("maxDevices=1：第二台裝置登入 — warning，第一台被踢掉")
        void secondDeviceEvictsFirst() {
            fx.activeSubscription(ACCOUNT, "solo");

            DeviceAdmission first = enforcer.login(ACCOUNT, "phone");
            fx.clock.advance(Duration.ofMinutes(5));
            DeviceAdmission second = enforcer.login(ACCOUNT, "laptop");

            assertThat(first.isWarning()).isFalse();
            assertThat(second.isAdmitted()).isTrue();
            assertThat(second.isWarning()).isTrue();
            assertThat(second.getEvictedDeviceIds()).containsExactly("phone");
            assertThat(second.getDeviceCount()).isEqualTo(1);
            assertThat(enforcer.listDevices(ACCOUNT)).extracting(DeviceResponse::getDeviceId)
                    .containsExactly("laptop");
            assertThat(fx.eventsOf(EventType.DEVICE_LIMIT_WARNING)).hasSize(1);
        }

        @Test
        @DisplayName("pro 3 台：第 4 台踢掉最久沒出現的那台")
        void evictsLeastRecentlySeen() {
            fx.activeSubscription(ACCOUNT, "pro");
            enforcer.admitDevice(ACCOUNT, "d1");
            fx.clock.advance(Duration.ofMinutes(1));
            enforcer.admitDevice(ACCOUNT, "d2");
            fx.clock.advance(Duration.ofMinutes(1));
            enforcer.admitDevice(ACCOUNT, "d3");
            fx.clock.advance(Duration.ofMinutes(1));
            enforcer.admitDevice(ACCOUNT, "d1");
            fx.clock.advance(Duration.ofMinutes(1));

            DeviceAdmission admission = enforcer.admitDevice(ACCOUNT, "d4");

            assertThat(admission.isWarning()).isTrue();
            assertThat(admission.getEvictedDeviceIds()).containsExactly("d2");
            assertThat(enforcer.listDevices(ACCOUNT)).extracting(DeviceResponse::getDeviceId)
                    .containsExactlyInAnyOrder("d1", "d3", "d4");
        }

        @Test
        @DisplayName("已登記的裝置再登入 — 只刷新 lastSeenAt，不警告")
        void knownDeviceRefreshed() {
            fx.activeSubscription(ACCOUNT, "solo");
            enforcer.admitDevice(ACCOUNT, "phone");
            fx.clock.advance(Duration.ofHours(2));

            DeviceAdmission again = enforcer.admitDevice(ACCOUNT, "phone");

            assertThat(again.isWarning()).isFalse();
            assertThat(again.getEvictedDeviceIds()).isEmpty();
            assertThat(enforcer.listDevices(ACCOUNT).get(0).getLastSeenAt()).isEqualTo(fx.clock.now());
        }

        @Test
        @DisplayName("超過 30 天沒出現的裝置在下次登記時清掉，不算超限")
        void staleDevicesPruned() {
            fx.activeSubscription(ACCOUNT, "solo");
            enforcer.admitDevice(ACCOUNT, "old-phone");
            fx.clock.advance(Duration.ofDays(31));

            DeviceAdmission admission = enforcer.admitDevice(ACCOUNT, "new-phone");

            assertThat(admission.isWarning()).isFalse();
            assertThat(admission.getEvictedDeviceIds()).isEmpty();
            assertThat(enforcer.listDevices(ACCOUNT)).extracting(DeviceResponse::getDeviceId)
                    .containsExactly("new-phone");
        }

        @Test
        @DisplayName("free 方案裝置不限 — 不警告")
        void unlimitedDevices() {
            for (int i = 0; i < 5; i++) {
                fx.clock.advance(Duration.ofSeconds(1));
                assertThat(enforcer.admitDevice(ACCOUNT, "d" + i).isWarning()).isFalse();
            }

            assertThat(enforcer.listDevices(ACCOUNT)).hasSize(5);
            assertThat(fx.eventsOf(EventType.DEVICE_LIMIT_WARNING)).isEmpty();
        }
    }

    @Nested
    @DisplayName("logout 登出")
    class Logout {

        @Test
        @DisplayName("移除已登記裝置 — true")
        void removesDevice() {
            enforcer.login(ACCOUNT, "phone");

            assertThat(enforcer.logout(ACCOUNT, "phone")).isTrue();
            assertThat(enforcer.listDevices(ACCOUNT)).isEmpty();
        }

        @Test
        @DisplayName("不存在的裝置 — false")
        void unknownDevice() {
            assertThat(enforcer.logout(ACCOUNT, "ghost")).isFalse();
        }
    }
}
