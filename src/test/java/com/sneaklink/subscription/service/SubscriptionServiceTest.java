package com.sneaklink.subscription.service;

import com.sneaklink.payment.gateway.GatewayException;
import com.sneaklink.payment.gateway.GatewayTransaction;
import com.sneaklink.payment.service.VerificationResult;
import com.sneaklink.plan.BillingCycle;
import com.sneaklink.shared.exception.EntitlementException;
import com.sneaklink.shared.exception.ErrorCode;
import com.sneaklink.subscription.dto.PlanSelection;
import com.sneaklink.subscription.dto.SubscriptionStatusResponse;
import com.sneaklink.subscription.entity.PaymentAttempt;
import com.sneaklink.subscription.entity.Subscription;
import com.sneaklink.support.EntitlementFixture;
import org.junit.jupiter.api.*;
import org.mockito.InOrder;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.*;

import static org.assertj.core.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

/**
 * SubscriptionService 單元測試
 *
 * 覆蓋：選擇方案、取代舊付款、自動續費切換（含閘道同步）、取消、到期 / 取消的 lazy 判斷、續費、撤銷、
 * 閘道訂閱的接手與釋放、同帳號並發選方案 / 驗證
 */
class SubscriptionServiceTest {

    private static final String ACCOUNT = "acc-1";

    private EntitlementFixture fx;
    private SubscriptionService service;

    @BeforeEach
    void setUp() {
        fx = new EntitlementFixture();
        service = fx.subscriptionService;
        fx.stubCharges();
    }

    @AfterEach
    void tearDown() {
        fx.shutdown();
    }

    private Subscription stored() {
        return fx.store.getSubscription(ACCOUNT).orElseThrow();
    }

    // ==================== 選擇方案 ====================

    @Nested
    @DisplayName("selectPlan 選擇方案")
    class SelectPlan {

        @Test
        @DisplayName("free → pro 月繳：建立 7900 usd 付款，訂閱進入 PENDING")
        void createsPendingSubscription() {
            PlanSelection selection = service.selectPlan(ACCOUNT, "pro", BillingCycle.MONTHLY);

            assertThat(selection.getReference()).isEqualTo("cs_1");
            assertThat(selection.getAmountMinorUnits()).isEqualTo(7900);
            assertThat(selection.getCurrency()).isEqualTo("usd");
            assertThat(selection.getRedirectUrl()).contains("cs_1");

            Subscription sub = stored();
            assertThat(sub.getStatus()).isEqualTo(Subscription.Status.PENDING);
            assertThat(sub.getPlanId()).isEqualTo("pro");
            assertThat(sub.getPendingPaymentReference()).isEqualTo("cs_1");
            assertThat(sub.getNextBillingDate()).isEqualTo(EntitlementFixture.START.plusMonths(1));

            PaymentAttempt attempt = fx.store.findAttempt("cs_1").orElseThrow();
            assertThat(attempt.getStatus()).isEqualTo(PaymentAttempt.Status.INITIALIZED);
            assertThat(attempt.getAmountMinorUnits()).isEqualTo(7900);
        }

        @Test
        @DisplayName("未指定週期 — 預設月繳")
        void defaultsToMonthly() {
            PlanSelection selection = service.selectPlan(ACCOUNT, "starter", null);

            assertThat(selection.getBillingCycle()).isEqualTo(BillingCycle.MONTHLY);
            assertThat(selection.getAmountMinorUnits()).isEqualTo(4900);
        }

        @Test
        @DisplayName("free 方案或未知方案 — INVALID_PLAN")
        void invalidPlans() {
            assertThatThrownBy(() -> service.selectPlan(ACCOUNT, "free", BillingCycle.MONTHLY))
                    .isInstanceOf(EntitlementException.class)
                    .hasFieldOrPropertyWithValue("errorCode", ErrorCode.INVALID_PLAN);
            assertThatThrownBy(() -> service.selectPlan(ACCOUNT, "platinum", BillingCycle.MONTHLY))
                    .isInstanceOf(EntitlementException.class)
                    .hasFieldOrPropertyWithValue("errorCode", ErrorCode.INVALID_PLAN);
        }

        @Test
        @DisplayName("第二次選擇取代第一次：舊付款 FAILED(SUPERSEDED)，只剩一筆進行中")
        void supersedesPreviousAttempt() {
            service.selectPlan(ACCOUNT, "pro", BillingCycle.MONTHLY);
            service.selectPlan(ACCOUNT, "starter", BillingCycle.MONTHLY);

            PaymentAttempt first = fx.store.findAttempt("cs_1").orElseThrow();
            assertThat(first.getStatus()).isEqualTo(PaymentAttempt.Status.FAILED);
            assertThat(first.getFailureCode()).isEqualTo("SUPERSEDED");
            assertThat(fx.store.findInFlightAttempts(ACCOUNT))
                    .extracting(PaymentAttempt::getReference)
                    .containsExactly("cs_2");
            assertThat(stored().getPendingPaymentReference()).isEqualTo("cs_2");
            assertThat(stored().getPlanId()).isEqualTo("starter");
        }

        @Test
        @DisplayName("已是 ACTIVE 同方案同週期 — ALREADY_ON_PLAN")
        void alreadyOnPlan() {
            fx.purchase(ACCOUNT, "pro", BillingCycle.MONTHLY, "pi_1");

            assertThatThrownBy(() -> service.selectPlan(ACCOUNT, "pro", BillingCycle.MONTHLY))
                    .isInstanceOf(EntitlementException.class)
                    .hasFieldOrPropertyWithValue("errorCode", ErrorCode.ALREADY_ON_PLAN);
        }

        @Test
        @DisplayName("ACTIVE 時改選年繳：原權益維持 ACTIVE，直到新付款確認")
        void upgradeKeepsCurrentEntitlement() {
            fx.purchase(ACCOUNT, "pro", BillingCycle.MONTHLY, "pi_1");

            service.selectPlan(ACCOUNT, "pro", BillingCycle.ANNUAL);

            Subscription sub = stored();
            assertThat(sub.getStatus()).isEqualTo(Subscription.Status.ACTIVE);
            assertThat(sub.getBillingCycle()).isEqualTo(BillingCycle.MONTHLY);
            assertThat(sub.getPendingPaymentReference()).isEqualTo("cs_2");
        }

        @Test
        @DisplayName("閘道暫時性錯誤 — GATEWAY_TIMEOUT，不留下任何記錄")
        void gatewayTimeout() throws Exception {
            when(fx.gateway.initializeCharge(any())).thenThrow(new GatewayException("connect timed out", true));

            assertThatThrownBy(() -> service.selectPlan(ACCOUNT, "pro", BillingCycle.MONTHLY))
                    .isInstanceOf(EntitlementException.class)
                    .hasFieldOrPropertyWithValue("errorCode", ErrorCode.GATEWAY_TIMEOUT);
            assertThat(fx.store.getSubscription(ACCOUNT)).isEmpty();
        }

        @Test
        @DisplayName("閘道明確拒絕 — GATEWAY_REJECTED")
        void gatewayRejected() throws Exception {
            when(fx.gateway.initializeCharge(any())).thenThrow(new GatewayException("invalid currency", false));

            assertThatThrownBy(() -> service.selectPlan(ACCOUNT, "pro", BillingCycle.MONTHLY))
                    .isInstanceOf(EntitlementException.class)
                    .hasFieldOrPropertyWithValue("errorCode", ErrorCode.GATEWAY_REJECTED);
        }
    }

    // ==================== 自動續費 ====================

    @Nested
    @DisplayName("toggleAutoRenew 自動續費")
    class ToggleAutoRenew {

        @Test
        @DisplayName("啟用後預設開啟，切換一次變 false")
        void togglesOff() {
            fx.purchase(ACCOUNT, "pro", BillingCycle.MONTHLY, "pi_1");

            assertThat(service.toggleAutoRenew(ACCOUNT)).isFalse();
            assertThat(stored().isAutoRenew()).isFalse();
            assertThat(stored().getStatus()).isEqualTo(Subscription.Status.ACTIVE);
        }

        @Test
        @DisplayName("EXPIRING 時重新開啟 — 回到 ACTIVE")
        void reEnableFromExpiring() {
            fx.purchase(ACCOUNT, "pro", BillingCycle.MONTHLY, "pi_1");
            service.toggleAutoRenew(ACCOUNT);
            fx.clock.set(LocalDateTime.of(2026, 2, 5, 0, 0));
            assertThat(service.getSubscription(ACCOUNT).getStatus()).isEqualTo("EXPIRING");

            assertThat(service.toggleAutoRenew(ACCOUNT)).isTrue();

            assertThat(stored().getStatus()).isEqualTo(Subscription.Status.ACTIVE);
        }

        @Test
        @DisplayName("沒有訂閱記錄 — NO_ACTIVE_SUBSCRIPTION")
        void noSubscription() {
            assertThatThrownBy(() -> service.toggleAutoRenew(ACCOUNT))
                    .isInstanceOf(EntitlementException.class)
                    .hasFieldOrPropertyWithValue("errorCode", ErrorCode.NO_ACTIVE_SUBSCRIPTION);
        }

        @Test
        @DisplayName("有閘道訂閱 — 關閉時同步 cancel_at_period_end")
        void syncsGateway() throws Exception {
            String ref = fx.purchase(ACCOUNT, "pro", BillingCycle.MONTHLY, "pi_1");

            service.toggleAutoRenew(ACCOUNT);
            service.toggleAutoRenew(ACCOUNT);

            InOrder order = inOrder(fx.gateway);
            order.verify(fx.gateway).setAutoRenew(EntitlementFixture.gatewaySubscriptionOf(ref), false);
            order.verify(fx.gateway).setAutoRenew(EntitlementFixture.gatewaySubscriptionOf(ref), true);
        }

        @Test
        @DisplayName("閘道同步失敗 — GATEWAY_TIMEOUT，本地 autoRenew 不變")
        void gatewayFailureKeepsLocalState() throws Exception {
            fx.purchase(ACCOUNT, "pro", BillingCycle.MONTHLY, "pi_1");
            doThrow(new GatewayException("timeout", true)).when(fx.gateway).setAutoRenew(anyString(), anyBoolean());

            assertThatThrownBy(() -> service.toggleAutoRenew(ACCOUNT))
                    .isInstanceOf(EntitlementException.class)
                    .hasFieldOrPropertyWithValue("errorCode", ErrorCode.GATEWAY_TIMEOUT);

            assertThat(stored().isAutoRenew()).isTrue();
        }

        @Test
        @DisplayName("PENDING 時不切換，原值回傳")
        void pendingUnchanged() {
            service.selectPlan(ACCOUNT, "pro", BillingCycle.MONTHLY);

            assertThat(service.toggleAutoRenew(ACCOUNT)).isFalse();
            assertThat(stored().getStatus()).isEqualTo(Subscription.Status.PENDING);
        }
    }

    // ==================== 到期 / 取消 ====================

    @Nested
    @DisplayName("生命週期（讀取時判斷）")
    class Lifecycle {

        @Test
        @DisplayName("autoRenew=false：計費日前 7 天 EXPIRING，過了計費日 CANCELLED")
        void expiringThenCancelled() {
            fx.purchase(ACCOUNT, "pro", BillingCycle.MONTHLY, "pi_1");
            service.toggleAutoRenew(ACCOUNT);

            fx.clock.set(LocalDateTime.of(2026, 2, 2, 23, 0));
            assertThat(service.getSubscription(ACCOUNT).getStatus()).isEqualTo("ACTIVE");

            fx.clock.set(LocalDateTime.of(2026, 2, 3, 0, 0));
            SubscriptionStatusResponse expiring = service.getSubscription(ACCOUNT);
            assertThat(expiring.getStatus()).isEqualTo("EXPIRING");
            assertThat(expiring.isActive()).isTrue();
            assertThat(service.effectivePlan(ACCOUNT).id()).isEqualTo("pro");

            fx.clock.set(LocalDateTime.of(2026, 2, 10, 0, 0));
            SubscriptionStatusResponse cancelled = service.getSubscription(ACCOUNT);
            assertThat(cancelled.getStatus()).isEqualTo("CANCELLED");
            assertThat(cancelled.getNextBillingDate()).isNull();
            assertThat(cancelled.getEffectivePlanId()).isEqualTo("free");
            assertThat(service.effectivePlan(ACCOUNT).id()).isEqualTo("free");
        }

        @Test
        @DisplayName("autoRenew=true 但沒收到續費：寬限 3 天後 CANCELLED")
        void graceThenCancelled() {
            fx.purchase(ACCOUNT, "pro", BillingCycle.MONTHLY, "pi_1");

            fx.clock.set(LocalDateTime.of(2026, 2, 12, 23, 59));
            assertThat(service.getSubscription(ACCOUNT).getStatus()).isEqualTo("ACTIVE");

            fx.clock.set(LocalDateTime.of(2026, 2, 13, 0, 0));
            assertThat(service.getSubscription(ACCOUNT).getStatus()).isEqualTo("CANCELLED");
            assertThat(stored().isAutoRenew()).isFalse();
        }

        @Test
        @DisplayName("沒有訂閱記錄 — 回傳 free / NONE")
        void noSubscriptionIsFree() {
            SubscriptionStatusResponse status = service.getSubscription(ACCOUNT);

            assertThat(status.getStatus()).isEqualTo("NONE");
            assertThat(status.getPlanId()).isEqualTo("free");
            assertThat(status.isActive()).isFalse();
        }

        @Test
        @DisplayName("applyLifecycle 沒有計費日時不變更")
        void noBillingDateNoChange() {
            Subscription sub = Subscription.builder()
                    .accountId(ACCOUNT).planId("free").status(Subscription.Status.NONE).build();

            assertThat(service.applyLifecycle(sub, LocalDateTime.of(2030, 1, 1, 0, 0))).isFalse();
        }
    }

    // ==================== 續費 / 撤銷 ====================

    @Nested
    @DisplayName("recordRenewal 續費")
    class Renewal {

        @Test
        @DisplayName("續費成功：計費日往後一個月，留下 SUCCEEDED 付款")
        void advancesBillingDate() {
            fx.purchase(ACCOUNT, "pro", BillingCycle.MONTHLY, "pi_1");
            fx.clock.set(LocalDateTime.of(2026, 2, 10, 1, 0));

            boolean applied = service.recordRenewal(ACCOUNT, "in_1", 7900, "usd", "pi_2", null);

            assertThat(applied).isTrue();
            assertThat(stored().getNextBillingDate()).isEqualTo(LocalDateTime.of(2026, 3, 10, 0, 0));
            assertThat(stored().getLastPaymentReference()).isEqualTo("in_1");
            assertThat(fx.store.findAttempt("in_1").orElseThrow().getStatus())
                    .isEqualTo(PaymentAttempt.Status.SUCCEEDED);
        }

        @Test
        @DisplayName("同一張 invoice 重複送達 — 忽略，不重複推進")
        void duplicateIgnored() {
            fx.purchase(ACCOUNT, "pro", BillingCycle.MONTHLY, "pi_1");
            service.recordRenewal(ACCOUNT, "in_1", 7900, "usd", "pi_2", null);

            assertThat(service.recordRenewal(ACCOUNT, "in_1", 7900, "usd", "pi_2", null)).isFalse();
            assertThat(stored().getNextBillingDate()).isEqualTo(LocalDateTime.of(2026, 3, 10, 0, 0));
        }

        @Test
        @DisplayName("金額不符 — AMOUNT_MISMATCH，計費日不變")
        void amountMismatch() {
            fx.purchase(ACCOUNT, "pro", BillingCycle.MONTHLY, "pi_1");

            assertThatThrownBy(() -> service.recordRenewal(ACCOUNT, "in_1", 5000, "usd", "pi_2", null))
                    .isInstanceOf(EntitlementException.class)
                    .hasFieldOrPropertyWithValue("errorCode", ErrorCode.AMOUNT_MISMATCH);
            assertThat(stored().getNextBillingDate()).isEqualTo(LocalDateTime.of(2026, 2, 10, 0, 0));
        }

        @Test
        @DisplayName("帳單來自已被取代的閘道訂閱 — SUPERSEDED，計費日不變")
        void foreignGatewaySubscriptionRejected() {
            fx.purchase(ACCOUNT, "pro", BillingCycle.MONTHLY, "pi_1");

            assertThatThrownBy(() -> service.recordRenewal(ACCOUNT, "in_1", 7900, "usd", "pi_2", "sub_stray"))
                    .isInstanceOf(EntitlementException.class)
                    .hasFieldOrPropertyWithValue("errorCode", ErrorCode.SUPERSEDED);
            assertThat(stored().getNextBillingDate()).isEqualTo(LocalDateTime.of(2026, 2, 10, 0, 0));
            assertThat(fx.store.findAttempt("in_1")).isEmpty();
        }

        @Test
        @DisplayName("EXPIRING 收到續費 — 回到 ACTIVE")
        void renewalRestoresActive() {
            fx.purchase(ACCOUNT, "pro", BillingCycle.MONTHLY, "pi_1");
            service.toggleAutoRenew(ACCOUNT);
            fx.clock.set(LocalDateTime.of(2026, 2, 5, 0, 0));

            service.recordRenewal(ACCOUNT, "in_1", 7900, "usd", "pi_2", null);

            assertThat(stored().getStatus()).isEqualTo(Subscription.Status.ACTIVE);
        }
    }

    // ==================== 取消 ====================

    @Nested
    @DisplayName("cancelSubscription 取消")
    class Cancel {

        @Test
        @DisplayName("ACTIVE → CANCELLED：閘道立即停止扣款，權益回到 free")
        void cancelsImmediately() throws Exception {
            String ref = fx.purchase(ACCOUNT, "pro", BillingCycle.MONTHLY, "pi_1");

            Subscription cancelled = service.cancelSubscription(ACCOUNT);

            verify(fx.gateway).cancelSubscription(EntitlementFixture.gatewaySubscriptionOf(ref));
            assertThat(cancelled.getStatus()).isEqualTo(Subscription.Status.CANCELLED);
            assertThat(stored().getNextBillingDate()).isNull();
            assertThat(stored().isAutoRenew()).isFalse();
            assertThat(stored().getGatewaySubscriptionId()).isNull();
            assertThat(service.effectivePlan(ACCOUNT).isFree()).isTrue();
        }

        @Test
        @DisplayName("EXPIRING 也可以取消")
        void cancelsExpiring() {
            fx.purchase(ACCOUNT, "pro", BillingCycle.MONTHLY, "pi_1");
            service.toggleAutoRenew(ACCOUNT);
            fx.clock.set(LocalDateTime.of(2026, 2, 5, 0, 0));

            assertThat(service.cancelSubscription(ACCOUNT).getStatus()).isEqualTo(Subscription.Status.CANCELLED);
        }

        @Test
        @DisplayName("PENDING / 沒有訂閱 — NO_ACTIVE_SUBSCRIPTION")
        void nothingToCancel() {
            assertThatThrownBy(() -> service.cancelSubscription(ACCOUNT))
                    .hasFieldOrPropertyWithValue("errorCode", ErrorCode.NO_ACTIVE_SUBSCRIPTION);

            service.selectPlan(ACCOUNT, "pro", BillingCycle.MONTHLY);

            assertThatThrownBy(() -> service.cancelSubscription(ACCOUNT))
                    .hasFieldOrPropertyWithValue("errorCode", ErrorCode.NO_ACTIVE_SUBSCRIPTION);
            assertThat(stored().getStatus()).isEqualTo(Subscription.Status.PENDING);
        }

        @Test
        @DisplayName("閘道取消失敗 — GATEWAY_REJECTED，訂閱維持 ACTIVE")
        void gatewayFailureKeepsActive() throws Exception {
            fx.purchase(ACCOUNT, "pro", BillingCycle.MONTHLY, "pi_1");
            doThrow(new GatewayException("No such subscription", false)).when(fx.gateway).cancelSubscription(anyString());

            assertThatThrownBy(() -> service.cancelSubscription(ACCOUNT))
                    .hasFieldOrPropertyWithValue("errorCode", ErrorCode.GATEWAY_REJECTED);
            assertThat(stored().getStatus()).isEqualTo(Subscription.Status.ACTIVE);
            assertThat(stored().getGatewaySubscriptionId()).isNotNull();
        }
    }

    // ==================== 閘道訂閱 ====================

    @Nested
    @DisplayName("閘道定期扣款訂閱")
    class GatewaySubscription {

        @Test
        @DisplayName("啟用時記下閘道訂閱；改年繳啟用後取消舊的月繳訂閱")
        void replacesPreviousGatewaySubscription() throws Exception {
            String monthly = fx.purchase(ACCOUNT, "pro", BillingCycle.MONTHLY, "pi_1");
            assertThat(stored().getGatewaySubscriptionId()).isEqualTo(EntitlementFixture.gatewaySubscriptionOf(monthly));

            String annual = fx.purchase(ACCOUNT, "pro", BillingCycle.ANNUAL, "pi_2");

            assertThat(stored().getGatewaySubscriptionId()).isEqualTo(EntitlementFixture.gatewaySubscriptionOf(annual));
            verify(fx.gateway).cancelSubscription(EntitlementFixture.gatewaySubscriptionOf(monthly));
            verify(fx.gateway, never()).cancelSubscription(EntitlementFixture.gatewaySubscriptionOf(annual));
        }

        @Test
        @DisplayName("閘道端訂閱結束 — ACTIVE → CANCELLED，回傳帳號")
        void gatewayEndCancels() {
            String ref = fx.purchase(ACCOUNT, "pro", BillingCycle.MONTHLY, "pi_1");

            Optional<String> changed = service.endGatewaySubscription(EntitlementFixture.gatewaySubscriptionOf(ref));

            assertThat(changed).contains(ACCOUNT);
            assertThat(stored().getStatus()).isEqualTo(Subscription.Status.CANCELLED);
            assertThat(stored().getGatewaySubscriptionId()).isNull();
        }

        @Test
        @DisplayName("已被取代的閘道訂閱結束 — 不動目前訂閱")
        void staleGatewayEndIgnored() {
            fx.purchase(ACCOUNT, "pro", BillingCycle.MONTHLY, "pi_1");

            assertThat(service.endGatewaySubscription("sub_unknown")).isEmpty();
            assertThat(stored().getStatus()).isEqualTo(Subscription.Status.ACTIVE);
        }

        @Test
        @DisplayName("revoke 退款撤銷時一併取消閘道訂閱")
        void revokeReleasesGatewaySubscription() throws Exception {
            String ref = fx.purchase(ACCOUNT, "pro", BillingCycle.MONTHLY, "pi_1");

            service.revoke(ACCOUNT, ref);

            verify(fx.gateway).cancelSubscription(EntitlementFixture.gatewaySubscriptionOf(ref));
            assertThat(stored().getGatewaySubscriptionId()).isNull();
        }

        @Test
        @DisplayName("仍在使用中的閘道訂閱不會被釋放")
        void currentSubscriptionNotReleased() throws Exception {
            String ref = fx.purchase(ACCOUNT, "pro", BillingCycle.MONTHLY, "pi_1");

            service.releaseGatewaySubscription(ACCOUNT, EntitlementFixture.gatewaySubscriptionOf(ref));

            verify(fx.gateway, never()).cancelSubscription(anyString());
        }

        @Test
        @DisplayName("釋放失敗只記錄，不外拋")
        void releaseFailureLogged() throws Exception {
            doThrow(new GatewayException("down", true)).when(fx.gateway).cancelSubscription("sub_old");

            assertThatCode(() -> service.releaseGatewaySubscription(ACCOUNT, "sub_old")).doesNotThrowAnyException();
            verify(fx.auditService).failure(eq(ACCOUNT), eq("GATEWAY_SUBSCRIPTION_RELEASED"), eq("sub_old"), anyString());
        }
    }

    // ==================== 並發 ====================

    @Nested
    @DisplayName("同帳號並發")
    class Concurrency {

        @Test
        @DisplayName("8 條線程同時選方案 — 只剩一筆 INITIALIZED，且就是 pendingPaymentReference")
        void concurrentSelectLeavesOneInFlight() throws Exception {
            int threads = 8;
            ExecutorService pool = Executors.newFixedThreadPool(threads);
            CountDownLatch start = new CountDownLatch(1);
            List<Future<PlanSelection>> futures = new ArrayList<>();
            try {
                for (int i = 0; i < threads; i++) {
                    BillingCycle cycle = i % 2 == 0 ? BillingCycle.MONTHLY : BillingCycle.ANNUAL;
                    futures.add(pool.submit(() -> {
                        start.await();
                        return service.selectPlan(ACCOUNT, "pro", cycle);
                    }));
                }
                start.countDown();
                List<String> references = new ArrayList<>();
                for (Future<PlanSelection> f : futures) {
                    references.add(f.get(5, TimeUnit.SECONDS).getReference());
                }

                List<PaymentAttempt> inFlight = fx.store.findInFlightAttempts(ACCOUNT);
                assertThat(inFlight).hasSize(1);
                String survivor = inFlight.get(0).getReference();
                assertThat(stored().getPendingPaymentReference()).isEqualTo(survivor);
                assertThat(stored().getStatus()).isEqualTo(Subscription.Status.PENDING);

                assertThat(references).doesNotHaveDuplicates().hasSize(threads).contains(survivor);
                references.stream()
                        .filter(ref -> !ref.equals(survivor))
                        .map(ref -> fx.store.findAttempt(ref).orElseThrow())
                        .forEach(a -> {
                            assertThat(a.getStatus()).isEqualTo(PaymentAttempt.Status.FAILED);
                            assertThat(a.getFailureCode()).isEqualTo(ErrorCode.SUPERSEDED.name());
                        });
            } finally {
                pool.shutdownNow();
            }
        }

        @Test
        @DisplayName("驗證卡在閘道時改選方案 — 不被擋住；已付款的舊付款 SUPERSEDED，不啟用、停掉其閘道訂閱")
        void selectDuringInFlightVerification() throws Exception {
            String first = service.selectPlan(ACCOUNT, "pro", BillingCycle.MONTHLY).getReference();
            CountDownLatch lookupEntered = new CountDownLatch(1);
            CountDownLatch releaseLookup = new CountDownLatch(1);
            when(fx.gateway.lookupTransaction(first)).thenAnswer(inv -> {
                lookupEntered.countDown();
                releaseLookup.await(5, TimeUnit.SECONDS);
                return new GatewayTransaction(first,
                        GatewayTransaction.Status.PAID, 7900, "usd", "pi_1",
                        EntitlementFixture.gatewaySubscriptionOf(first));
            });

            ExecutorService pool = Executors.newSingleThreadExecutor();
            try {
                Future<VerificationResult> verifying =
                        pool.submit(() -> fx.coordinator.verify(first));
                assertThat(lookupEntered.await(2, TimeUnit.SECONDS)).isTrue();

                String second = CompletableFuture
                        .supplyAsync(() -> service.selectPlan(ACCOUNT, "starter", BillingCycle.MONTHLY).getReference(),
                                fx.executor)
                        .get(1, TimeUnit.SECONDS);
                releaseLookup.countDown();
                VerificationResult result = verifying.get(5, TimeUnit.SECONDS);

                assertThat(result.status()).isEqualTo(PaymentAttempt.Status.FAILED);
                assertThat(result.errorCode()).isEqualTo(ErrorCode.SUPERSEDED);
                PaymentAttempt superseded = fx.store.findAttempt(first).orElseThrow();
                assertThat(superseded.getFailureCode()).isEqualTo(ErrorCode.SUPERSEDED.name());
                assertThat(superseded.getGatewayPaymentId()).isEqualTo("pi_1");

                assertThat(stored().getStatus()).isEqualTo(Subscription.Status.PENDING);
                assertThat(stored().getPlanId()).isEqualTo("starter");
                assertThat(stored().getPendingPaymentReference()).isEqualTo(second);
                verify(fx.gateway).cancelSubscription(EntitlementFixture.gatewaySubscriptionOf(first));
            } finally {
                releaseLookup.countDown();
                pool.shutdownNow();
            }
        }
    }

    @Test
    @DisplayName("revoke — ACTIVE → REFUNDED，計費日清空")
    void revokeRefunds() {
        fx.purchase(ACCOUNT, "pro", BillingCycle.MONTHLY, "pi_1");

        service.revoke(ACCOUNT, "cs_1");

        Subscription sub = stored();
        assertThat(sub.getStatus()).isEqualTo(Subscription.Status.REFUNDED);
        assertThat(sub.getNextBillingDate()).isNull();
        assertThat(sub.isAutoRenew()).isFalse();
        assertThat(service.effectivePlan(ACCOUNT).isFree()).isTrue();
    }
}
