package com.sneaklink.dispute.controller;

import com.sneaklink.dispute.dto.DisputeResponse;
import com.sneaklink.dispute.dto.RefundRequest;
import com.sneaklink.dispute.entity.DisputeOrRefund;
import com.sneaklink.dispute.service.DisputeRefundReconciler;
import org.junit.jupiter.api.*;
import org.springframework.http.ResponseEntity;
import org.springframework.security.authentication.UsernamePasswordAuthenticationToken;
import org.springframework.security.core.authority.SimpleGrantedAuthority;
import org.springframework.security.core.context.SecurityContextHolder;

import java.util.List;

import static org.assertj.core.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

class AdminDisputeControllerTest {

    private DisputeRefundReconciler reconciler;
    private AdminDisputeController controller;

    @BeforeEach
    void setUp() {
        reconciler = mock(DisputeRefundReconciler.class);
        controller = new AdminDisputeController(reconciler);
        SecurityContextHolder.getContext().setAuthentication(new UsernamePasswordAuthenticationToken(
                "ops-1", null, List.of(new SimpleGrantedAuthority("ROLE_ADMIN"))));
    }

    @AfterEach
    void tearDown() {
        SecurityContextHolder.clearContext();
    }

    @Test
    @DisplayName("refund — 轉給 reconciler 並回傳紀錄")
    void refund() {
        RefundRequest request = new RefundRequest();
        request.setAccountId("acc-1");
        request.setAmountMinorUnits(7900L);
        request.setNote("客訴");
        DisputeOrRefund record = DisputeOrRefund.builder()
                .id(1L).paymentReference("cs_1").accountId("acc-1")
                .kind(DisputeOrRefund.Kind.REFUND).amountMinorUnits(7900).build();
        when(reconciler.applyRefund("acc-1", "cs_1", 7900L, "客訴")).thenReturn(record);
        when(reconciler.toResponse(record)).thenReturn(DisputeResponse.builder()
                .id(1L).paymentReference("cs_1").kind(DisputeOrRefund.Kind.REFUND).amountMinorUnits(7900).build());

        ResponseEntity<DisputeResponse> response = controller.refund("cs_1", request);

        assertThat(response.getBody().getKind()).isEqualTo(DisputeOrRefund.Kind.REFUND);
        assertThat(response.getBody().getAmountMinorUnits()).isEqualTo(7900);
    }

    @Test
    @DisplayName("reject — 無 body 時 note 為 null")
    void rejectWithoutBody() {
        DisputeOrRefund record = DisputeOrRefund.builder().id(5L).build();
        when(reconciler.rejectDispute(5L, null)).thenReturn(record);
        when(reconciler.toResponse(record)).thenReturn(DisputeResponse.builder().id(5L).build());

        ResponseEntity<DisputeResponse> response = controller.reject(5L, null);

        assertThat(response.getBody().getId()).isEqualTo(5L);
    }

    @Test
    @DisplayName("list — 依 resolution 過濾")
    void listByResolution() {
        when(reconciler.listDisputes(DisputeOrRefund.Resolution.PENDING)).thenReturn(List.of());

        controller.listDisputes(DisputeOrRefund.Resolution.PENDING);

        verify(reconciler).listDisputes(eq(DisputeOrRefund.Resolution.PENDING));
    }
}
