package com.sneaklink.shared.controller;

import com.sneaklink.payment.service.PaymentVerificationCoordinator;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.Map;

/**
 * 健康檢查端點
 *
 * 無認證、無副作用。服務本身永遠回 200 UP；金流閘道狀態另外標示（5 秒期限），
 * 閘道掛掉時仍可以查額度、登入裝置。
 */
@RestController
@RequiredArgsConstructor
public class HealthController {

    private final PaymentVerificationCoordinator coordinator;

    @GetMapping("/api/health")
    public ResponseEntity<Map<String, String>> health() {
        return ResponseEntity.ok(Map.of(
                "status", "UP",
                "gateway", coordinator.gatewayHealthy() ? "UP" : "DOWN"));
    }
}
