package com.sneaklink.device.controller;

import com.sneaklink.device.dto.DeviceAdmission;
import com.sneaklink.device.dto.DeviceResponse;
import com.sneaklink.device.dto.LoginRequest;
import com.sneaklink.device.service.DeviceLimitEnforcer;
import com.sneaklink.shared.dto.MessageResponse;
import com.sneaklink.shared.util.SecurityUtil;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

/**
 * 連線 / 裝置 API
 *
 * - POST /api/session/login   → 登記裝置（超過上限時 warning=true）
 * - POST /api/session/logout  → 移除裝置
 * - GET  /api/session/devices → 已登記的裝置
 */
@RestController
@RequestMapping("/api/session")
@RequiredArgsConstructor
public class SessionController {

    private final DeviceLimitEnforcer deviceLimitEnforcer;

    @PostMapping("/login")
    public ResponseEntity<DeviceAdmission> login(@Valid @RequestBody LoginRequest request) {
        String accountId = SecurityUtil.getCurrentAccountId();
        return ResponseEntity.ok(deviceLimitEnforcer.login(accountId, request.getDeviceId()));
    }

    @PostMapping("/logout")
    public ResponseEntity<MessageResponse> logout(@Valid @RequestBody LoginRequest request) {
        String accountId = SecurityUtil.getCurrentAccountId();
        boolean removed = deviceLimitEnforcer.logout(accountId, request.getDeviceId());
        return ResponseEntity.ok(MessageResponse.builder()
                .status("success")
                .message(removed ? "裝置已登出" : "裝置不存在")
                .build());
    }

    @GetMapping("/devices")
    public ResponseEntity<List<DeviceResponse>> devices() {
        String accountId = SecurityUtil.getCurrentAccountId();
        return ResponseEntity.ok(deviceLimitEnforcer.listDevices(accountId));
    }
}
