package com.sneaklink.device.dto;

import lombok.AllArgsConstructor;
import lombok.Data;

import java.time.LocalDateTime;

@Data
@AllArgsConstructor
public class DeviceResponse {

    private String deviceId;
    private LocalDateTime firstSeenAt;
    private LocalDateTime lastSeenAt;
}
