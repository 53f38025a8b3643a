package com.sneaklink.device.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import lombok.Data;

@Data
public class LoginRequest {

    @NotBlank(message = "deviceId 不可為空")
    @Size(max = 128, message = "deviceId 過長")
    private String deviceId;
}
