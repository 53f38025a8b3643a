package com.sneaklink.subscription.dto;

import jakarta.validation.constraints.NotBlank;
import lombok.Data;

@Data
public class VerifyPaymentRequest {

    @NotBlank(message = "reference 不可為空")
    private String reference;
}
