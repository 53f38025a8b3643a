package com.sneaklink.shared.dto;

import lombok.Builder;
import lombok.Data;

/**
 * 通用訊息回應
 */
@Data
@Builder
public class MessageResponse {

    private String status;
    private String message;
}
