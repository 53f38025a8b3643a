package com.sneaklink.subscription.dto;

import lombok.AllArgsConstructor;
import lombok.Data;

@Data
@AllArgsConstructor
public class AutoRenewResponse {

    private boolean autoRenew;
}
