package com.sneaklink.quota.dto;

import com.sneaklink.quota.QuotaKind;
import lombok.AllArgsConstructor;
import lombok.Data;

@Data
@AllArgsConstructor
public class ConsumeQuotaResponse {

    private QuotaKind kind;

    /** -1 = 不限 */
    private long remaining;
}
