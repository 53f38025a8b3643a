package com.sneaklink.plan.dto;

import com.sneaklink.plan.Plan;
import com.sneaklink.plan.QuotaLimits;
import lombok.Builder;
import lombok.Data;

/**
 * 方案列表中單個方案的回應 DTO
 *
 * current = true 表示帳號目前實際生效的方案。
 */
@Data
@Builder
public class PlanResponse {

    private String planId;
    private String name;

    /** 最小貨幣單位 */
    private long priceMonthly;
    private long priceAnnual;

    private QuotaLimits limits;

    private boolean current;

    public static PlanResponse of(Plan plan, boolean current) {
        return PlanResponse.builder()
                .planId(plan.id())
                .name(plan.displayName())
                .priceMonthly(plan.monthlyPrice())
                .priceAnnual(plan.annualPrice())
                .limits(plan.limits())
                .current(current)
                .build();
    }
}
