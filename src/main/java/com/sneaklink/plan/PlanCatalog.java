package com.sneaklink.plan;

import com.sneaklink.shared.exception.EntitlementException;
import com.sneaklink.shared.exception.ErrorCode;
import org.springframework.stereotype.Component;

import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * 方案目錄
 *
 * 唯一的方案來源；其他模組只透過 planId 查詢，不自行寫死限制。
 */
@Component
public class PlanCatalog {

    private static final long U = QuotaLimits.UNLIMITED;

    private final Map<String, Plan> plans;
    private final List<Plan> ordered;

    public PlanCatalog() {
        this(defaultPlans());
    }

    public PlanCatalog(List<Plan> plans) {
        Map<String, Plan> byId = new LinkedHashMap<>();
        plans.stream()
                .sorted(Comparator.comparingInt(Plan::tier))
                .forEach(p -> byId.put(p.id(), p));
        if (!byId.containsKey(Plan.FREE)) {
            throw new IllegalArgumentException("方案目錄必須包含 free 方案");
        }
        this.plans = Map.copyOf(byId);
        this.ordered = List.copyOf(byId.values());
    }

    static List<Plan> defaultPlans() {
        return List.of(
                new Plan("free", "Free", 0, 0,
                        new QuotaLimits(0, 0, 0, U, 0), 0),
                new Plan("starter", "Starter", 4900, 49000,
                        new QuotaLimits(1000, 2, 2, 2, 200), 1),
                new Plan("pro", "Pro", 7900, 79000,
                        new QuotaLimits(10000, 10, 5, 3, 500), 2),
                new Plan("enterprise", "Enterprise", 19900, 199000,
                        new QuotaLimits(U, U, U, 10, U), 3)
        );
    }

    public Optional<Plan> find(String planId) {
        if (planId == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(plans.get(planId));
    }

    /**
     * @throws EntitlementException INVALID_PLAN
     */
    public Plan require(String planId) {
        return find(planId).orElseThrow(() ->
                new EntitlementException(ErrorCode.INVALID_PLAN, "未知的方案: " + planId));
    }

    public Plan free() {
        return plans.get(Plan.FREE);
    }

    /** 依 tier 排序 */
    public List<Plan> all() {
        return ordered;
    }

    public long priceFor(Plan plan, BillingCycle cycle) {
        return plan.priceFor(cycle);
    }
}
