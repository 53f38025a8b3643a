package com.sneaklink.shared.exception;

import lombok.Getter;

import java.util.Map;

/**
 * 配額不足：帶上目前的上限與已使用量
 */
@Getter
public class QuotaExceededException extends EntitlementException {

    private final String quotaKind;
    private final long limit;
    private final long used;

    public QuotaExceededException(String quotaKind, long limit, long used) {
        super(ErrorCode.QUOTA_EXCEEDED,
                String.format("%s 已達上限 (limit=%d, used=%d)，請升級方案或等待下個週期", quotaKind, limit, used));
        this.quotaKind = quotaKind;
        this.limit = limit;
        this.used = used;
    }

    @Override
    public Map<String, Object> getDetails() {
        return Map.of("quotaKind", quotaKind, "limit", limit, "used", used);
    }
}
