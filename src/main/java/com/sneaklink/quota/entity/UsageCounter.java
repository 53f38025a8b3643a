package com.sneaklink.quota.entity;

import com.sneaklink.quota.QuotaKind;
import jakarta.persistence.*;
import lombok.*;

import java.time.LocalDateTime;

/**
 * 帳號 × 用量種類的計數器
 *
 * count 在扣減時保證不超過 limit；窗口過期時在下一次存取時才歸零（lazy rollover）。
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Entity
@Table(name = "usage_counters", uniqueConstraints = {
        @UniqueConstraint(name = "uk_counter_account_kind", columnNames = {"accountId", "kind"})
})
public class UsageCounter {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false)
    private String accountId;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    private QuotaKind kind;

    private LocalDateTime windowStart;

    /** 不含 */
    private LocalDateTime windowEnd;

    private long count;

    /** -1 = 不限 */
    @Column(name = "quota_limit")
    private long limit;
}
