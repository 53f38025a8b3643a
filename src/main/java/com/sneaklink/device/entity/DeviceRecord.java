package com.sneaklink.device.entity;

import jakarta.persistence.*;
import lombok.*;

import java.time.LocalDateTime;

/**
 * 帳號登入過的裝置
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Entity
@Table(name = "device_records", uniqueConstraints = {
        @UniqueConstraint(name = "uk_device_account_device", columnNames = {"accountId", "deviceId"})
})
public class DeviceRecord {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false)
    private String accountId;

    @Column(nullable = false)
    private String deviceId;

    private LocalDateTime firstSeenAt;

    private LocalDateTime lastSeenAt;
}
