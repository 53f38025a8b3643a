package com.sneaklink.device.repository;

import com.sneaklink.device.entity.DeviceRecord;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;

@Repository
public interface DeviceRecordRepository extends JpaRepository<DeviceRecord, Long> {

    List<DeviceRecord> findByAccountIdOrderByLastSeenAtAsc(String accountId);

    @Transactional
    long deleteByAccountIdAndDeviceId(String accountId, String deviceId);
}
