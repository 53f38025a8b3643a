package com.sneaklink.shared.repository;

import com.sneaklink.shared.entity.AuditLog;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface AuditLogRepository extends JpaRepository<AuditLog, Long> {

    List<AuditLog> findByAccountIdOrderByTimestampDesc(String accountId);

    List<AuditLog> findByReferenceOrderByTimestampDesc(String reference);
}
