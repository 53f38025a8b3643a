package com.sneaklink.quota.repository;

import com.sneaklink.quota.QuotaKind;
import com.sneaklink.quota.entity.UsageCounter;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.Optional;

@Repository
public interface UsageCounterRepository extends JpaRepository<UsageCounter, Long> {

    Optional<UsageCounter> findByAccountIdAndKind(String accountId, QuotaKind kind);
}
