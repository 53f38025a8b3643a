package com.sneaklink.subscription.repository;

import com.sneaklink.subscription.entity.Subscription;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.Optional;

@Repository
public interface SubscriptionRepository extends JpaRepository<Subscription, Long> {

    Optional<Subscription> findByAccountId(String accountId);

    Optional<Subscription> findByGatewaySubscriptionId(String gatewaySubscriptionId);
}
