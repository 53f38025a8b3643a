package com.sneaklink.subscription.repository;

import com.sneaklink.subscription.entity.PaymentAttempt;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.Collection;
import java.util.List;
import java.util.Optional;

@Repository
public interface PaymentAttemptRepository extends JpaRepository<PaymentAttempt, Long> {

    Optional<PaymentAttempt> findByReference(String reference);

    Optional<PaymentAttempt> findByGatewayPaymentId(String gatewayPaymentId);

    List<PaymentAttempt> findByAccountIdAndStatusIn(String accountId, Collection<PaymentAttempt.Status> statuses);
}
