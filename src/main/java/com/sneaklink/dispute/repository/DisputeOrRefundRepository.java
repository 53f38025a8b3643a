package com.sneaklink.dispute.repository;

import com.sneaklink.dispute.entity.DisputeOrRefund;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface DisputeOrRefundRepository extends JpaRepository<DisputeOrRefund, Long> {

    List<DisputeOrRefund> findByPaymentReferenceAndKindAndResolution(
            String paymentReference, DisputeOrRefund.Kind kind, DisputeOrRefund.Resolution resolution);

    List<DisputeOrRefund> findByKindOrderByCreatedAtDesc(DisputeOrRefund.Kind kind);

    List<DisputeOrRefund> findByKindAndResolutionOrderByCreatedAtDesc(
            DisputeOrRefund.Kind kind, DisputeOrRefund.Resolution resolution);

    /**
     * 同一筆付款已完成的退款總額
     */
    @Query("SELECT COALESCE(SUM(d.amountMinorUnits), 0) FROM DisputeOrRefund d " +
            "WHERE d.paymentReference = :ref AND d.kind = :kind AND d.resolution = :resolution")
    long sumAmount(@Param("ref") String paymentReference,
                   @Param("kind") DisputeOrRefund.Kind kind,
                   @Param("resolution") DisputeOrRefund.Resolution resolution);

    default long sumResolvedRefunds(String paymentReference) {
        return sumAmount(paymentReference, DisputeOrRefund.Kind.REFUND, DisputeOrRefund.Resolution.RESOLVED);
    }
}
