package com.flagship.telehealth_booking.payment;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Repository
public interface PaymentRepository extends JpaRepository<PaymentEntity, UUID> {

    List<PaymentEntity> findByConsultationIdAndStatusIn(UUID consultationId, Collection<PaymentStatus> statuses);

    Optional<PaymentEntity> findByProviderCheckoutId(String providerCheckoutId);

    boolean existsByConsultationIdAndStatus(UUID consultationId, PaymentStatus status);

    /**
     * Records a terminal outcome only while the row is still PENDING.
     * Returns 0 when another confirmation got there first.
     */
    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("""
        UPDATE PaymentEntity p
           SET p.status = :status,
               p.providerPaymentId = :providerPaymentId,
               p.paidAt = :paidAt,
               p.updatedAt = :updatedAt
         WHERE p.id = :id
           AND p.status = com.flagship.telehealth_booking.payment.PaymentStatus.PENDING
        """)
    int completeIfPending(
        @Param("id") UUID id,
        @Param("status") PaymentStatus status,
        @Param("providerPaymentId") String providerPaymentId,
        @Param("paidAt") Instant paidAt,
        @Param("updatedAt") Instant updatedAt);
}
