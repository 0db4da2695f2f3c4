package com.flagship.telehealth_booking.payment;

import com.flagship.telehealth_booking.common.exception.NotFoundException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.EnumSet;
import java.util.Optional;
import java.util.UUID;

/**
 * Bridges the Payment domain object and its JPA entity.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class PaymentPersistenceService {

    private final PaymentRepository paymentRepository;

    /**
     * Inserts and flushes, so a duplicate checkout id or idempotency key fails here.
     */
    @Transactional
    public Payment insert(Payment payment) {
        PaymentEntity saved = paymentRepository.saveAndFlush(PaymentEntity.fromDomain(payment));
        log.debug("Saved payment {} for consultation {}", saved.getId(), saved.getConsultationId());
        return saved.toDomain();
    }

    @Transactional(readOnly = true)
    public Payment getById(UUID paymentId) {
        return paymentRepository.findById(paymentId)
            .map(PaymentEntity::toDomain)
            .orElseThrow(() -> new NotFoundException("Payment", paymentId));
    }

    /**
     * A PENDING or PAID payment for the consultation, if any.
     */
    @Transactional(readOnly = true)
    public Optional<Payment> findActive(UUID consultationId) {
        return paymentRepository.findByConsultationIdAndStatusIn(
                consultationId, EnumSet.of(PaymentStatus.PENDING, PaymentStatus.PAID))
            .stream()
            .map(PaymentEntity::toDomain)
            .findFirst();
    }

    @Transactional(readOnly = true)
    public Optional<Payment> findByCheckoutId(String providerCheckoutId) {
        return paymentRepository.findByProviderCheckoutId(providerCheckoutId)
            .map(PaymentEntity::toDomain);
    }

    @Transactional(readOnly = true)
    public boolean isPaid(UUID consultationId) {
        return paymentRepository.existsByConsultationIdAndStatus(consultationId, PaymentStatus.PAID);
    }

    /**
     * Moves a PENDING payment to {@code status}.
     *
     * @return false if the payment already left PENDING
     */
    @Transactional
    public boolean complete(Payment payment, PaymentStatus status, String providerPaymentId, Instant now) {
        int rows = paymentRepository.completeIfPending(
            payment.getId(),
            status,
            providerPaymentId,
            status == PaymentStatus.PAID ? now : null,
            now);
        log.debug("Completed payment {}: status={}, rows={}", payment.getId(), status, rows);
        return rows == 1;
    }
}
