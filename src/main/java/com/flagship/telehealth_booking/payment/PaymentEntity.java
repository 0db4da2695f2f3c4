package com.flagship.telehealth_booking.payment;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.Table;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

/**
 * JPA entity for payments. No setters: outcomes are written through
 * {@link PaymentRepository#completeIfPending}.
 */
@Entity
@Table(
    name = "payments",
    indexes = {
        @Index(name = "idx_payments_consultation_id", columnList = "consultation_id"),
        @Index(name = "idx_payments_provider_checkout_id", columnList = "provider_checkout_id")
    }
)
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class PaymentEntity {

    @Id
    @Column(nullable = false, updatable = false)
    private UUID id;

    @Column(name = "consultation_id", nullable = false, updatable = false)
    private UUID consultationId;

    @Column(nullable = false, precision = 19, scale = 4, updatable = false)
    private BigDecimal amount;

    @Column(nullable = false, length = 3, updatable = false)
    private String currency;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 16)
    private PaymentStatus status;

    @Column(name = "provider_checkout_id", nullable = false, unique = true, updatable = false)
    private String providerCheckoutId;

    @Column(name = "idempotency_key", nullable = false, unique = true, updatable = false)
    private String idempotencyKey;

    @Column(name = "provider_payment_id")
    private String providerPaymentId;

    @Column(name = "paid_at")
    private Instant paidAt;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    static PaymentEntity fromDomain(Payment payment) {
        return new PaymentEntity(
            payment.getId(),
            payment.getConsultationId(),
            payment.getAmount(),
            payment.getCurrency(),
            payment.getStatus(),
            payment.getProviderCheckoutId(),
            payment.getIdempotencyKey(),
            payment.getProviderPaymentId(),
            payment.getPaidAt(),
            payment.getCreatedAt(),
            payment.getUpdatedAt()
        );
    }

    public Payment toDomain() {
        return Payment.builder()
            .id(id)
            .consultationId(consultationId)
            .amount(amount)
            .currency(currency)
            .status(status)
            .providerCheckoutId(providerCheckoutId)
            .idempotencyKey(idempotencyKey)
            .providerPaymentId(providerPaymentId)
            .paidAt(paidAt)
            .createdAt(createdAt)
            .updatedAt(updatedAt)
            .build();
    }
}
