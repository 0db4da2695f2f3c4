package com.flagship.telehealth_booking.payment;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

/**
 * Payment domain object. One row per checkout attempt.
 */
@Value
@Builder(toBuilder = true)
public class Payment {
    UUID id;
    UUID consultationId;
    BigDecimal amount;
    String currency;
    PaymentStatus status;
    /** Provider checkout session id; the key webhook events are matched on. */
    String providerCheckoutId;
    String idempotencyKey;
    String providerPaymentId;
    Instant paidAt;
    Instant createdAt;
    Instant updatedAt;

    public static Payment pending(UUID id, UUID consultationId, BigDecimal amount, String currency,
                                  String providerCheckoutId, String idempotencyKey, Instant now) {
        return Payment.builder()
            .id(id)
            .consultationId(consultationId)
            .amount(amount)
            .currency(currency)
            .status(PaymentStatus.PENDING)
            .providerCheckoutId(providerCheckoutId)
            .idempotencyKey(idempotencyKey)
            .createdAt(now)
            .updatedAt(now)
            .build();
    }

    public boolean isPending() {
        return status == PaymentStatus.PENDING;
    }
}
