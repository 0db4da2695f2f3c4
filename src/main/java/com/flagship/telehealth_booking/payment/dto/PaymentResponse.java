package com.flagship.telehealth_booking.payment.dto;

import com.flagship.telehealth_booking.payment.Payment;
import com.flagship.telehealth_booking.payment.PaymentStatus;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

@Value
@Builder
public class PaymentResponse {
    UUID id;
    UUID consultationId;
    PaymentStatus status;
    BigDecimal amount;
    String currency;
    String providerCheckoutId;
    Instant paidAt;
    Instant createdAt;
    Instant updatedAt;

    public static PaymentResponse from(Payment payment) {
        return PaymentResponse.builder()
            .id(payment.getId())
            .consultationId(payment.getConsultationId())
            .status(payment.getStatus())
            .amount(payment.getAmount())
            .currency(payment.getCurrency())
            .providerCheckoutId(payment.getProviderCheckoutId())
            .paidAt(payment.getPaidAt())
            .createdAt(payment.getCreatedAt())
            .updatedAt(payment.getUpdatedAt())
            .build();
    }
}
