package com.flagship.telehealth_booking.payment.gateway;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.util.UUID;

@Value
@Builder
public class CheckoutRequest {
    UUID paymentId;
    UUID consultationId;
    /** Major units, e.g. 150.00 USD. */
    BigDecimal amount;
    String currency;
    String description;
    String idempotencyKey;
}
