package com.flagship.telehealth_booking.payment.dto;

import jakarta.validation.constraints.NotNull;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.UUID;

@Value
@Builder
@Jacksonized
public class CreatePaymentRequest {

    @NotNull(message = "consultationId is required")
    UUID consultationId;
}
