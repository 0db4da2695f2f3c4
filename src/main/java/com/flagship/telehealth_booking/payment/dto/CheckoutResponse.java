package com.flagship.telehealth_booking.payment.dto;

import lombok.Value;

import java.util.UUID;

@Value
public class CheckoutResponse {
    /** Hosted checkout page to redirect the patient to. */
    String url;
    UUID paymentId;
}
