package com.flagship.telehealth_booking.payment;

import lombok.Value;

import java.util.UUID;

/**
 * A started checkout: where to send the patient, and the PENDING payment it created.
 */
@Value
public class CheckoutSession {
    String url;
    UUID paymentId;
}
