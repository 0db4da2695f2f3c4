package com.flagship.telehealth_booking.payment;

/**
 * Payment lifecycle: PENDING until the provider reports an outcome, then PAID or FAILED.
 * Both outcomes are terminal.
 */
public enum PaymentStatus {
    PENDING,
    PAID,
    FAILED
}
