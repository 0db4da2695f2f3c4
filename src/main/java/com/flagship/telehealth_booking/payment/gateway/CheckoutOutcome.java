package com.flagship.telehealth_booking.payment.gateway;

/**
 * Terminal outcome a provider reports for a checkout session.
 */
public enum CheckoutOutcome {
    COMPLETED,
    FAILED
}
