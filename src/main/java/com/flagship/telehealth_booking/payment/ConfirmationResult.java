package com.flagship.telehealth_booking.payment;

/**
 * What a webhook confirmation did.
 */
public enum ConfirmationResult {
    /** Payment PAID, consultation PAID. */
    PAID,
    /** Payment PAID but the doctor's slot was already confirmed elsewhere; consultation PAYMENT_FAILED. */
    SLOT_TAKEN,
    /** Payment FAILED, consultation PAYMENT_FAILED. */
    FAILED,
    /** The payment had already left PENDING; nothing changed. */
    ALREADY_PROCESSED,
    /** No payment matches the checkout session. */
    UNKNOWN_SESSION,
    /** Verified event with no payment outcome. */
    IGNORED
}
