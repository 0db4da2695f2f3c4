package com.flagship.telehealth_booking.consultation;

/**
 * Consultation lifecycle states.
 *
 * COMPLETED, CANCELLED and EXPIRED are terminal. EXPIRED is never stored by the
 * orchestrator; it is derived at read time by {@link TimeWindowPolicy#effectiveStatus}.
 */
public enum ConsultationStatus {
    CREATED,
    PAYMENT_PENDING,
    PAID,
    PAYMENT_FAILED,
    IN_CALL,
    COMPLETED,
    CANCELLED,
    EXPIRED
}
