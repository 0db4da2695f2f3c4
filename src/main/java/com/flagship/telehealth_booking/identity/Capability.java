package com.flagship.telehealth_booking.identity;

/**
 * Operations gated by role. Ownership checks (own consultation, assigned doctor)
 * are applied on top of these by the consultation access policy.
 */
public enum Capability {
    BOOK_CONSULTATION,
    INITIATE_PAYMENT,
    UPDATE_STATUS,
    RESCHEDULE,
    ASSIGN_DOCTOR,
    CLOSE_CALL,
    VIEW_AUDIT,
    VIEW_ALL_CONSULTATIONS,
    /** Join video rooms with owner privileges. */
    OWN_CALL
}
