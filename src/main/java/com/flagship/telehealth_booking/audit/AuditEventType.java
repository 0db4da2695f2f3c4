package com.flagship.telehealth_booking.audit;

public enum AuditEventType {
    CONSULT_CREATED,
    CONSULT_STATUS_CHANGED,
    CONSULT_DOCTOR_ASSIGNED,
    CONSULT_RESCHEDULED,
    VIDEO_ROOM_PROVISIONED,
    JOIN_TOKEN_MINTED,
    PAYMENT_INITIATED,
    PAYMENT_CONFIRMED,
    PAYMENT_CONFLICT_SLOT_TAKEN
}
