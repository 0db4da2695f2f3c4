package com.flagship.telehealth_booking.identity;

import java.util.Collections;
import java.util.EnumSet;
import java.util.Set;

public enum Role {
    PATIENT(EnumSet.of(
            Capability.BOOK_CONSULTATION,
            Capability.INITIATE_PAYMENT)),
    DOCTOR(EnumSet.of(
            Capability.UPDATE_STATUS,
            Capability.RESCHEDULE,
            Capability.CLOSE_CALL,
            Capability.OWN_CALL)),
    ADMIN(EnumSet.of(
            Capability.UPDATE_STATUS,
            Capability.RESCHEDULE,
            Capability.ASSIGN_DOCTOR,
            Capability.CLOSE_CALL,
            Capability.VIEW_AUDIT,
            Capability.VIEW_ALL_CONSULTATIONS,
            Capability.OWN_CALL));

    private final Set<Capability> capabilities;

    Role(Set<Capability> capabilities) {
        this.capabilities = Collections.unmodifiableSet(capabilities);
    }

    public boolean can(Capability capability) {
        return capabilities.contains(capability);
    }

    public Set<Capability> getCapabilities() {
        return capabilities;
    }
}
