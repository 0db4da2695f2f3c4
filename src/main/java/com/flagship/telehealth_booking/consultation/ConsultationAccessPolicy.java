package com.flagship.telehealth_booking.consultation;

import com.flagship.telehealth_booking.common.exception.ForbiddenException;
import com.flagship.telehealth_booking.identity.Caller;
import com.flagship.telehealth_booking.identity.Capability;
import com.flagship.telehealth_booking.identity.Role;
import org.springframework.stereotype.Component;

/**
 * Per-consultation ownership rules layered on top of role capabilities.
 */
@Component
public class ConsultationAccessPolicy {

    /**
     * Admins see everything; patients and doctors only consultations they take part in.
     */
    public void requireVisible(Consultation consultation, Caller caller) {
        if (caller.can(Capability.VIEW_ALL_CONSULTATIONS)) {
            return;
        }
        if (!consultation.isParticipant(caller.getUserId())) {
            throw new ForbiddenException("You do not have access to this consultation");
        }
    }

    /**
     * The patient, the assigned doctor or an admin.
     */
    public void requireCanJoin(Consultation consultation, Caller caller) {
        if (caller.is(Role.ADMIN)) {
            return;
        }
        boolean allowed = caller.is(Role.PATIENT)
            ? consultation.isOwnedBy(caller.getUserId())
            : consultation.isAssignedTo(caller.getUserId());
        if (!allowed) {
            throw new ForbiddenException("You are not a participant of this consultation");
        }
    }

    /**
     * The assigned doctor or an admin.
     */
    public void requireCanClose(Consultation consultation, Caller caller) {
        caller.require(Capability.CLOSE_CALL, "close calls");
        if (caller.is(Role.DOCTOR) && !consultation.isAssignedTo(caller.getUserId())) {
            throw new ForbiddenException("Only the assigned doctor can close this call");
        }
    }

    /**
     * Only the patient who booked the consultation may pay for it.
     */
    public void requireOwner(Consultation consultation, Caller caller) {
        caller.require(Capability.INITIATE_PAYMENT, "pay for consultations");
        if (!consultation.isOwnedBy(caller.getUserId())) {
            throw new ForbiddenException("You can only pay for your own consultations");
        }
    }

    /**
     * Intake answers come from the booking patient alone; admins and doctors only read them.
     */
    public void requireIntakeAuthor(Consultation consultation, Caller caller) {
        if (!consultation.isOwnedBy(caller.getUserId())) {
            throw new ForbiddenException("Only the consultation owner can submit intake");
        }
    }
}
