package com.flagship.telehealth_booking.consultation;

import com.flagship.telehealth_booking.common.exception.InvalidStatusTransitionException;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.Collections;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.Map;
import java.util.Set;

import static com.flagship.telehealth_booking.consultation.ConsultationStatus.CANCELLED;
import static com.flagship.telehealth_booking.consultation.ConsultationStatus.COMPLETED;
import static com.flagship.telehealth_booking.consultation.ConsultationStatus.CREATED;
import static com.flagship.telehealth_booking.consultation.ConsultationStatus.EXPIRED;
import static com.flagship.telehealth_booking.consultation.ConsultationStatus.IN_CALL;
import static com.flagship.telehealth_booking.consultation.ConsultationStatus.PAID;
import static com.flagship.telehealth_booking.consultation.ConsultationStatus.PAYMENT_FAILED;
import static com.flagship.telehealth_booking.consultation.ConsultationStatus.PAYMENT_PENDING;

/**
 * The consultation state graph.
 *
 * A transition is legal iff it is an edge of {@link #TRANSITIONS}; everything else,
 * including a status "moving" to itself, is rejected. Entering IN_CALL stamps
 * startedAt and entering COMPLETED stamps endedAt. The graph has no path back into
 * either state, so each stamp is written at most once.
 */
@Component
public class StatusTransitionValidator {

    private static final Map<ConsultationStatus, Set<ConsultationStatus>> TRANSITIONS;

    static {
        Map<ConsultationStatus, Set<ConsultationStatus>> table = new EnumMap<>(ConsultationStatus.class);
        table.put(CREATED, EnumSet.of(PAYMENT_PENDING, CANCELLED));
        table.put(PAYMENT_PENDING, EnumSet.of(PAID, PAYMENT_FAILED, CANCELLED));
        table.put(PAID, EnumSet.of(IN_CALL, CANCELLED));
        table.put(IN_CALL, EnumSet.of(COMPLETED));
        table.put(COMPLETED, EnumSet.noneOf(ConsultationStatus.class));
        table.put(CANCELLED, EnumSet.noneOf(ConsultationStatus.class));
        table.put(EXPIRED, EnumSet.noneOf(ConsultationStatus.class));
        table.put(PAYMENT_FAILED, EnumSet.of(PAYMENT_PENDING));
        TRANSITIONS = Collections.unmodifiableMap(table);
    }

    public boolean isAllowed(ConsultationStatus from, ConsultationStatus to) {
        return TRANSITIONS.getOrDefault(from, Set.of()).contains(to);
    }

    public Set<ConsultationStatus> allowedTargets(ConsultationStatus from) {
        return Collections.unmodifiableSet(TRANSITIONS.getOrDefault(from, Set.of()));
    }

    /**
     * @throws InvalidStatusTransitionException if {@code from -> to} is not an edge
     */
    public void validate(ConsultationStatus from, ConsultationStatus to) {
        if (!isAllowed(from, to)) {
            throw new InvalidStatusTransitionException(from, to);
        }
    }

    /**
     * Validates and applies a transition, stamping the side-effect timestamps.
     *
     * @return a new Consultation in status {@code to} with updatedAt = now
     */
    public Consultation apply(Consultation consultation, ConsultationStatus to, Instant now) {
        validate(consultation.getStatus(), to);

        Consultation.ConsultationBuilder next = consultation.toBuilder()
            .status(to)
            .updatedAt(now);
        if (to == IN_CALL) {
            next.startedAt(now);
        } else if (to == COMPLETED) {
            next.endedAt(now);
        }
        return next.build();
    }
}
