package com.flagship.telehealth_booking.consultation;

import com.flagship.telehealth_booking.common.exception.ValidationException;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Time boundaries for joining and for the display-only EXPIRED status.
 *
 * Both window boundaries are inclusive. An unscheduled consultation is always joinable.
 */
@Component
public class TimeWindowPolicy {

    public static final Duration EARLY_JOIN = Duration.ofMinutes(5);
    public static final Duration LATE_JOIN = Duration.ofMinutes(30);

    public JoinWindow windowFor(Instant scheduledStartAt) {
        return new JoinWindow(
            scheduledStartAt,
            scheduledStartAt.minus(EARLY_JOIN),
            scheduledStartAt.plus(LATE_JOIN));
    }

    public boolean joinable(Instant scheduledStartAt, Instant now) {
        return scheduledStartAt == null || windowFor(scheduledStartAt).contains(now);
    }

    /**
     * @throws ValidationException carrying scheduledAt and the violated boundary
     *         (opensAt when too early, closedAt when too late)
     */
    public void requireJoinable(Instant scheduledStartAt, Instant now) {
        if (scheduledStartAt == null) {
            return;
        }
        JoinWindow window = windowFor(scheduledStartAt);
        if (window.notYetOpen(now)) {
            Map<String, Object> details = new LinkedHashMap<>();
            details.put("scheduledAt", scheduledStartAt);
            details.put("opensAt", window.getOpensAt());
            throw new ValidationException(
                "Consultation can be joined from " + EARLY_JOIN.toMinutes() + " minutes before the scheduled time",
                details);
        }
        if (window.closed(now)) {
            Map<String, Object> details = new LinkedHashMap<>();
            details.put("scheduledAt", scheduledStartAt);
            details.put("closedAt", window.getClosesAt());
            throw new ValidationException(
                "Join window closed " + LATE_JOIN.toMinutes() + " minutes after the scheduled time",
                details);
        }
    }

    /**
     * Status to display. A PAID or IN_CALL consultation whose window has closed reads
     * as EXPIRED; the stored status is never changed by this method.
     */
    public ConsultationStatus effectiveStatus(Consultation consultation, Instant now) {
        ConsultationStatus status = consultation.getStatus();
        boolean expirable = status == ConsultationStatus.PAID || status == ConsultationStatus.IN_CALL;
        if (expirable && consultation.getScheduledStartAt() != null
                && windowFor(consultation.getScheduledStartAt()).closed(now)) {
            return ConsultationStatus.EXPIRED;
        }
        return status;
    }

    /**
     * PAID or IN_CALL with a scheduled start whose join window has not opened yet.
     */
    public boolean isUpcoming(Consultation consultation, Instant now) {
        ConsultationStatus status = consultation.getStatus();
        return (status == ConsultationStatus.PAID || status == ConsultationStatus.IN_CALL)
            && consultation.getScheduledStartAt() != null
            && windowFor(consultation.getScheduledStartAt()).notYetOpen(now);
    }

    /**
     * Bookings must start strictly after the instant they are made.
     */
    public void requireBookable(Instant scheduledStartAt, Instant now) {
        if (scheduledStartAt != null && !scheduledStartAt.isAfter(now)) {
            Map<String, Object> details = new LinkedHashMap<>();
            details.put("scheduledStartAt", scheduledStartAt);
            details.put("now", now);
            throw new ValidationException("scheduledStartAt must be in the future", details);
        }
    }
}
