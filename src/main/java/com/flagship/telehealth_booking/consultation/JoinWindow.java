package com.flagship.telehealth_booking.consultation;

import lombok.Value;

import java.time.Instant;

/**
 * Closed interval [opensAt, closesAt] during which a scheduled consultation can be joined.
 */
@Value
public class JoinWindow {
    Instant scheduledAt;
    Instant opensAt;
    Instant closesAt;

    public boolean contains(Instant instant) {
        return !instant.isBefore(opensAt) && !instant.isAfter(closesAt);
    }

    public boolean notYetOpen(Instant instant) {
        return instant.isBefore(opensAt);
    }

    public boolean closed(Instant instant) {
        return instant.isAfter(closesAt);
    }
}
