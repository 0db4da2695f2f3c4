package com.flagship.telehealth_booking.video;

import lombok.Value;

import java.time.Instant;
import java.util.UUID;

/**
 * The provider room backing a consultation. At most one per consultation; its
 * creation is what moves a PAID consultation to IN_CALL.
 */
@Value
public class VideoSession {
    UUID id;
    UUID consultationId;
    String provider;
    String roomName;
    String roomUrl;
    Instant createdAt;
    Instant endedAt;

    public static VideoSession open(UUID consultationId, String provider, VideoRoom room, Instant now) {
        return new VideoSession(UUID.randomUUID(), consultationId, provider, room.getName(), room.getUrl(), now, null);
    }

    public boolean isEnded() {
        return endedAt != null;
    }
}
