package com.flagship.telehealth_booking.video;

import com.flagship.telehealth_booking.common.exception.ProviderException;

import java.time.Instant;
import java.util.UUID;

/**
 * Port to the external video platform. Every method is a synchronous network call
 * without retries and throws {@link ProviderException} on failure.
 */
public interface VideoProvider {

    /** Provider tag stored on each video session (e.g. "DAILY"). */
    String providerId();

    VideoRoom createRoom(String roomName, Instant expiresAt);

    /**
     * Deletes a room, ejecting every participant. Deleting a room that no longer
     * exists is not an error.
     */
    void deleteRoom(String roomName);

    /**
     * @param owner owners can end the call and manage participants
     */
    MeetingToken createMeetingToken(String roomName, UUID userId, boolean owner, Instant expiresAt);
}
