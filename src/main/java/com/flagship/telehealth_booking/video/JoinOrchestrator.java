package com.flagship.telehealth_booking.video;

import com.flagship.telehealth_booking.common.exception.ValidationException;
import com.flagship.telehealth_booking.consultation.Consultation;
import com.flagship.telehealth_booking.consultation.ConsultationAccessPolicy;
import com.flagship.telehealth_booking.consultation.ConsultationPersistenceService;
import com.flagship.telehealth_booking.consultation.ConsultationStatus;
import com.flagship.telehealth_booking.consultation.TimeWindowPolicy;
import com.flagship.telehealth_booking.identity.Caller;
import com.flagship.telehealth_booking.identity.Capability;
import com.flagship.telehealth_booking.observability.ConsultationMetrics;
import com.flagship.telehealth_booking.video.dto.JoinResponse;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;
import java.util.UUID;

/**
 * Joins a caller to the consultation's video room.
 *
 * The first join provisions the provider room and then commits the video session
 * together with the PAID to IN_CALL transition. The provider and the database cannot
 * share a transaction, so a failed or lost commit is undone by deleting the room
 * (compensation). Later joins reuse the stored room and mint a fresh token each time.
 *
 * Not transactional itself: each database step runs in its own transaction in
 * {@link VideoSessionWriter} so that provider calls never hold a connection.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class JoinOrchestrator {

    private static final Set<ConsultationStatus> JOINABLE_STATUSES =
        EnumSet.of(ConsultationStatus.PAID, ConsultationStatus.IN_CALL);

    private final ConsultationPersistenceService consultationPersistence;
    private final ConsultationAccessPolicy accessPolicy;
    private final TimeWindowPolicy timeWindowPolicy;
    private final VideoSessionWriter videoSessionWriter;
    private final VideoProvider videoProvider;
    private final VideoProperties videoProperties;
    private final ConsultationMetrics metrics;
    private final Clock clock;

    public JoinResponse join(Caller caller, UUID consultationId) {
        Consultation consultation = consultationPersistence.getById(consultationId);
        accessPolicy.requireCanJoin(consultation, caller);
        requireJoinableStatus(consultation);

        Instant now = Instant.now(clock).truncatedTo(ChronoUnit.MILLIS);
        timeWindowPolicy.requireJoinable(consultation.getScheduledStartAt(), now);

        VideoSession session = videoSessionWriter.findByConsultationId(consultationId)
            .orElseGet(() -> provision(caller, consultation, now));

        boolean owner = caller.can(Capability.OWN_CALL);
        MeetingToken token = videoProvider.createMeetingToken(
            session.getRoomName(), caller.getUserId(), owner, now.plus(videoProperties.getTokenTtl()));
        videoSessionWriter.recordTokenMinted(caller, consultationId, session.getRoomName(), owner);
        metrics.recordTokenMinted(owner);

        log.info("Join token minted: consultationId={}, roomName={}, owner={}",
            consultationId, session.getRoomName(), owner);

        return JoinResponse.builder()
            .joinUrl(session.getRoomUrl() + "?t=" + token.getToken())
            .roomUrl(session.getRoomUrl())
            .token(token.getToken())
            .expiresAt(token.getExpiresAt())
            .build();
    }

    private void requireJoinableStatus(Consultation consultation) {
        if (!JOINABLE_STATUSES.contains(consultation.getStatus())) {
            Map<String, Object> details = new LinkedHashMap<>();
            details.put("currentStatus", consultation.getStatus());
            details.put("requiredStatus", JOINABLE_STATUSES.stream().map(Enum::name).toList());
            throw new ValidationException(
                "Cannot join consultation with status " + consultation.getStatus()
                    + "; it must be PAID or IN_CALL", details);
        }
    }

    private VideoSession provision(Caller caller, Consultation consultation, Instant now) {
        String roomName = roomNameFor(consultation.getId(), now);
        VideoRoom room = videoProvider.createRoom(roomName, now.plus(videoProperties.getRoomTtl()));
        metrics.incrementRoomsCreated();

        try {
            return videoSessionWriter.commitFirstJoin(
                caller.getUserId(), consultation.getId(), videoProvider.providerId(), room);

        } catch (DataIntegrityViolationException e) {
            // Another first join committed its session first; use that room instead.
            compensate(consultation.getId(), room);
            return videoSessionWriter.findByConsultationId(consultation.getId())
                .orElseThrow(() -> e);

        } catch (RuntimeException e) {
            compensate(consultation.getId(), room);
            throw e;
        }
    }

    /**
     * Providers reject duplicate room names, so concurrent first joins in the same
     * millisecond each need their own suffix to reach the commit race.
     */
    static String roomNameFor(UUID consultationId, Instant now) {
        return "consult_" + consultationId + "_" + now.toEpochMilli() + "_"
            + UUID.randomUUID().toString().substring(0, 8);
    }

    /**
     * Deletes a room whose session was never committed. A failure here is logged and
     * counted but never replaces the original outcome.
     */
    private void compensate(UUID consultationId, VideoRoom room) {
        try {
            videoProvider.deleteRoom(room.getName());
            metrics.incrementRoomsCompensated();
            log.info("Compensated uncommitted room: consultationId={}, roomName={}", consultationId, room.getName());
        } catch (RuntimeException cleanupError) {
            metrics.incrementCompensationFailures();
            log.error("Failed to delete uncommitted room, it will expire on its own: consultationId={}, roomName={}",
                consultationId, room.getName(), cleanupError);
        }
    }
}
