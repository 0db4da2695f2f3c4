package com.flagship.telehealth_booking.video;

import com.flagship.telehealth_booking.audit.AuditEventType;
import com.flagship.telehealth_booking.audit.AuditRecorder;
import com.flagship.telehealth_booking.common.exception.ValidationException;
import com.flagship.telehealth_booking.consultation.Consultation;
import com.flagship.telehealth_booking.consultation.ConsultationAccessPolicy;
import com.flagship.telehealth_booking.consultation.ConsultationPersistenceService;
import com.flagship.telehealth_booking.consultation.ConsultationService;
import com.flagship.telehealth_booking.consultation.ConsultationStatus;
import com.flagship.telehealth_booking.identity.Caller;
import com.flagship.telehealth_booking.identity.Capability;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * Database side of joining and closing calls. Each public method is one atomic
 * unit; provider calls happen outside, in {@link JoinOrchestrator} and
 * {@link CallTerminationService}.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class VideoSessionWriter {

    private final VideoSessionRepository videoSessionRepository;
    private final ConsultationPersistenceService consultationPersistence;
    private final ConsultationService consultationService;
    private final ConsultationAccessPolicy accessPolicy;
    private final AuditRecorder auditRecorder;
    private final Clock clock;

    @Transactional(readOnly = true)
    public Optional<VideoSession> findByConsultationId(UUID consultationId) {
        return videoSessionRepository.findByConsultationId(consultationId)
            .map(VideoSessionEntity::toDomain);
    }

    /**
     * Inserts the video session and, for a PAID consultation, moves it to IN_CALL
     * with its CONSULT_STATUS_CHANGED event. The insert is flushed first so that a
     * concurrent first join fails here on the consultation_id unique constraint.
     */
    @Transactional
    public VideoSession commitFirstJoin(UUID actorUserId, UUID consultationId, String provider, VideoRoom room) {
        Consultation current = consultationPersistence.getById(consultationId);
        VideoSession session = VideoSession.open(consultationId, provider, room, now());
        videoSessionRepository.saveAndFlush(VideoSessionEntity.fromDomain(session));

        if (current.getStatus() == ConsultationStatus.PAID) {
            consultationService.transition(actorUserId, current, ConsultationStatus.IN_CALL,
                Map.of("roomName", room.getName()));
        } else if (current.getStatus() == ConsultationStatus.IN_CALL) {
            auditRecorder.record(actorUserId, consultationId, AuditEventType.VIDEO_ROOM_PROVISIONED,
                Map.of("roomName", room.getName()));
        } else {
            throw new ValidationException("Consultation is no longer joinable",
                Map.of("currentStatus", current.getStatus()));
        }

        log.info("Video session committed: consultationId={}, roomName={}", consultationId, room.getName());
        return session;
    }

    @Transactional
    public void recordTokenMinted(Caller caller, UUID consultationId, String roomName, boolean owner) {
        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("roomName", roomName);
        metadata.put("isOwner", owner);
        metadata.put("userRole", caller.getRole());
        auditRecorder.record(caller.getUserId(), consultationId, AuditEventType.JOIN_TOKEN_MINTED, metadata);
    }

    /**
     * Completes an IN_CALL consultation and stamps the session's end.
     */
    @Transactional
    public ClosedCall commitClose(Caller caller, UUID consultationId) {
        caller.require(Capability.CLOSE_CALL, "end consultations");
        Consultation current = consultationPersistence.getById(consultationId);
        accessPolicy.requireCanClose(current, caller);

        if (current.getStatus() != ConsultationStatus.IN_CALL) {
            Map<String, Object> details = new LinkedHashMap<>();
            details.put("currentStatus", current.getStatus());
            details.put("requiredStatus", ConsultationStatus.IN_CALL);
            throw new ValidationException(
                "Cannot close consultation with status " + current.getStatus() + "; it must be IN_CALL", details);
        }

        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("closedBy", caller.getRole());
        Consultation completed = consultationService.transition(
            caller.getUserId(), current, ConsultationStatus.COMPLETED, metadata);

        // Loaded after the transition: the compare-and-set clears the persistence context.
        VideoSession session = videoSessionRepository.findByConsultationId(consultationId)
            .map(entity -> {
                entity.end(completed.getEndedAt());
                return entity.toDomain();
            })
            .orElse(null);

        return new ClosedCall(completed, session);
    }

    private Instant now() {
        return Instant.now(clock).truncatedTo(ChronoUnit.MILLIS);
    }
}
