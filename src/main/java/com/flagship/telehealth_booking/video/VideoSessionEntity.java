package com.flagship.telehealth_booking.video;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import jakarta.persistence.UniqueConstraint;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.UUID;

/**
 * JPA entity for video sessions.
 *
 * The unique constraint on consultation_id is what serializes concurrent first
 * joins: the losing insert fails and the loser reuses the winner's room.
 */
@Entity
@Table(
    name = "video_sessions",
    uniqueConstraints = {
        @UniqueConstraint(name = "uq_video_sessions_consultation_id", columnNames = "consultation_id"),
        @UniqueConstraint(name = "uq_video_sessions_room_name", columnNames = "room_name")
    }
)
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class VideoSessionEntity {

    @Id
    @Column(nullable = false, updatable = false)
    private UUID id;

    @Column(name = "consultation_id", nullable = false, updatable = false)
    private UUID consultationId;

    @Column(nullable = false, updatable = false, length = 32)
    private String provider;

    @Column(name = "room_name", nullable = false, updatable = false)
    private String roomName;

    @Column(name = "room_url", nullable = false, updatable = false)
    private String roomUrl;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "ended_at")
    private Instant endedAt;

    static VideoSessionEntity fromDomain(VideoSession session) {
        return new VideoSessionEntity(
            session.getId(),
            session.getConsultationId(),
            session.getProvider(),
            session.getRoomName(),
            session.getRoomUrl(),
            session.getCreatedAt(),
            session.getEndedAt()
        );
    }

    public VideoSession toDomain() {
        return new VideoSession(id, consultationId, provider, roomName, roomUrl, createdAt, endedAt);
    }

    /**
     * Stamps the end of the call. Only the first call has an effect.
     */
    void end(Instant now) {
        if (this.endedAt == null) {
            this.endedAt = now;
        }
    }
}
