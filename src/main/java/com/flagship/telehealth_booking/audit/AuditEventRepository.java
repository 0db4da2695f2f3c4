package com.flagship.telehealth_booking.audit;

import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.UUID;

@Repository
public interface AuditEventRepository extends JpaRepository<AuditEventEntity, UUID> {

    /**
     * Nullable filters: a null parameter matches every row.
     * Newest first.
     */
    @Query("""
        SELECT e FROM AuditEventEntity e
        WHERE (:eventType IS NULL OR e.eventType = :eventType)
          AND (:actorUserId IS NULL OR e.actorUserId = :actorUserId)
          AND (:consultationId IS NULL OR e.consultationId = :consultationId)
        ORDER BY e.createdAt DESC
        """)
    Page<AuditEventEntity> findByFilter(
        @Param("eventType") AuditEventType eventType,
        @Param("actorUserId") UUID actorUserId,
        @Param("consultationId") UUID consultationId,
        Pageable pageable);

    List<AuditEventEntity> findByConsultationIdOrderByCreatedAtAsc(UUID consultationId);

    long countByConsultationIdAndEventType(UUID consultationId, AuditEventType eventType);
}
