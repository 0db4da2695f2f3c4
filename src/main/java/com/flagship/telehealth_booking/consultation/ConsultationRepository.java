package com.flagship.telehealth_booking.consultation;

import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

@Repository
public interface ConsultationRepository extends JpaRepository<ConsultationEntity, UUID> {

    /**
     * Writes the mutable columns only if the row still carries the updatedAt the
     * caller read. Returns the number of rows written: 0 means another writer won.
     */
    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("""
        UPDATE ConsultationEntity c
           SET c.status = :status,
               c.doctorId = :doctorId,
               c.scheduledStartAt = :scheduledStartAt,
               c.startedAt = :startedAt,
               c.endedAt = :endedAt,
               c.updatedAt = :updatedAt
         WHERE c.id = :id
           AND c.updatedAt = :expectedUpdatedAt
        """)
    int compareAndSet(
        @Param("id") UUID id,
        @Param("expectedUpdatedAt") Instant expectedUpdatedAt,
        @Param("status") ConsultationStatus status,
        @Param("doctorId") UUID doctorId,
        @Param("scheduledStartAt") Instant scheduledStartAt,
        @Param("startedAt") Instant startedAt,
        @Param("endedAt") Instant endedAt,
        @Param("updatedAt") Instant updatedAt);

    /**
     * Nullable filters: a null parameter matches every row.
     */
    @Query("""
        SELECT c FROM ConsultationEntity c
        WHERE (:patientId IS NULL OR c.patientId = :patientId)
          AND (:doctorId IS NULL OR c.doctorId = :doctorId)
          AND (:status IS NULL OR c.status = :status)
          AND (:specialty IS NULL OR c.specialty = :specialty)
        ORDER BY c.createdAt DESC
        """)
    List<ConsultationEntity> search(
        @Param("patientId") UUID patientId,
        @Param("doctorId") UUID doctorId,
        @Param("status") ConsultationStatus status,
        @Param("specialty") Specialty specialty,
        Pageable pageable);
}
