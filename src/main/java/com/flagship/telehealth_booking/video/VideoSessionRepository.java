package com.flagship.telehealth_booking.video;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.Optional;
import java.util.UUID;

@Repository
public interface VideoSessionRepository extends JpaRepository<VideoSessionEntity, UUID> {

    Optional<VideoSessionEntity> findByConsultationId(UUID consultationId);

    long countByConsultationId(UUID consultationId);
}
