package com.flagship.telehealth_booking.intake;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.Optional;
import java.util.UUID;

@Repository
public interface PatientIntakeRepository extends JpaRepository<PatientIntakeEntity, UUID> {

    Optional<PatientIntakeEntity> findByConsultationId(UUID consultationId);
}
