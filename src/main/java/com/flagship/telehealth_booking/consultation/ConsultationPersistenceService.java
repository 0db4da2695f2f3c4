package com.flagship.telehealth_booking.consultation;

import com.flagship.telehealth_booking.common.exception.ConflictException;
import com.flagship.telehealth_booking.common.exception.NotFoundException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * Bridges the Consultation domain object and its JPA entity.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ConsultationPersistenceService {

    private final ConsultationRepository consultationRepository;

    @Transactional
    public Consultation insert(Consultation consultation) {
        ConsultationEntity saved = consultationRepository.save(ConsultationEntity.fromDomain(consultation));
        log.debug("Saved consultation {}", saved.getId());
        return saved.toDomain();
    }

    @Transactional(readOnly = true)
    public Optional<Consultation> findById(UUID consultationId) {
        return consultationRepository.findById(consultationId)
            .map(ConsultationEntity::toDomain);
    }

    /**
     * @throws NotFoundException if no consultation has this id
     */
    @Transactional(readOnly = true)
    public Consultation getById(UUID consultationId) {
        return findById(consultationId)
            .orElseThrow(() -> new NotFoundException("Consultation", consultationId));
    }

    /**
     * Persists {@code updated} only if the stored row still carries
     * {@code current.getUpdatedAt()}.
     *
     * @throws ConflictException if another writer changed the row since {@code current} was read
     */
    @Transactional
    public Consultation compareAndSet(Consultation current, Consultation updated) {
        int rows = consultationRepository.compareAndSet(
            current.getId(),
            current.getUpdatedAt(),
            updated.getStatus(),
            updated.getDoctorId(),
            updated.getScheduledStartAt(),
            updated.getStartedAt(),
            updated.getEndedAt(),
            updated.getUpdatedAt());

        if (rows == 0) {
            log.info("Concurrent modification detected for consultation {}", current.getId());
            Map<String, Object> details = new LinkedHashMap<>();
            details.put("consultationId", current.getId());
            details.put("expectedUpdatedAt", current.getUpdatedAt());
            throw new ConflictException("Consultation was modified concurrently", details);
        }

        log.debug("Updated consultation {}: status={}", current.getId(), updated.getStatus());
        return updated;
    }

    @Transactional(readOnly = true)
    public List<Consultation> search(ConsultationQuery query) {
        return consultationRepository.search(
                query.getPatientId(),
                query.getDoctorId(),
                query.getStatus(),
                query.getSpecialty(),
                new OffsetPageRequest(query.getOffset(), query.getLimit()))
            .stream()
            .map(ConsultationEntity::toDomain)
            .toList();
    }
}
