package com.flagship.telehealth_booking.audit;

import com.fasterxml.jackson.databind.JsonNode;
import com.flagship.telehealth_booking.identity.Role;
import com.flagship.telehealth_booking.support.IntegrationTestSupport;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.mock.mockito.SpyBean;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.transaction.IllegalTransactionStateException;

import java.time.Duration;
import java.util.Map;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doAnswer;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

/**
 * A mutation and its audit event commit together or not at all.
 */
class AuditAtomicityIntegrationTest extends IntegrationTestSupport {

    @SpyBean
    private AuditEventRepository auditEventRepository;

    @Autowired
    private AuditRecorder auditRecorder;

    private UUID patientId;
    private UUID doctorId;
    private UUID adminId;

    @BeforeEach
    void setUp() {
        patientId = registerUser(Role.PATIENT);
        doctorId = registerUser(Role.DOCTOR);
        adminId = registerUser(Role.ADMIN);
    }

    @Test
    @DisplayName("A status change whose audit write fails is rolled back")
    void statusChangeRolledBackWithAudit() throws Exception {
        String path = book();
        UUID consultationId = UUID.fromString(path.substring(path.lastIndexOf('/') + 1));
        failAuditWritesOf(AuditEventType.CONSULT_STATUS_CHANGED);

        patchJson(path, adminId, Map.of("status", "PAYMENT_PENDING"))
                .andExpect(status().isInternalServerError())
                .andExpect(jsonPath("$.error.code").value("INTERNAL_ERROR"));

        assertEquals("CREATED", storedStatus(consultationId));
        assertNull(auditCounts(consultationId).get("CONSULT_STATUS_CHANGED"));
        assertEquals(1, auditCounts(consultationId).size());
    }

    @Test
    @DisplayName("A doctor assignment whose audit write fails leaves the consultation unassigned")
    void assignmentRolledBackWithAudit() throws Exception {
        String path = book();
        UUID consultationId = UUID.fromString(path.substring(path.lastIndexOf('/') + 1));
        failAuditWritesOf(AuditEventType.CONSULT_DOCTOR_ASSIGNED);

        patchJson(path, adminId, Map.of("doctorId", doctorId))
                .andExpect(status().isInternalServerError());

        assertNull(jdbcTemplate.queryForObject(
                "SELECT doctor_id FROM consultations WHERE id = ?", UUID.class, consultationId));
        assertNull(auditCounts(consultationId).get("CONSULT_DOCTOR_ASSIGNED"));
    }

    @Test
    @DisplayName("Audit events cannot be written outside a transaction")
    void recordRequiresTransaction() {
        assertThrows(IllegalTransactionStateException.class, () -> auditRecorder.record(
                adminId, UUID.randomUUID(), AuditEventType.CONSULT_STATUS_CHANGED, Map.of()));

        Integer rows = jdbcTemplate.queryForObject("SELECT COUNT(*) FROM audit_events", Integer.class);
        assertEquals(0, rows);
    }

    private String book() throws Exception {
        JsonNode created = json(postJson("/api/v1/consultations", patientId,
                Map.of("specialty", "general", "scheduledStartAt", T0.plus(Duration.ofHours(2)).toString()))
                .andExpect(status().isCreated()));
        return "/api/v1/consultations/" + created.get("id").asText();
    }

    private void failAuditWritesOf(AuditEventType type) {
        doAnswer(inv -> {
            AuditEventEntity entity = inv.getArgument(0);
            if (entity.getEventType() == type) {
                throw new DataAccessResourceFailureException("audit store unavailable");
            }
            return inv.callRealMethod();
        }).when(auditEventRepository).save(any(AuditEventEntity.class));
    }

    private String storedStatus(UUID consultationId) {
        return jdbcTemplate.queryForObject(
                "SELECT status FROM consultations WHERE id = ?", String.class, consultationId);
    }
}
