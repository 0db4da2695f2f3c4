package com.flagship.telehealth_booking.intake;

import com.fasterxml.jackson.databind.JsonNode;
import com.flagship.telehealth_booking.identity.Role;
import com.flagship.telehealth_booking.support.IntegrationTestSupport;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.Map;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

class PatientIntakeIntegrationTest extends IntegrationTestSupport {

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
    @DisplayName("Intake is submitted once, revised with PUT, read by the doctor and closed by payment")
    void intakeLifecycle() throws Exception {
        UUID consultationId = bookAndAssign(patientId, adminId, doctorId, T0.plus(Duration.ofHours(2)));
        String path = "/api/v1/consultations/" + consultationId + "/intake";

        JsonNode created = json(postJson(path, patientId,
                Map.of("nameOrAlias", " Sam ", "ageRange", "18-39", "consentAccepted", true))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.nameOrAlias").value("Sam"))
                .andExpect(jsonPath("$.consentAcceptedAt").value(T0.toString())));
        String intakeId = created.get("id").asText();

        postJson(path, patientId, Map.of("nameOrAlias", "Sam", "consentAccepted", true))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.error.details.existingIntakeId").value(intakeId));

        clock.advance(Duration.ofMinutes(3));
        putJson(path, patientId, Map.of("nameOrAlias", "Samantha", "chiefComplaint", "Chest pain",
                "consentAccepted", true))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.id").value(intakeId))
                .andExpect(jsonPath("$.ageRange").isEmpty())
                .andExpect(jsonPath("$.consentAcceptedAt").value(T0.toString()));

        getAs(path, doctorId)
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.nameOrAlias").value("Samantha"))
                .andExpect(jsonPath("$.chiefComplaint").value("Chest pain"));

        patchJson("/api/v1/consultations/" + consultationId, adminId, Map.of("status", "PAYMENT_PENDING"));
        patchJson("/api/v1/consultations/" + consultationId, adminId, Map.of("status", "PAID"));

        postJson(path, patientId, Map.of("nameOrAlias", "Sam", "consentAccepted", true))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error.details.currentStatus").value("PAID"));

        Integer rows = jdbcTemplate.queryForObject(
                "SELECT COUNT(*) FROM patient_intakes WHERE consultation_id = ?", Integer.class, consultationId);
        assertEquals(1, rows);
    }

    @Test
    @DisplayName("Doctors cannot submit intake for their patients")
    void doctorCannotSubmit() throws Exception {
        UUID consultationId = bookAndAssign(patientId, adminId, doctorId, T0.plus(Duration.ofHours(2)));

        postJson("/api/v1/consultations/" + consultationId + "/intake", doctorId,
                Map.of("nameOrAlias", "Sam", "consentAccepted", true))
                .andExpect(status().isForbidden())
                .andExpect(jsonPath("$.error.code").value("FORBIDDEN"));
    }
}
