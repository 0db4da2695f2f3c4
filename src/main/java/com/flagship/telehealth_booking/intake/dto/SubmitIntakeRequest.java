package com.flagship.telehealth_booking.intake.dto;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/**
 * Intake form body, shared by create and upsert. Checked field by field in
 * {@link com.flagship.telehealth_booking.intake.PatientIntakeService}.
 */
@Value
@Builder
@Jacksonized
public class SubmitIntakeRequest {
    String nameOrAlias;
    String ageRange;
    String chiefComplaint;
    Boolean consentAccepted;
}
