package com.flagship.telehealth_booking.intake;

import lombok.Value;

/**
 * Validated, normalized intake form content.
 */
@Value
public class IntakeAnswers {
    String nameOrAlias;
    AgeRange ageRange;
    String chiefComplaint;
}
