package com.flagship.telehealth_booking.intake;

import java.util.Arrays;
import java.util.List;
import java.util.Optional;

/**
 * Coarse age bands a patient can report on intake. Clients exchange the label.
 */
public enum AgeRange {
    FROM_18_TO_39("18-39"),
    FROM_40_TO_64("40-64"),
    FROM_65("65+");

    private final String label;

    AgeRange(String label) {
        this.label = label;
    }

    public String getLabel() {
        return label;
    }

    public static Optional<AgeRange> fromLabel(String label) {
        return Arrays.stream(values())
            .filter(range -> range.label.equals(label))
            .findFirst();
    }

    public static List<String> labels() {
        return Arrays.stream(values()).map(AgeRange::getLabel).toList();
    }
}
