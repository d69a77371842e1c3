package com.hiredoc.domain.document.model;

/**
 * One bounded sub-score of a psychometric assessment.
 *
 * @param name        canonical (English) dimension name
 * @param value       score, always within [0, 100]
 * @param description the label as written in the source
 * @param category    dimension family
 */
public record AssessmentDimension(
        String name,
        double value,
        String description,
        DimensionCategory category
) {
    public static final double MIN_VALUE = 0.0;
    public static final double MAX_VALUE = 100.0;

    public AssessmentDimension {
        if (!inRange(value)) {
            throw new IllegalArgumentException(
                    "Dimension '" + name + "' value " + value + " is outside [0, 100]");
        }
    }

    public static boolean inRange(double value) {
        return value >= MIN_VALUE && value <= MAX_VALUE;
    }
}
