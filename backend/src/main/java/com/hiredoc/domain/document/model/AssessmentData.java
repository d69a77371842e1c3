package com.hiredoc.domain.document.model;

import java.util.List;

public record AssessmentData(
        String testName,
        String testType,
        String candidateName,
        String testDate,
        List<AssessmentDimension> scores,
        List<RejectedDimension> rejectedScores,
        Double sincerityScore,
        String interpretation,
        String rawText
) implements ExtractedDocument {

    /**
     * Test name used when no known test family or report title is found.
     */
    public static final String UNKNOWN_TEST_NAME = "Unknown Assessment";

    public AssessmentData {
        scores = scores == null ? List.of() : List.copyOf(scores);
        rejectedScores = rejectedScores == null ? List.of() : List.copyOf(rejectedScores);
        if (sincerityScore != null && !AssessmentDimension.inRange(sincerityScore)) {
            throw new IllegalArgumentException("Sincerity score " + sincerityScore + " is outside [0, 100]");
        }
    }
}
