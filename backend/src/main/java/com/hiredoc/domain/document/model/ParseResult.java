package com.hiredoc.domain.document.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Envelope handed back to the caller for every pipeline run.
 * <p>
 * {@code extraction} is set only for COMPLETED, MANUAL_REVIEW and CONFIRMED;
 * {@code errorMessage} only for ERROR.
 */
public record ParseResult(
        String documentId,
        ProcessingStatus status,
        String text,
        DocumentType documentType,
        Map<String, Object> metadata,
        ExtractionResult extraction,
        ValidationResult validation,
        String errorMessage,
        long processingTimeMs
) {
    public ParseResult {
        metadata = metadata == null
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(metadata));
        if (status.carriesExtraction() && extraction == null) {
            throw new IllegalArgumentException("status " + status + " requires an extraction result");
        }
        if (!status.carriesExtraction()) {
            extraction = null;
        }
        if (status != ProcessingStatus.ERROR) {
            errorMessage = null;
        }
    }

    public boolean requiresReview() {
        return status == ProcessingStatus.MANUAL_REVIEW;
    }
}
