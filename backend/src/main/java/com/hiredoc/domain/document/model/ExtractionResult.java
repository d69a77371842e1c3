package com.hiredoc.domain.document.model;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Output of the extraction stage.
 *
 * @param documentType     type the extractor was selected for
 * @param confidence       completeness estimate in [0, 1], derived by the pipeline
 * @param data             the typed record flattened to snake_case field names
 * @param extractedAt      extraction timestamp
 * @param extractorVersion version of the extraction rules
 * @param warnings         ordered, human-readable extraction warnings
 */
public record ExtractionResult(
        DocumentType documentType,
        double confidence,
        Map<String, Object> data,
        Instant extractedAt,
        String extractorVersion,
        List<String> warnings
) {
    public ExtractionResult {
        if (Double.isNaN(confidence) || confidence < 0.0 || confidence > 1.0) {
            throw new IllegalArgumentException("confidence must be within [0, 1]: " + confidence);
        }
        data = data == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(data));
        warnings = warnings == null ? List.of() : List.copyOf(warnings);
    }
}
