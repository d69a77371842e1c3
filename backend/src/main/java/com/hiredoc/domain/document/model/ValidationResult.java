package com.hiredoc.domain.document.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Result of validating one extracted record.
 *
 * @param errors         ERROR-level issues
 * @param warnings       WARNING-level issues, never affect validity
 * @param normalizedData canonical values, filled regardless of validity
 */
public record ValidationResult(
        List<ValidationIssue> errors,
        List<ValidationIssue> warnings,
        Map<String, Object> normalizedData
) {
    public ValidationResult {
        errors = errors == null ? List.of() : List.copyOf(errors);
        warnings = warnings == null ? List.of() : List.copyOf(warnings);
        normalizedData = normalizedData == null
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(normalizedData));
    }

    public boolean isValid() {
        return errors.isEmpty();
    }
}
