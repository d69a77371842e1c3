package com.hiredoc.infrastructure.extraction.validation;

import com.hiredoc.domain.document.model.AssessmentData;
import com.hiredoc.domain.document.model.AssessmentDimension;
import com.hiredoc.domain.document.model.DocumentType;
import com.hiredoc.domain.document.model.ValidationIssue;
import com.hiredoc.domain.document.model.ValidationResult;
import com.hiredoc.infrastructure.extraction.preprocessing.FieldNormalizer;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Rule-based validator for extracted (or reviewer-confirmed) records.
 * <p>
 * Works on the snake_case field map of a record, so the same rules apply to extractor output
 * and to data edited by a reviewer. Range and required-field violations are errors; contact
 * and date problems are warnings. {@code normalizedData} is always filled with the canonical
 * values, whatever the outcome.
 * <p>
 * Rules per type:
 * <ul>
 *   <li>CV: full_name required; email/phone format and plausibility (warnings); dates to ISO-8601; lists de-duplicated</li>
 *   <li>Assessment: test_name required; every score within [0, 100]; at least one valid score; sincerity within range (warning)</li>
 *   <li>Interview: date to ISO-8601; missing interviewer or summary (warnings)</li>
 *   <li>Cover letter / other: non-empty raw_text</li>
 * </ul>
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ExtractionValidator {

    private static final int MIN_PHONE_DIGITS = 7;
    private static final int MAX_PHONE_DIGITS = 15;

    private static final List<String> LIST_FIELDS = List.of("skills", "languages", "certifications");

    private final FieldNormalizer fieldNormalizer;
    private final Clock clock;

    /**
     * Validate one record.
     *
     * @param type the document type the record was extracted as
     * @param data snake_case field map; null is treated as empty
     */
    public ValidationResult validate(DocumentType type, Map<String, Object> data) {
        Issues issues = new Issues();
        Map<String, Object> normalized = new LinkedHashMap<>(data != null ? data : Map.of());

        switch (type) {
            case CV -> validateCv(normalized, issues);
            case ASSESSMENT -> validateAssessment(normalized, issues);
            case INTERVIEW -> validateInterview(normalized, issues);
            case COVER_LETTER, OTHER -> validateGeneric(normalized, issues);
        }

        if (!issues.errors.isEmpty()) {
            log.warn("[ExtractionValidator] {} record has {} error(s): {}", type.value(), issues.errors.size(),
                    issues.errors.stream().map(ValidationIssue::field).toList());
        }
        if (!issues.warnings.isEmpty()) {
            log.debug("[ExtractionValidator] {} record warnings: {}", type.value(),
                    issues.warnings.stream().map(ValidationIssue::field).toList());
        }
        return new ValidationResult(issues.errors, issues.warnings, normalized);
    }

    // ===== CV =====

    private void validateCv(Map<String, Object> data, Issues issues) {
        String fullName = text(data.get("full_name"));
        if (fullName == null) {
            issues.error("full_name", "Full name is required");
        } else {
            data.put("full_name", fullName);
        }

        validateEmail(data, issues);
        validatePhone(data, issues);

        String linkedin = text(data.get("linkedin"));
        if (linkedin != null) {
            data.put("linkedin", fieldNormalizer.normalizeUrl(linkedin));
        }

        data.put("experience", validateEntries(data.get("experience"), "experience", issues));
        data.put("education", validateEntries(data.get("education"), "education", issues));

        for (String field : LIST_FIELDS) {
            data.put(field, normalizeList(data.get(field)));
        }
    }

    private void validateEmail(Map<String, Object> data, Issues issues) {
        String raw = text(data.get("email"));
        if (raw == null) {
            issues.warning("email", "Email is missing");
            return;
        }
        String email = fieldNormalizer.normalizeEmail(raw);
        if (email == null || !fieldNormalizer.isWellFormedEmail(email)) {
            issues.warning("email", "Email '" + raw + "' is malformed");
            return;
        }
        data.put("email", email);
    }

    private void validatePhone(Map<String, Object> data, Issues issues) {
        String raw = text(data.get("phone"));
        if (raw == null) {
            issues.warning("phone", "Phone is missing");
            return;
        }
        String phone = fieldNormalizer.normalizePhone(raw);
        if (phone == null) {
            issues.warning("phone", "Phone '" + raw + "' is malformed");
            return;
        }
        int digits = fieldNormalizer.phoneDigitCount(phone);
        if (digits < MIN_PHONE_DIGITS || digits > MAX_PHONE_DIGITS) {
            issues.warning("phone", "Phone '" + raw + "' has an implausible number of digits (" + digits + ")");
        }
        data.put("phone", phone);
    }

    /**
     * Copy experience/education entries with their dates turned into ISO-8601.
     */
    private List<Map<String, Object>> validateEntries(Object value, String field, Issues issues) {
        List<Map<String, Object>> entries = new ArrayList<>();
        if (!(value instanceof Collection<?> items)) {
            return entries;
        }
        int index = 0;
        for (Object item : items) {
            if (!(item instanceof Map<?, ?> map)) {
                issues.warning(field + "[" + index + "]", "Entry " + index + " of " + field + " is not a record");
                index++;
                continue;
            }
            Map<String, Object> entry = copy(map);
            String path = field + "[" + index + "]";
            boolean current = Boolean.TRUE.equals(entry.get("is_current"));

            LocalDate start = normalizeDateField(entry, "start_date", path, issues);
            if (current && text(entry.get("end_date")) != null) {
                issues.warning(path + ".end_date", "Current " + field + " entry " + index + " has an end date; it was dropped");
                entry.put("end_date", null);
            }
            LocalDate end = normalizeDateField(entry, "end_date", path, issues);
            if (start != null && end != null && start.isAfter(end)) {
                issues.warning(path + ".start_date", "Entry " + index + " of " + field + " starts after it ends");
            }
            entries.add(entry);
            index++;
        }
        return entries;
    }

    // ===== Assessment =====

    private void validateAssessment(Map<String, Object> data, Issues issues) {
        String testName = text(data.get("test_name"));
        if (testName == null) {
            issues.error("test_name", "Test name is required");
        } else if (AssessmentData.UNKNOWN_TEST_NAME.equals(testName)) {
            issues.warning("test_name", "Test name could not be identified");
        }

        List<Map<String, Object>> validScores = new ArrayList<>();
        if (data.get("scores") instanceof Collection<?> scores) {
            int index = 0;
            for (Object item : scores) {
                Map<String, Object> score = item instanceof Map<?, ?> map ? copy(map) : Map.of();
                String name = text(score.get("name"));
                String field = name != null ? "scores." + name : "scores[" + index + "]";
                Double value = number(score.get("value"));
                if (name == null) {
                    issues.error(field, "Dimension " + index + " has no name");
                } else if (value == null) {
                    issues.error(field, "Score of " + name + " is not a number");
                } else if (!AssessmentDimension.inRange(value)) {
                    issues.error(field, outOfRange(name, value));
                } else {
                    score.put("value", value);
                    validScores.add(score);
                }
                index++;
            }
        }

        if (data.get("rejected_scores") instanceof Collection<?> rejected) {
            for (Object item : rejected) {
                if (item instanceof Map<?, ?> map) {
                    String name = text(map.get("name"));
                    Double raw = number(map.get("raw_value"));
                    issues.error("scores." + (name != null ? name : "unknown"),
                            outOfRange(name != null ? name : "Unnamed dimension", raw));
                }
            }
        }

        if (validScores.isEmpty()) {
            issues.error("scores", "At least one valid dimension score is required");
        }
        data.put("scores", validScores);

        Object sincerityRaw = data.get("sincerity_score");
        if (sincerityRaw != null) {
            Double sincerity = number(sincerityRaw);
            if (sincerity == null || !AssessmentDimension.inRange(sincerity)) {
                issues.warning("sincerity_score", "Sincerity score " + sincerityRaw + " is outside [0, 100]");
                data.put("sincerity_score", null);
            } else {
                data.put("sincerity_score", sincerity);
            }
        }

        normalizeDateField(data, "test_date", null, issues);
    }

    private static String outOfRange(String name, Double value) {
        return name + " score " + value + " is outside [0, 100]";
    }

    // ===== Interview =====

    private void validateInterview(Map<String, Object> data, Issues issues) {
        if (text(data.get("interviewer")) == null) {
            issues.warning("interviewer", "Interviewer is missing");
        }
        if (text(data.get("summary")) == null) {
            issues.warning("summary", "Interview summary is empty");
        }
        normalizeDateField(data, "date", null, issues);
        // Findings are whole sentences, so they are de-duplicated but never split
        for (String field : List.of("flags", "strengths", "concerns")) {
            data.put(field, normalizeSentences(data.get(field)));
        }
    }

    // ===== Cover letter / other =====

    private void validateGeneric(Map<String, Object> data, Issues issues) {
        if (text(data.get("raw_text")) == null) {
            issues.error("raw_text", "Document text is empty");
        }
    }

    // ===== Helpers =====

    /**
     * Replace a date field with its ISO-8601 form; unparseable values stay as written.
     *
     * @return the parsed date, or null
     */
    private LocalDate normalizeDateField(Map<String, Object> data, String key, String parent, Issues issues) {
        String raw = text(data.get(key));
        if (raw == null) {
            return null;
        }
        LocalDate date = fieldNormalizer.normalizeDate(raw, clock);
        String path = parent != null ? parent + "." + key : key;
        if (date == null) {
            issues.warning(path, "Unrecognized date '" + raw + "' in " + path);
            log.warn("[ExtractionValidator] Unparseable date in {}", path);
            return null;
        }
        data.put(key, date.toString());
        return date;
    }

    private List<String> normalizeList(Object value) {
        if (value == null) {
            return List.of();
        }
        if (value instanceof Collection<?> items) {
            List<String> parts = new ArrayList<>();
            for (Object item : items) {
                if (item != null) {
                    parts.addAll(fieldNormalizer.splitDelimitedList(item.toString()));
                }
            }
            return fieldNormalizer.dedupeIgnoreCase(parts);
        }
        return fieldNormalizer.splitDelimitedList(value.toString());
    }

    private List<String> normalizeSentences(Object value) {
        if (value instanceof Collection<?> items) {
            return fieldNormalizer.dedupeIgnoreCase(items.stream()
                    .filter(Objects::nonNull)
                    .map(Object::toString)
                    .toList());
        }
        String single = text(value);
        return single != null ? List.of(single) : List.of();
    }

    private static String text(Object value) {
        if (value == null) {
            return null;
        }
        String s = value.toString().strip();
        return s.isEmpty() ? null : s;
    }

    private static Double number(Object value) {
        if (value instanceof Number n) {
            return n.doubleValue();
        }
        String s = text(value);
        if (s == null) {
            return null;
        }
        try {
            return Double.valueOf(s.replace(',', '.'));
        } catch (NumberFormatException e) {
            return null;
        }
    }

    private static Map<String, Object> copy(Map<?, ?> map) {
        Map<String, Object> copy = new LinkedHashMap<>();
        map.forEach((k, v) -> copy.put(String.valueOf(k), v));
        return copy;
    }

    private static final class Issues {
        private final List<ValidationIssue> errors = new ArrayList<>();
        private final List<ValidationIssue> warnings = new ArrayList<>();

        void error(String field, String message) {
            errors.add(ValidationIssue.error(field, message));
        }

        void warning(String field, String message) {
            warnings.add(ValidationIssue.warning(field, message));
        }
    }
}
