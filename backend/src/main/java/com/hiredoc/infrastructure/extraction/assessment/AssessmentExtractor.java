package com.hiredoc.infrastructure.extraction.assessment;

import com.hiredoc.domain.document.model.AssessmentData;
import com.hiredoc.domain.document.model.AssessmentDimension;
import com.hiredoc.domain.document.model.DimensionCategory;
import com.hiredoc.domain.document.model.DocumentType;
import com.hiredoc.domain.document.model.RejectedDimension;
import com.hiredoc.domain.document.service.DocumentExtractor;
import com.hiredoc.infrastructure.extraction.EmptyInputException;
import com.hiredoc.infrastructure.extraction.ExtractionSettings;
import com.hiredoc.infrastructure.extraction.preprocessing.EntityCleaner;
import com.hiredoc.infrastructure.extraction.preprocessing.TextNormalizer;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Extracts an {@link AssessmentData} record from a psychometric test report.
 * <p>
 * Scores are read line by line from "Label: 72.5", "Label ..... 72", "Label 72%" and
 * "| Label | 72 |" layouts. Labels are translated to canonical dimension names. Validity
 * scales (sincerity, consistency) go to {@code sincerityScore}, never to the dimension list.
 * Values outside [0, 100] are kept apart as rejected scores.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class AssessmentExtractor implements DocumentExtractor<AssessmentData> {

    private static final int CASE_FLAGS = Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE;

    private static final String LABEL = "(?<label>\\p{L}[\\p{L}\\p{M}'’/&()\\- ]{1,60}?)";

    private static final String VALUE = "(?<value>-?\\d{1,3}(?:[.,]\\d+)?)";

    // Value must not be the start of a date or a longer number; "/100" is allowed
    private static final String VALUE_END = "(?:\\s*%|\\s*/\\s*100(?!\\d))?(?![\\d]|[.,]\\d|\\s*[/-]\\s*\\d)";

    // 1. "Egocentrismo: 72.5", "Narcisismo = 40", "Apertura ...... 65", "Dominancia… 30"
    private static final Pattern LABEL_SEPARATOR_VALUE = Pattern.compile(
            "(?<![\\p{L}\\d])" + LABEL + "\\s*(?::|=|\\.{2,}|…+)\\s*" + VALUE + VALUE_END);

    // 2. "Egocentrismo 72%"
    private static final Pattern LABEL_PERCENT = Pattern.compile(
            "(?<![\\p{L}\\d])" + LABEL + "\\s+" + VALUE + "\\s*%");

    // 3. A whole line "Egocentrismo 72" or "Egocentrismo 72/100"
    private static final Pattern LABEL_SPACE_VALUE_LINE = Pattern.compile(
            "^" + LABEL + "\\s+" + VALUE + "(?:\\s*/\\s*100)?$");

    private static final Pattern TABLE_NUMBER = Pattern.compile("^" + VALUE + "\\s*(?:%|/\\s*100)?$");

    private static final Pattern HAS_LETTER = Pattern.compile("\\p{L}");

    private static final Pattern SINCERITY_FALLBACK = Pattern.compile(
            "(?:sinceridad|sincerity|consistencia|consistency|validez|validity|validaci[oó]n|validation)"
                    + "\\s*(?:\\([^)]*\\))?\\s*[:\\-=]?\\s*(-?\\d{1,3}(?:[.,]\\d+)?)(?!\\d|[.,]\\d|\\s*[/-]\\s*\\d)",
            CASE_FLAGS
    );

    private static final Pattern CANDIDATE_NAME = Pattern.compile(
            "(?:candidat[oa]|candidate|persona evaluada|evaluad[oa]|nombre(?:\\s+completo)?|full name|name)"
                    + "\\s*:\\s*([^\\n|,;]{2,60})",
            CASE_FLAGS
    );

    private static final String DATE_VALUE = "(\\d{1,2}[/.-]\\d{1,2}[/.-]\\d{2,4}|\\d{4}-\\d{1,2}-\\d{1,2}"
            + "|\\d{1,2}\\s+de\\s+\\p{L}+\\s+(?:de|del)\\s+\\d{4}|\\p{L}+\\s+\\d{1,2},?\\s+\\d{4}|\\p{L}+\\s+(?:de\\s+)?\\d{4})";

    private static final Pattern TEST_DATE = Pattern.compile(
            "(?:fecha(?:\\s+de)?(?:\\s+(?:aplicaci[oó]n|la\\s+prueba|prueba|evaluaci[oó]n|test|assessment))?"
                    + "|test\\s+date|date(?:\\s+of\\s+(?:test|assessment))?)\\s*:\\s*" + DATE_VALUE,
            CASE_FLAGS
    );

    private static final Pattern REPORT_TITLE = Pattern.compile(
            "^(?:resultados?|reporte|informe|report|results?)\\s+(?:de(?:l)?\\s+|of\\s+)?(?:la\\s+|the\\s+)?"
                    + "(?:prueba\\s+|test\\s+|evaluaci[oó]n\\s+)?[:\\-]?\\s*(\\p{L}[^\\n]{2,50})$",
            CASE_FLAGS
    );

    static final double HIGH_SCORE = 70.0;
    static final double LOW_SCORE = 30.0;

    private final TextNormalizer textNormalizer;
    private final EntityCleaner entityCleaner;
    private final ExtractionSettings settings;

    @Override
    public DocumentType supportedType() {
        return DocumentType.ASSESSMENT;
    }

    @Override
    public AssessmentData extract(String text) {
        EmptyInputException.requireText(text, DocumentType.ASSESSMENT);
        String normalized = textNormalizer.normalize(text);
        EmptyInputException.requireText(normalized, DocumentType.ASSESSMENT);

        String testName = detectTestName(normalized);
        ScoreScan scan = scanScores(normalized);
        Double sincerity = scan.sincerity != null ? scan.sincerity : fallbackSincerity(normalized);
        String testType = classifyTestType(testName, scan.dimensions);

        log.debug("[AssessmentExtractor] test={}, dimensions={}, rejected={}, sincerity={}",
                testName, scan.dimensions.size(), scan.rejected.size(), sincerity != null);

        return new AssessmentData(
                testName,
                testType,
                findCandidateName(normalized),
                findTestDate(normalized),
                scan.dimensions,
                scan.rejected,
                sincerity,
                interpret(scan.dimensions),
                settings.truncateRaw(normalized)
        );
    }

    // ===== Test identity =====

    String detectTestName(String text) {
        Optional<String> family = AssessmentDictionary.testFamily(TextNormalizer.fold(text));
        if (family.isPresent()) {
            return family.get();
        }
        for (String line : TextNormalizer.lines(text)) {
            Matcher m = REPORT_TITLE.matcher(line.strip());
            if (m.matches()) {
                return textNormalizer.collapse(m.group(1));
            }
        }
        return AssessmentDictionary.UNKNOWN_TEST;
    }

    /**
     * Test type from the test name, falling back to the dominant dimension category.
     */
    String classifyTestType(String testName, List<AssessmentDimension> dimensions) {
        String name = TextNormalizer.fold(testName);
        if (containsAny(name, "dark", "oscur", "moral", "narcis", "sicopat", "psicopat", "triad")) {
            return "personality_dark";
        }
        if (containsAny(name, "disc", "comportamiento", "behavioral")) {
            return "behavioral";
        }
        if (containsAny(name, "big five", "cinco grandes", "ocean")) {
            return "personality_big5";
        }
        if (containsAny(name, "inteligencia", "intelligence", "cognitiv")) {
            return "cognitive";
        }
        if (containsAny(name, "competencia", "competency", "skill")) {
            return "competency";
        }
        if (AssessmentDictionary.UNKNOWN_TEST.equals(testName) && !dimensions.isEmpty()) {
            return switch (dominantCategory(dimensions)) {
                case DARK_FACTOR -> "personality_dark";
                case DISC -> "behavioral";
                case BIG5 -> "personality_big5";
                case COGNITIVE -> "cognitive";
                case OTHER -> "personality";
            };
        }
        return "personality";
    }

    private static DimensionCategory dominantCategory(List<AssessmentDimension> dimensions) {
        Map<DimensionCategory, Integer> counts = new EnumMap<>(DimensionCategory.class);
        dimensions.forEach(d -> counts.merge(d.category(), 1, Integer::sum));
        return counts.entrySet().stream()
                .max(Map.Entry.comparingByValue())
                .map(Map.Entry::getKey)
                .orElse(DimensionCategory.OTHER);
    }

    private static boolean containsAny(String text, String... fragments) {
        for (String fragment : fragments) {
            if (text.contains(fragment)) {
                return true;
            }
        }
        return false;
    }

    // ===== Scores =====

    private static final class ScoreScan {
        private final List<AssessmentDimension> dimensions = new ArrayList<>();
        private final List<RejectedDimension> rejected = new ArrayList<>();
        private final Set<String> seen = new HashSet<>();
        private Double sincerity;
    }

    private ScoreScan scanScores(String text) {
        ScoreScan scan = new ScoreScan();
        for (String rawLine : TextNormalizer.lines(text)) {
            String line = rawLine.strip();
            if (line.isEmpty()) {
                continue;
            }
            if (line.contains("|")) {
                scanTableRow(line, scan);
                continue;
            }
            boolean found = false;
            Matcher m = LABEL_SEPARATOR_VALUE.matcher(line);
            while (m.find()) {
                found |= accept(m.group("label"), m.group("value"), scan);
            }
            if (!found) {
                m = LABEL_PERCENT.matcher(line);
                while (m.find()) {
                    found |= accept(m.group("label"), m.group("value"), scan);
                }
            }
            if (!found) {
                m = LABEL_SPACE_VALUE_LINE.matcher(line);
                if (m.matches()) {
                    accept(m.group("label"), m.group("value"), scan);
                }
            }
        }
        return scan;
    }

    private void scanTableRow(String line, ScoreScan scan) {
        String label = null;
        String value = null;
        for (String cell : line.split("\\|")) {
            String c = cell.strip();
            if (c.isEmpty()) {
                continue;
            }
            Matcher number = TABLE_NUMBER.matcher(c);
            if (number.matches()) {
                if (value == null) {
                    value = number.group("value");
                }
            } else if (label == null && HAS_LETTER.matcher(c).find()) {
                label = c;
            }
        }
        if (label != null && value != null) {
            accept(label, value, scan);
        }
    }

    /**
     * @return true when the pair was recognized as a score or a sincerity value
     */
    private boolean accept(String rawLabel, String rawValue, ScoreScan scan) {
        String label = textNormalizer.collapse(rawLabel).replaceAll("[\\s:.\\-–]+$", "");
        String folded = TextNormalizer.fold(label).replaceAll("[^\\p{L}\\p{N}\\s-]", " ").replaceAll("\\s+", " ").strip();
        if (folded.isEmpty()) {
            return false;
        }
        double value;
        try {
            value = Double.parseDouble(rawValue.replace(',', '.'));
        } catch (NumberFormatException e) {
            return false;
        }

        if (AssessmentDictionary.isSincerityLabel(folded)) {
            if (scan.sincerity == null) {
                scan.sincerity = clampSincerity(value);
            }
            return true;
        }
        if (AssessmentDictionary.isNonScoreLabel(folded)) {
            return false;
        }

        String name = AssessmentDictionary.canonicalDimension(folded).orElse(label);
        if (!scan.seen.add(name.toLowerCase(Locale.ROOT))) {
            log.debug("[AssessmentExtractor] Duplicate dimension ignored: {}", name);
            return true;
        }
        if (!AssessmentDimension.inRange(value)) {
            log.warn("[AssessmentExtractor] Dimension {} out of range: {}", name, value);
            scan.rejected.add(new RejectedDimension(name, value, label));
            return true;
        }
        scan.dimensions.add(new AssessmentDimension(name, value, label, AssessmentDictionary.categoryOf(name)));
        return true;
    }

    private Double fallbackSincerity(String text) {
        Matcher m = SINCERITY_FALLBACK.matcher(text);
        if (m.find()) {
            try {
                return clampSincerity(Double.parseDouble(m.group(1).replace(',', '.')));
            } catch (NumberFormatException e) {
                return null;
            }
        }
        return null;
    }

    private static double clampSincerity(double value) {
        if (AssessmentDimension.inRange(value)) {
            return value;
        }
        log.warn("[AssessmentExtractor] Sincerity {} clamped to [0, 100]", value);
        return Math.max(AssessmentDimension.MIN_VALUE, Math.min(AssessmentDimension.MAX_VALUE, value));
    }

    // ===== Header fields =====

    private String findCandidateName(String text) {
        Matcher m = CANDIDATE_NAME.matcher(text);
        while (m.find()) {
            String value = m.group(1).strip();
            if (value.chars().anyMatch(Character::isDigit)) {
                continue;
            }
            String name = entityCleaner.cleanPersonName(value);
            if (name != null && name.length() > 3) {
                return name;
            }
        }
        return null;
    }

    private String findTestDate(String text) {
        Matcher m = TEST_DATE.matcher(text);
        return m.find() ? m.group(1).strip() : null;
    }

    /**
     * Short reading of the profile: dimensions at or above 70 are high, at or below 30 low.
     */
    String interpret(List<AssessmentDimension> dimensions) {
        if (dimensions.isEmpty()) {
            return "No scores available to interpret.";
        }
        List<String> high = dimensions.stream().filter(d -> d.value() >= HIGH_SCORE).map(AssessmentDimension::name).toList();
        List<String> low = dimensions.stream().filter(d -> d.value() <= LOW_SCORE).map(AssessmentDimension::name).toList();

        List<String> parts = new ArrayList<>();
        if (!high.isEmpty()) {
            parts.add("High scores in: " + String.join(", ", high) + ".");
        }
        if (!low.isEmpty()) {
            parts.add("Low scores in: " + String.join(", ", low) + ".");
        }
        if (parts.isEmpty()) {
            parts.add("All dimensions within mid ranges.");
        }
        return String.join(" ", parts);
    }
}
