package com.hiredoc.infrastructure.extraction.preprocessing;

import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Cleans entity names found by the extractors: person names, company and institution
 * names, skills and academic degrees.
 */
@Component
public class EntityCleaner {

    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    // Honorifics: Sr., Sra., Dr., Ing., Lic., Mr., Mrs., Ms., Prof., PhD
    private static final Pattern HONORIFIC = Pattern.compile(
            "^(?:sra?|dra?|prof|ing|lic|m\\.?sc|ph\\.?d|mrs?|ms|miss)\\.?\\s+",
            Pattern.CASE_INSENSITIVE
    );

    private static final Pattern NAME_INVALID_CHARS = Pattern.compile("[^\\p{L}\\p{M}\\s\\-'.]");

    private static final Set<String> NAME_PARTICLES = Set.of(
            "de", "del", "la", "las", "los", "y", "e", "von", "van", "der", "den", "di", "da"
    );

    // S.A., S.A.S., S.A.B., S.L., Ltd., LLC, Inc., Corp., GmbH, B.V.
    private static final Pattern COMPANY_SUFFIX = Pattern.compile(
            "(?:\\s*,\\s*|\\s+)(?:S\\.?A\\.?(?:S\\.?|B\\.?)?(?:\\s+de\\s+C\\.?V\\.?)?|S\\.?L\\.?L?\\.?|LTDA?\\.?|LIMITED"
                    + "|LLC|INC\\.?|CORP\\.?|GMBH|B\\.?V\\.?)\\s*$",
            Pattern.CASE_INSENSITIVE
    );

    private static final Map<String, String> SKILL_ALIASES = Map.ofEntries(
            Map.entry("js", "JavaScript"),
            Map.entry("ts", "TypeScript"),
            Map.entry("py", "Python"),
            Map.entry("reactjs", "React"),
            Map.entry("react.js", "React"),
            Map.entry("node", "Node.js"),
            Map.entry("nodejs", "Node.js"),
            Map.entry("postgres", "PostgreSQL"),
            Map.entry("mongo", "MongoDB"),
            Map.entry("amazon web services", "AWS"),
            Map.entry("google cloud", "GCP"),
            Map.entry("google cloud platform", "GCP"),
            Map.entry("k8s", "Kubernetes"),
            Map.entry("golang", "Go")
    );

    // First match wins, so more specific degrees come first
    private static final List<Map.Entry<Pattern, String>> DEGREES = degreeTable(
            List.of(
                    Map.entry("licenciatura", "Bachelor's Degree"),
                    Map.entry("licenciado", "Bachelor's Degree"),
                    Map.entry("pregrado", "Bachelor's Degree"),
                    Map.entry("bachiller", "Bachelor"),
                    Map.entry("mba", "MBA"),
                    Map.entry("maestria", "Master's Degree"),
                    Map.entry("master", "Master's Degree"),
                    Map.entry("doctorado", "PhD"),
                    Map.entry("phd", "PhD"),
                    Map.entry("ph.d", "PhD"),
                    Map.entry("ingenieria", "Engineering"),
                    Map.entry("tecnologia", "Technology"),
                    Map.entry("tsu", "Associate Degree"),
                    Map.entry("tecnico", "Technical Degree")
            )
    );

    private static List<Map.Entry<Pattern, String>> degreeTable(List<Map.Entry<String, String>> entries) {
        return entries.stream()
                .map(e -> Map.entry(
                        Pattern.compile("(?<!\\p{L})" + Pattern.quote(e.getKey()) + "(?!\\p{L})"),
                        e.getValue()))
                .toList();
    }

    /**
     * Drop honorifics and stray symbols, then title-case every word except inner
     * particles: "DR. JUAN DE LA CRUZ" becomes "Juan de la Cruz".
     */
    public String cleanPersonName(String name) {
        if (name == null || name.isBlank()) {
            return null;
        }
        String cleaned = WHITESPACE.matcher(name).replaceAll(" ").strip();
        String previous;
        do {
            previous = cleaned;
            cleaned = HONORIFIC.matcher(cleaned).replaceFirst("");
        } while (!cleaned.equals(previous));
        cleaned = NAME_INVALID_CHARS.matcher(cleaned).replaceAll("");
        cleaned = WHITESPACE.matcher(cleaned).replaceAll(" ").strip();
        if (cleaned.isEmpty()) {
            return null;
        }

        String[] parts = cleaned.split(" ");
        List<String> result = new ArrayList<>(parts.length);
        for (int i = 0; i < parts.length; i++) {
            String lower = parts[i].toLowerCase(Locale.ROOT);
            if (i > 0 && NAME_PARTICLES.contains(lower)) {
                result.add(lower);
            } else {
                result.add(capitalize(lower));
            }
        }
        return String.join(" ", result);
    }

    /**
     * Remove trailing legal-form suffixes: "TechCorp S.A." becomes "TechCorp".
     */
    public String cleanCompanyName(String name) {
        if (name == null || name.isBlank()) {
            return null;
        }
        String cleaned = WHITESPACE.matcher(name).replaceAll(" ").strip();
        String stripped = COMPANY_SUFFIX.matcher(cleaned).replaceAll("").strip();
        return stripped.isEmpty() ? cleaned : stripped;
    }

    /**
     * Map well-known aliases to their canonical spelling. Anything that is not an alias,
     * including case variants of canonical names, is returned trimmed and otherwise untouched.
     */
    public String canonicalSkill(String skill) {
        if (skill == null) {
            return null;
        }
        String trimmed = WHITESPACE.matcher(skill).replaceAll(" ").strip();
        String alias = SKILL_ALIASES.get(trimmed.toLowerCase(Locale.ROOT));
        return alias != null ? alias : trimmed;
    }

    /**
     * Standardize common Spanish/English degree names; unknown degrees are kept as written.
     */
    public String standardizeDegree(String degree) {
        if (degree == null || degree.isBlank()) {
            return null;
        }
        String cleaned = WHITESPACE.matcher(degree).replaceAll(" ").strip();
        String folded = TextNormalizer.fold(cleaned);
        for (Map.Entry<Pattern, String> entry : DEGREES) {
            if (entry.getKey().matcher(folded).find()) {
                return entry.getValue();
            }
        }
        return cleaned;
    }

    private static String capitalize(String word) {
        if (word.isEmpty()) {
            return word;
        }
        int first = word.codePointAt(0);
        return new String(Character.toChars(Character.toTitleCase(first))) + word.substring(Character.charCount(first));
    }
}
