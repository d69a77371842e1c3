package com.hiredoc.infrastructure.extraction.cv;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * A CV split into its leading contact block and the bodies of the recognized sections.
 *
 * @param contactLines non-blank lines before the first section header (capped)
 * @param sections     section name to body lines, in document order; a repeated header
 *                     appends to the existing body
 */
record CvSections(List<String> contactLines, Map<String, List<String>> sections) {

    static final String SUMMARY = "summary";
    static final String EXPERIENCE = "experience";
    static final String EDUCATION = "education";
    static final String SKILLS = "skills";
    static final String LANGUAGES = "languages";
    static final String CERTIFICATIONS = "certifications";

    CvSections {
        contactLines = List.copyOf(contactLines);
        sections = Collections.unmodifiableMap(new LinkedHashMap<>(sections));
    }

    List<String> body(String section) {
        return sections.getOrDefault(section, List.of());
    }

    boolean has(String section) {
        return body(section).stream().anyMatch(line -> !line.isBlank());
    }
}
