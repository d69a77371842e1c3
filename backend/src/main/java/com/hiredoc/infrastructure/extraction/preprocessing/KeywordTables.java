package com.hiredoc.infrastructure.extraction.preprocessing;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.hiredoc.domain.document.model.DocumentType;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Bilingual keyword dictionaries bundled under {@code dictionaries/}. Loaded once when the
 * class initializes; every returned map and list is unmodifiable. Keys are stored folded
 * (see {@link TextNormalizer#fold}) so lookups are accent- and case-insensitive.
 */
public final class KeywordTables {

    static final String SECTION_HEADERS_RESOURCE = "dictionaries/cv-section-headers.json";
    static final String DOCUMENT_SIGNALS_RESOURCE = "dictionaries/document-signals.json";

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private static final Map<String, List<String>> SECTION_HEADERS = loadSectionHeaders();
    private static final Map<DocumentType, Map<String, Integer>> DOCUMENT_SIGNALS = loadDocumentSignals();

    private KeywordTables() {
    }

    /**
     * CV section name (summary, experience, education, skills, languages, certifications)
     * to the header phrases that open it, in file order.
     */
    public static Map<String, List<String>> sectionHeaders() {
        return SECTION_HEADERS;
    }

    /**
     * Weighted signal phrases per classifiable document type.
     */
    public static Map<DocumentType, Map<String, Integer>> documentSignals() {
        return DOCUMENT_SIGNALS;
    }

    private static Map<String, List<String>> loadSectionHeaders() {
        Map<String, List<String>> raw = read(SECTION_HEADERS_RESOURCE, new TypeReference<>() {
        });
        Map<String, List<String>> result = new LinkedHashMap<>();
        raw.forEach((section, phrases) -> result.put(
                section,
                phrases.stream().map(TextNormalizer::fold).map(String::strip).distinct().toList()));
        return Collections.unmodifiableMap(result);
    }

    private static Map<DocumentType, Map<String, Integer>> loadDocumentSignals() {
        Map<String, Map<String, Integer>> raw = read(DOCUMENT_SIGNALS_RESOURCE, new TypeReference<>() {
        });
        Map<DocumentType, Map<String, Integer>> result = new EnumMap<>(DocumentType.class);
        raw.forEach((typeName, signals) -> {
            DocumentType type = DocumentType.valueOf(typeName);
            Map<String, Integer> folded = new LinkedHashMap<>();
            signals.forEach((phrase, weight) -> {
                if (weight == null || weight <= 0) {
                    throw new IllegalStateException(
                            "Signal weight must be positive: " + typeName + "/" + phrase);
                }
                folded.put(TextNormalizer.fold(phrase).strip(), weight);
            });
            result.put(type, Collections.unmodifiableMap(folded));
        });
        return Collections.unmodifiableMap(result);
    }

    private static <T> T read(String resource, TypeReference<T> type) {
        ClassLoader loader = KeywordTables.class.getClassLoader();
        try (InputStream in = loader.getResourceAsStream(resource)) {
            if (in == null) {
                throw new IllegalStateException("Missing keyword dictionary on classpath: " + resource);
            }
            return MAPPER.readValue(in, type);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read keyword dictionary " + resource, e);
        }
    }
}
