package com.hiredoc.infrastructure.extraction.cv;

import com.hiredoc.infrastructure.extraction.preprocessing.KeywordTables;
import com.hiredoc.infrastructure.extraction.preprocessing.TextNormalizer;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Splits normalized CV text into sections using the bilingual header table in
 * {@code dictionaries/cv-section-headers.json}.
 * <p>
 * A line is a header when, folded and stripped of bullets and a trailing colon, it equals a
 * header phrase. "Skills: Java, SQL" also counts: the phrase before the colon opens the
 * section and the rest of the line becomes its first body line, except inside experience and
 * education entries where such lines are entry details.
 */
@Component
public class CvSectionSegmenter {

    private static final int MAX_HEADER_LENGTH = 50;

    // Leading bullets, numbering and markdown markers
    private static final Pattern HEADER_DECORATION = Pattern.compile("^[\\s#*\\-•·>\\d.)]+|[\\s:*\\-•·=_]+$");

    private final List<Map.Entry<String, String>> phraseToSection;

    public CvSectionSegmenter() {
        this(KeywordTables.sectionHeaders());
    }

    CvSectionSegmenter(Map<String, List<String>> headers) {
        List<Map.Entry<String, String>> entries = new ArrayList<>();
        headers.forEach((section, phrases) -> phrases.forEach(p -> entries.add(Map.entry(p, section))));
        // Longest phrase first so "experiencia laboral" wins over "experiencia"
        entries.sort(Comparator.comparingInt((Map.Entry<String, String> e) -> e.getKey().length()).reversed());
        this.phraseToSection = List.copyOf(entries);
    }

    public CvSections segment(String text, int contactBlockLines) {
        List<String> contact = new ArrayList<>();
        Map<String, List<String>> sections = new LinkedHashMap<>();
        List<String> current = null;
        String currentName = null;

        for (String line : TextNormalizer.lines(text)) {
            Optional<Header> header = header(line);
            // "Technologies: Docker, Kafka" inside a job entry belongs to that entry
            if (header.isPresent() && !header.get().inlineContent().isBlank() && isEntrySection(currentName)) {
                header = Optional.empty();
            }
            if (header.isPresent()) {
                currentName = header.get().section();
                current = sections.computeIfAbsent(currentName, k -> new ArrayList<>());
                if (!header.get().inlineContent().isBlank()) {
                    current.add(header.get().inlineContent().strip());
                }
                continue;
            }
            if (current != null) {
                current.add(line.strip());
            } else if (!line.isBlank() && contact.size() < contactBlockLines) {
                contact.add(line.strip());
            }
        }
        return new CvSections(contact, sections);
    }

    private static boolean isEntrySection(String section) {
        return CvSections.EXPERIENCE.equals(section) || CvSections.EDUCATION.equals(section);
    }

    private Optional<Header> header(String line) {
        if (line == null || line.isBlank()) {
            return Optional.empty();
        }
        String candidate = line.strip();
        String inline = "";
        int colon = candidate.indexOf(':');
        if (colon > 0) {
            inline = candidate.substring(colon + 1);
            candidate = candidate.substring(0, colon);
        }
        if (candidate.length() > MAX_HEADER_LENGTH) {
            return Optional.empty();
        }
        String key = HEADER_DECORATION.matcher(TextNormalizer.fold(candidate)).replaceAll("")
                .replaceAll("\\s+", " ")
                .strip();
        for (Map.Entry<String, String> entry : phraseToSection) {
            if (entry.getKey().equals(key)) {
                return Optional.of(new Header(entry.getValue(), inline));
            }
        }
        return Optional.empty();
    }

    private record Header(String section, String inlineContent) {
    }
}
