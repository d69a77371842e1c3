package com.hiredoc.infrastructure.extraction.cv;

import com.hiredoc.domain.document.model.CvData;
import com.hiredoc.domain.document.model.DocumentType;
import com.hiredoc.domain.document.model.Education;
import com.hiredoc.domain.document.model.WorkExperience;
import com.hiredoc.domain.document.service.DocumentExtractor;
import com.hiredoc.infrastructure.extraction.EmptyInputException;
import com.hiredoc.infrastructure.extraction.ExtractionSettings;
import com.hiredoc.infrastructure.extraction.preprocessing.EntityCleaner;
import com.hiredoc.infrastructure.extraction.preprocessing.FieldNormalizer;
import com.hiredoc.infrastructure.extraction.preprocessing.TextNormalizer;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Extracts a {@link CvData} record from résumé text in four passes:
 * <ol>
 *   <li>contact block: name, email, phone, LinkedIn, location</li>
 *   <li>section segmentation by bilingual headers ({@link CvSectionSegmenter})</li>
 *   <li>experience and education entries</li>
 *   <li>skills (delimited list, or a technical-term scan), languages, certifications, summary</li>
 * </ol>
 * Dates are kept as written; the validator normalizes them.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class CvExtractor implements DocumentExtractor<CvData> {

    private static final int CASE_FLAGS = Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE;

    // === Contact block ===

    private static final Pattern EMAIL = Pattern.compile("[A-Za-z0-9._%+-]+@[A-Za-z0-9.-]+\\.[A-Za-z]{2,}");

    // 1. Labeled: "Tel: +52 55 1234 5678", "Celular. 300-123-4567"
    private static final Pattern LABELED_PHONE = Pattern.compile(
            "(?<!\\p{L})(?:tel[eé]fono|tel|phone|celular|cel|mobile|m[oó]vil|whatsapp)\\.?\\s*[:.]?\\s*"
                    + "(\\+?[\\d \\-().]{6,20}\\d)",
            CASE_FLAGS
    );

    // 2. International: "+34 600 123 456"
    private static final Pattern INTERNATIONAL_PHONE = Pattern.compile("(?<![\\w+])(\\+\\d[\\d \\-().]{6,18}\\d)");

    // 3. Bare local number in the contact block: "(55) 1234-5678"
    private static final Pattern PLAIN_PHONE = Pattern.compile(
            "(?<![\\w/.-])(\\(?\\d{2,4}\\)?[ \\-.]?\\d{3,4}[ \\-.]?\\d{3,4})(?![\\w/])");

    private static final int MIN_PHONE_DIGITS = 7;
    private static final int MAX_PHONE_DIGITS = 15;

    private static final Pattern LINKEDIN_URL = Pattern.compile(
            "(?:https?://)?((?:[\\w-]+\\.)?linkedin\\.com/[^\\s,;|)]+)", Pattern.CASE_INSENSITIVE);

    private static final Pattern LINKEDIN_LABEL = Pattern.compile(
            "linkedin\\s*:\\s*@?([\\w\\-]{3,100})", Pattern.CASE_INSENSITIVE);

    private static final Pattern URL_LIKE = Pattern.compile(
            "https?://|www\\.|\\.(?:com|org|net|io|dev)\\b", Pattern.CASE_INSENSITIVE);

    private static final Pattern LOCATION_LABEL = Pattern.compile(
            "(?:ubicaci[oó]n|location|ciudad|city|direcci[oó]n|address|residencia|domicilio)\\s*:\\s*([^|•\\n]{2,60})",
            CASE_FLAGS
    );

    private static final Pattern CONTACT_SEPARATOR = Pattern.compile("\\s*[|•·]\\s*");

    private static final Pattern PLACE_KEYWORD = Pattern.compile("(?<!\\p{L})(?:" + String.join("|",
            "mexico", "cdmx", "guadalajara", "monterrey", "puebla", "queretaro", "madrid", "barcelona",
            "valencia", "sevilla", "espana", "spain", "bogota", "medellin", "cali", "colombia",
            "buenos aires", "cordoba", "argentina", "santiago", "chile", "lima", "peru", "quito",
            "ecuador", "caracas", "venezuela", "montevideo", "uruguay", "paraguay", "bolivia",
            "costa rica", "panama", "guatemala", "el salvador", "honduras", "puerto rico",
            "republica dominicana", "miami", "new york", "london", "usa", "united states",
            "estados unidos", "canada", "toronto", "lisboa", "portugal", "remote", "remoto") + ")(?!\\p{L})");

    private static final int MAX_LOCATION_LENGTH = 60;
    private static final int MAX_NAME_WORDS = 6;

    private static final List<String> DOCUMENT_TITLES = List.of(
            "curriculum vitae", "curriculum", "cv", "resume", "hoja de vida");

    // === Entries ===

    // "Senior Developer en TechCorp", "Engineer at Acme", "Dev @ Startup"
    private static final Pattern TITLE_AT_COMPANY = Pattern.compile("^(.+)\\s+(?:en|at|@)\\s+(.+)$", CASE_FLAGS);

    private static final Pattern PART_SEPARATOR = Pattern.compile("\\s*[,|]\\s*|\\s+[-–—]\\s+");

    private static final Pattern ENTRY_LOCATION = Pattern.compile(
            "^(?:ubicaci[oó]n|location|lugar|place|ciudad|city)\\s*:\\s*(.+)$", CASE_FLAGS);

    private static final Pattern FIELD_OF_STUDY = Pattern.compile(
            "^(?:carrera|field(?:\\s+of\\s+study)?|major|specialization|especialidad|especializaci[oó]n)\\s*:\\s*(.+)$",
            CASE_FLAGS
    );

    private static final Pattern INSTITUTION_HINT = Pattern.compile(
            "(?<!\\p{L})(?:universidad|university|instituto|institute|college|school|escuela|colegio|academia"
                    + "|academy|polit[eé]cnico|tecnol[oó]gico|facultad|faculty|conservatorio)(?!\\p{L})",
            CASE_FLAGS
    );

    private static final Pattern CONNECTOR = Pattern.compile("\\s+(?:en|at|in|-|–)\\s+|\\s*[,|]\\s*", CASE_FLAGS);

    private static final Pattern DEGREE_FIELD = Pattern.compile("^(.+?)\\s+(?:en|in|de|of)\\s+(.+)$", CASE_FLAGS);

    private static final Pattern BULLET = Pattern.compile("^[•·▪●‣⁃*\\-–]\\s*");

    private static final int MAX_INLINE_DATE_HEADER = 100;

    // === Skills, languages, summary ===

    private static final Pattern LIST_DELIMITER = Pattern.compile("[,|;•·]");

    // "Lenguajes: Python, Java"
    private static final Pattern LIST_LABEL = Pattern.compile("^([^:,|;]{2,30}):\\s*(.+)$");

    private static final int MAX_SKILL_LENGTH = 50;
    private static final int MAX_SKILL_WORDS = 5;
    private static final int MIN_CERTIFICATION_LENGTH = 4;
    private static final int MAX_SUMMARY_SENTENCES = 5;

    private static final Pattern SENTENCE_BREAK = Pattern.compile("(?<=[.!?])\\s+");

    private static final Map<String, String> LANGUAGES = languageTable();

    private static final Pattern LANGUAGE_NAME = Pattern.compile(
            "(?<!\\p{L})(" + String.join("|", LANGUAGES.keySet()) + ")(?!\\p{L})");

    private final TextNormalizer textNormalizer;
    private final FieldNormalizer fieldNormalizer;
    private final EntityCleaner entityCleaner;
    private final CvSectionSegmenter segmenter;
    private final ExtractionSettings settings;

    @Override
    public DocumentType supportedType() {
        return DocumentType.CV;
    }

    @Override
    public CvData extract(String text) {
        EmptyInputException.requireText(text, DocumentType.CV);
        String normalized = textNormalizer.normalize(text);
        EmptyInputException.requireText(normalized, DocumentType.CV);

        CvSections sections = segmenter.segment(normalized, settings.contactBlockLines());
        List<String> contact = sections.contactLines();
        String contactText = String.join("\n", contact);

        String fullName = findName(contact);
        String email = findEmail(contactText, normalized);
        String phone = findPhone(contactText, contact, normalized);
        String linkedin = findLinkedin(normalized);
        String location = findLocation(contact);

        List<WorkExperience> experience = parseExperience(sections.body(CvSections.EXPERIENCE));
        List<Education> education = parseEducation(sections.body(CvSections.EDUCATION));
        List<String> skills = parseSkills(sections, normalized);
        List<String> languages = parseLanguages(sections.body(CvSections.LANGUAGES));
        List<String> certifications = parseCertifications(sections.body(CvSections.CERTIFICATIONS));
        String summary = parseSummary(sections.body(CvSections.SUMMARY));

        log.debug("[CvExtractor] sections={}, experience={}, education={}, skills={}, languages={}",
                sections.sections().keySet(), experience.size(), education.size(), skills.size(), languages.size());

        return new CvData(
                fullName, email, phone, location, linkedin, summary,
                experience, education, skills, languages, certifications,
                settings.truncateRaw(normalized)
        );
    }

    // ===== Pass 1: contact block =====

    private String findName(List<String> contact) {
        for (String line : contact) {
            String fragment = CONTACT_SEPARATOR.split(line)[0].strip();
            if (fragment.isEmpty() || DOCUMENT_TITLES.contains(TextNormalizer.fold(fragment))) {
                continue;
            }
            if (fragment.chars().anyMatch(Character::isDigit) || fragment.contains("@")
                    || fragment.contains(":") || URL_LIKE.matcher(fragment).find()) {
                continue;
            }
            int words = fragment.split("\\s+").length;
            if (words > MAX_NAME_WORDS) {
                continue;
            }
            return entityCleaner.cleanPersonName(fragment);
        }
        return null;
    }

    private String findEmail(String contactText, String fullText) {
        Matcher m = EMAIL.matcher(contactText);
        if (m.find()) {
            return fieldNormalizer.normalizeEmail(m.group());
        }
        m = EMAIL.matcher(fullText);
        return m.find() ? fieldNormalizer.normalizeEmail(m.group()) : null;
    }

    private String findPhone(String contactText, List<String> contact, String fullText) {
        String phone = firstPlausiblePhone(LABELED_PHONE.matcher(fullText));
        if (phone == null) {
            phone = firstPlausiblePhone(INTERNATIONAL_PHONE.matcher(contactText));
        }
        if (phone == null) {
            for (String line : contact) {
                if (DateRange.find(line).isPresent()) {
                    continue;
                }
                phone = firstPlausiblePhone(PLAIN_PHONE.matcher(line));
                if (phone != null) {
                    break;
                }
            }
        }
        return phone;
    }

    private String firstPlausiblePhone(Matcher m) {
        while (m.find()) {
            String phone = fieldNormalizer.normalizePhone(m.group(1));
            int digits = fieldNormalizer.phoneDigitCount(phone);
            if (phone != null && digits >= MIN_PHONE_DIGITS && digits <= MAX_PHONE_DIGITS) {
                return phone;
            }
        }
        return null;
    }

    private String findLinkedin(String text) {
        Matcher m = LINKEDIN_URL.matcher(text);
        if (m.find()) {
            return fieldNormalizer.normalizeUrl(m.group(1).replaceAll("[/.]+$", ""));
        }
        m = LINKEDIN_LABEL.matcher(text);
        if (m.find()) {
            return "https://linkedin.com/in/" + m.group(1);
        }
        return null;
    }

    private String findLocation(List<String> contact) {
        List<String> fragments = new ArrayList<>();
        for (int i = 0; i < contact.size(); i++) {
            String[] parts = CONTACT_SEPARATOR.split(contact.get(i));
            for (int j = 0; j < parts.length; j++) {
                Matcher label = LOCATION_LABEL.matcher(parts[j]);
                if (label.find()) {
                    return textNormalizer.collapse(label.group(1)).replaceAll("[.,;]+$", "");
                }
                // The leading fragment of the first line is the name
                if (i == 0 && j == 0) {
                    continue;
                }
                fragments.add(parts[j].strip());
            }
        }

        List<String> candidates = fragments.stream().filter(this::couldBeLocation).toList();
        return candidates.stream()
                .filter(f -> PLACE_KEYWORD.matcher(TextNormalizer.fold(f)).find())
                .findFirst()
                .or(() -> candidates.stream().filter(f -> f.contains(",")).findFirst())
                .map(f -> f.replaceAll("[.;]+$", ""))
                .orElse(null);
    }

    private boolean couldBeLocation(String fragment) {
        if (fragment.isEmpty() || fragment.length() > MAX_LOCATION_LENGTH) {
            return false;
        }
        if (fragment.contains("@") || URL_LIKE.matcher(fragment).find() || fragment.contains(":")) {
            return false;
        }
        // Allow postal codes, reject phone numbers
        return fieldNormalizer.phoneDigitCount(fragment) < 6 && fragment.split("\\s+").length <= 6;
    }

    // ===== Pass 3: entries =====

    private List<WorkExperience> parseExperience(List<String> body) {
        List<WorkExperience> result = new ArrayList<>();
        for (List<String> entry : splitEntries(body)) {
            WorkExperience experience = parseExperienceEntry(entry);
            if (experience != null) {
                result.add(experience);
            }
        }
        return result;
    }

    /**
     * Entries are separated by blank lines, or start at a header line directly followed by a
     * date range once the current entry already has its own dates.
     */
    private List<List<String>> splitEntries(List<String> body) {
        List<List<String>> entries = new ArrayList<>();
        List<String> current = new ArrayList<>();
        boolean currentHasDates = false;

        for (int i = 0; i < body.size(); i++) {
            String line = body.get(i).strip();
            if (line.isEmpty()) {
                if (!current.isEmpty()) {
                    entries.add(current);
                    current = new ArrayList<>();
                    currentHasDates = false;
                }
                continue;
            }
            Optional<DateRange> range = DateRange.find(line);
            boolean bullet = BULLET.matcher(line).lookingAt();
            if (!current.isEmpty() && currentHasDates && !bullet
                    && (nextNonBlankIsDateLine(body, i) || isHeaderWithInlineDates(line, range))) {
                entries.add(current);
                current = new ArrayList<>();
                currentHasDates = false;
            }
            current.add(line);
            currentHasDates |= range.isPresent();
        }
        if (!current.isEmpty()) {
            entries.add(current);
        }
        return mergeOrphanDateBlocks(entries);
    }

    private boolean nextNonBlankIsDateLine(List<String> body, int index) {
        for (int j = index + 1; j < body.size(); j++) {
            String next = body.get(j).strip();
            if (!next.isEmpty()) {
                return DateRange.find(next).filter(r -> r.fillsLine(next)).isPresent();
            }
        }
        return false;
    }

    private boolean isHeaderWithInlineDates(String line, Optional<DateRange> range) {
        if (range.isEmpty() || range.get().fillsLine(line) || line.length() > MAX_INLINE_DATE_HEADER) {
            return false;
        }
        String rest = range.get().removeFrom(line);
        return TITLE_AT_COMPANY.matcher(rest).matches() || rest.contains("|");
    }

    // "Title en Company\n\nEnero 2020 - Presente" keeps the dates with their header
    private List<List<String>> mergeOrphanDateBlocks(List<List<String>> entries) {
        List<List<String>> merged = new ArrayList<>();
        for (List<String> entry : entries) {
            String first = entry.get(0);
            boolean startsWithDates = DateRange.find(first).filter(r -> r.fillsLine(first)).isPresent();
            if (startsWithDates && !merged.isEmpty() && !hasDates(merged.get(merged.size() - 1))) {
                merged.get(merged.size() - 1).addAll(entry);
            } else {
                merged.add(new ArrayList<>(entry));
            }
        }
        return merged;
    }

    private static boolean hasDates(List<String> entry) {
        return entry.stream().anyMatch(line -> DateRange.find(line).isPresent());
    }

    private WorkExperience parseExperienceEntry(List<String> lines) {
        DateRange range = null;
        int rangeLine = -1;
        for (int i = 0; i < lines.size(); i++) {
            Optional<DateRange> found = DateRange.find(lines.get(i));
            if (found.isPresent()) {
                range = found.get();
                rangeLine = i;
                break;
            }
        }

        String header = null;
        int headerLine = -1;
        for (int i = 0; i < lines.size(); i++) {
            String line = lines.get(i);
            if (i == rangeLine && range.fillsLine(line)) {
                continue;
            }
            if (ENTRY_LOCATION.matcher(line).matches()) {
                continue;
            }
            header = i == rangeLine ? range.removeFrom(line) : BULLET.matcher(line).replaceFirst("");
            headerLine = i;
            break;
        }

        String title = null;
        String company = null;
        String location = null;
        if (header != null && !header.isBlank()) {
            Matcher at = TITLE_AT_COMPANY.matcher(header);
            String[] parts;
            if (at.matches()) {
                title = at.group(1);
                parts = PART_SEPARATOR.split(at.group(2));
                company = parts[0];
                if (parts.length > 1) {
                    location = parts[1];
                }
            } else {
                parts = PART_SEPARATOR.split(header);
                title = parts[0];
                if (parts.length > 1) {
                    company = parts[1];
                }
                if (parts.length > 2) {
                    location = parts[2];
                }
            }
        }

        List<String> description = new ArrayList<>();
        for (int i = 0; i < lines.size(); i++) {
            if (i == headerLine) {
                continue;
            }
            String line = lines.get(i);
            Matcher loc = ENTRY_LOCATION.matcher(line);
            if (loc.matches()) {
                location = loc.group(1);
                continue;
            }
            if (i == rangeLine) {
                String rest = range.removeFrom(line);
                // "Madrid | Enero 2020 - Presente"
                if (!rest.isEmpty() && location == null && rest.length() <= MAX_LOCATION_LENGTH / 2) {
                    location = rest;
                }
                continue;
            }
            String cleaned = BULLET.matcher(line).replaceFirst("").strip();
            if (!cleaned.isEmpty()) {
                description.add(cleaned);
            }
        }

        title = tidy(title);
        company = entityCleaner.cleanCompanyName(tidy(company));
        if (title == null && company == null) {
            return null;
        }
        return new WorkExperience(
                company,
                title,
                range != null ? range.start() : null,
                range != null ? range.end() : null,
                range != null && range.current(),
                description.isEmpty() ? null : String.join("\n", description),
                tidy(location)
        );
    }

    private List<Education> parseEducation(List<String> body) {
        List<Education> result = new ArrayList<>();
        for (List<String> entry : splitEntries(body)) {
            Education education = parseEducationEntry(entry);
            if (education != null) {
                result.add(education);
            }
        }
        return result;
    }

    private Education parseEducationEntry(List<String> lines) {
        DateRange range = null;
        int rangeLine = -1;
        for (int i = 0; i < lines.size() && range == null; i++) {
            Optional<DateRange> found = DateRange.find(lines.get(i));
            if (found.isPresent()) {
                range = found.get();
                rangeLine = i;
            }
        }
        for (int i = 0; i < lines.size() && range == null; i++) {
            Optional<DateRange> found = DateRange.findSingle(lines.get(i));
            if (found.isPresent()) {
                range = found.get();
                rangeLine = i;
            }
        }

        String degree = null;
        String institution = null;
        String field = null;
        boolean headerSeen = false;

        for (int i = 0; i < lines.size(); i++) {
            String line = BULLET.matcher(lines.get(i)).replaceFirst("").strip();
            if (i == rangeLine) {
                if (range.fillsLine(line)) {
                    continue;
                }
                line = range.removeFrom(line);
            }
            Matcher fieldLine = FIELD_OF_STUDY.matcher(line);
            if (fieldLine.matches()) {
                field = fieldLine.group(1);
                continue;
            }
            if (line.isEmpty()) {
                continue;
            }
            if (!headerSeen) {
                headerSeen = true;
                String[] parsed = splitDegreeLine(line);
                degree = parsed[0];
                institution = parsed[1];
                if (field == null) {
                    field = parsed[2];
                }
            } else if (institution == null) {
                institution = line;
            }
        }

        degree = entityCleaner.standardizeDegree(tidy(degree));
        institution = entityCleaner.cleanCompanyName(tidy(institution));
        if (degree == null && institution == null) {
            return null;
        }
        return new Education(
                institution,
                degree,
                tidy(field),
                range != null ? range.start() : null,
                range != null ? range.end() : null,
                range != null && range.current()
        );
    }

    /**
     * @return degree, institution and field of study found on an education header line
     */
    private String[] splitDegreeLine(String line) {
        String degreePart = line;
        String institution = null;

        Matcher hint = INSTITUTION_HINT.matcher(line);
        if (hint.find()) {
            int lastConnectorEnd = -1;
            int lastConnectorStart = -1;
            Matcher connector = CONNECTOR.matcher(line);
            while (connector.find() && connector.end() <= hint.start()) {
                lastConnectorStart = connector.start();
                lastConnectorEnd = connector.end();
            }
            if (lastConnectorEnd >= 0) {
                degreePart = line.substring(0, lastConnectorStart);
                institution = line.substring(lastConnectorEnd);
            } else {
                // "Universidad Nacional, Licenciatura en Derecho"
                String[] parts = PART_SEPARATOR.split(line, 2);
                institution = parts[0];
                degreePart = parts.length > 1 ? parts[1] : null;
            }
        } else {
            String[] parts = PART_SEPARATOR.split(line, 2);
            if (parts.length > 1) {
                degreePart = parts[0];
                institution = parts[1];
            }
        }

        String field = null;
        if (degreePart != null) {
            Matcher df = DEGREE_FIELD.matcher(degreePart.strip());
            if (df.matches()) {
                degreePart = df.group(1);
                field = df.group(2);
            }
        }
        return new String[]{degreePart, institution, field};
    }

    // ===== Pass 4: skills, languages, certifications, summary =====

    private List<String> parseSkills(CvSections sections, String fullText) {
        List<String> found = new ArrayList<>();
        if (sections.has(CvSections.SKILLS)) {
            List<String> body = sections.body(CvSections.SKILLS).stream()
                    .map(line -> BULLET.matcher(line).replaceFirst("").strip())
                    .filter(line -> !line.isEmpty())
                    .toList();
            boolean delimited = body.size() > 1 || body.stream().anyMatch(l -> LIST_DELIMITER.matcher(l).find());
            if (delimited) {
                for (String line : body) {
                    Matcher label = LIST_LABEL.matcher(line);
                    String items = label.matches() ? label.group(2) : line;
                    List<String> split = fieldNormalizer.splitDelimitedList(items);
                    if (split.stream().allMatch(CvExtractor::looksLikeSkill)) {
                        found.addAll(split);
                    } else {
                        // prose with a stray comma
                        found.addAll(TechTerms.scan(line));
                    }
                }
            }
            if (found.isEmpty()) {
                found.addAll(TechTerms.scan(String.join("\n", body)));
            }
        } else {
            found.addAll(TechTerms.scan(fullText));
        }
        return fieldNormalizer.dedupeIgnoreCase(found.stream().map(entityCleaner::canonicalSkill).toList());
    }

    private static boolean looksLikeSkill(String item) {
        return item.length() <= MAX_SKILL_LENGTH && item.split("\\s+").length <= MAX_SKILL_WORDS;
    }

    private List<String> parseLanguages(List<String> body) {
        if (body.isEmpty()) {
            return List.of();
        }
        Matcher m = LANGUAGE_NAME.matcher(TextNormalizer.fold(String.join("\n", body)));
        List<String> found = new ArrayList<>();
        while (m.find()) {
            found.add(LANGUAGES.get(m.group(1)));
        }
        return fieldNormalizer.dedupeIgnoreCase(found);
    }

    private List<String> parseCertifications(List<String> body) {
        List<String> found = body.stream()
                .map(line -> textNormalizer.collapse(BULLET.matcher(line).replaceFirst("")))
                .filter(line -> line.length() >= MIN_CERTIFICATION_LENGTH)
                .toList();
        return fieldNormalizer.dedupeIgnoreCase(found);
    }

    private String parseSummary(List<String> body) {
        String joined = textNormalizer.collapse(String.join(" ", body));
        if (joined == null || joined.isEmpty()) {
            return null;
        }
        String[] sentences = SENTENCE_BREAK.split(joined);
        return String.join(" ", Arrays.asList(sentences).subList(0, Math.min(sentences.length, MAX_SUMMARY_SENTENCES)));
    }

    private String tidy(String value) {
        if (value == null) {
            return null;
        }
        String cleaned = textNormalizer.collapse(value).replaceAll("^[\\s,;|:·•\\-–—]+|[\\s,;|:·•\\-–—]+$", "");
        return cleaned.isEmpty() ? null : cleaned;
    }

    private static Map<String, String> languageTable() {
        Map<String, String> table = new LinkedHashMap<>();
        table.put("espanol", "Español");
        table.put("castellano", "Castellano");
        table.put("spanish", "Spanish");
        table.put("ingles", "Inglés");
        table.put("english", "English");
        table.put("frances", "Francés");
        table.put("french", "French");
        table.put("aleman", "Alemán");
        table.put("german", "German");
        table.put("portugues", "Portugués");
        table.put("portuguese", "Portuguese");
        table.put("italiano", "Italiano");
        table.put("italian", "Italian");
        table.put("chino", "Chino");
        table.put("mandarin", "Mandarín");
        table.put("chinese", "Chinese");
        table.put("japones", "Japonés");
        table.put("japanese", "Japanese");
        table.put("coreano", "Coreano");
        table.put("korean", "Korean");
        table.put("ruso", "Ruso");
        table.put("russian", "Russian");
        table.put("arabe", "Árabe");
        table.put("arabic", "Arabic");
        table.put("catalan", "Catalán");
        table.put("holandes", "Holandés");
        table.put("dutch", "Dutch");
        return Collections.unmodifiableMap(table);
    }
}
