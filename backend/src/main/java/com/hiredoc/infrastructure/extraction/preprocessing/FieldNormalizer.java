package com.hiredoc.infrastructure.extraction.preprocessing;

import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.DateTimeException;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Side-effect free canonicalization of contact fields, dates and delimited lists.
 * All operations are idempotent: feeding an output back in returns it unchanged.
 */
@Component
public class FieldNormalizer {

    private static final Pattern PHONE_ALLOWED = Pattern.compile("\\+?[\\d()\\-./]+");
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");
    private static final Pattern HAS_DIGIT = Pattern.compile("\\d");

    private static final Pattern LIST_DELIMITERS = Pattern.compile("[,|;\\u2022\\u00B7\\u25AA\\u25CF\\u2023\\u2043]");

    private static final Pattern EMAIL = Pattern.compile("^[a-z0-9._%+-]+@[a-z0-9.-]+\\.[a-z]{2,}$");

    private static final Set<String> PRESENT_TOKENS = Set.of(
            "present", "presente", "actual", "actualidad", "actualmente",
            "current", "currently", "now", "today", "hoy", "a la fecha"
    );

    private static final Map<String, Integer> MONTHS = Map.ofEntries(
            Map.entry("enero", 1), Map.entry("ene", 1), Map.entry("january", 1), Map.entry("jan", 1),
            Map.entry("febrero", 2), Map.entry("feb", 2), Map.entry("february", 2),
            Map.entry("marzo", 3), Map.entry("mar", 3), Map.entry("march", 3),
            Map.entry("abril", 4), Map.entry("abr", 4), Map.entry("april", 4), Map.entry("apr", 4),
            Map.entry("mayo", 5), Map.entry("may", 5),
            Map.entry("junio", 6), Map.entry("jun", 6), Map.entry("june", 6),
            Map.entry("julio", 7), Map.entry("jul", 7), Map.entry("july", 7),
            Map.entry("agosto", 8), Map.entry("ago", 8), Map.entry("august", 8), Map.entry("aug", 8),
            Map.entry("septiembre", 9), Map.entry("setiembre", 9), Map.entry("sep", 9), Map.entry("sept", 9),
            Map.entry("set", 9), Map.entry("september", 9),
            Map.entry("octubre", 10), Map.entry("oct", 10), Map.entry("october", 10),
            Map.entry("noviembre", 11), Map.entry("nov", 11), Map.entry("november", 11),
            Map.entry("diciembre", 12), Map.entry("dic", 12), Map.entry("december", 12), Map.entry("dec", 12)
    );

    /**
     * Regex alternation of every month name and abbreviation, longest first. Match it
     * case-insensitively.
     */
    public static final String MONTH_NAMES_REGEX = String.join("|", MONTHS.keySet().stream()
            .sorted(Comparator.<String>comparingInt(String::length).reversed().thenComparing(Comparator.naturalOrder()))
            .toList());

    // 2024-03-15, 2024/03/15, 2024.03.15
    private static final Pattern ISO_DATE = Pattern.compile("(\\d{4})[-/.](\\d{1,2})[-/.](\\d{1,2})");
    // 2024-03
    private static final Pattern ISO_MONTH = Pattern.compile("(\\d{4})[-/.](\\d{1,2})");
    // 15/03/2024, 15-03-2024, 15.03.2024
    private static final Pattern DAY_FIRST = Pattern.compile("(\\d{1,2})[-/.](\\d{1,2})[-/.](\\d{4})");
    // 03/2024
    private static final Pattern MONTH_YEAR_NUMERIC = Pattern.compile("(\\d{1,2})[-/.](\\d{4})");
    // 2024
    private static final Pattern YEAR = Pattern.compile("(\\d{4})");
    // "15 de marzo de 2024", "15 March 2024"
    private static final Pattern DAY_MONTH_NAME_YEAR = Pattern.compile("(\\d{1,2})\\s+(?:de\\s+)?([a-z]+)\\.?,?\\s+(?:de\\s+|del\\s+)?(\\d{4})");
    // "March 15, 2024"
    private static final Pattern MONTH_NAME_DAY_YEAR = Pattern.compile("([a-z]+)\\.?\\s+(\\d{1,2}),?\\s+(\\d{4})");
    // "marzo 2024", "marzo de 2024", "Mar. 2024"
    private static final Pattern MONTH_NAME_YEAR = Pattern.compile("([a-z]+)\\.?\\s+(?:de\\s+|del\\s+)?(\\d{4})");

    /**
     * Strip whitespace separators from a phone number while keeping the leading '+',
     * digits and the punctuation used in international formats.
     *
     * @return the normalized number, or null when the input holds letters or no digits
     */
    public String normalizePhone(String text) {
        if (text == null) {
            return null;
        }
        String compact = WHITESPACE.matcher(text).replaceAll("");
        if (compact.isEmpty() || !HAS_DIGIT.matcher(compact).find()) {
            return null;
        }
        if (!PHONE_ALLOWED.matcher(compact).matches()) {
            return null;
        }
        return compact;
    }

    /**
     * Number of digits in a phone value, used by plausibility checks.
     */
    public int phoneDigitCount(String phone) {
        if (phone == null) {
            return 0;
        }
        return (int) phone.chars().filter(Character::isDigit).count();
    }

    public boolean isPresentToken(String text) {
        if (text == null) {
            return false;
        }
        return PRESENT_TOKENS.contains(TextNormalizer.fold(text).strip().replaceAll("[.\\s]+$", ""));
    }

    /**
     * Parse a date written in an ISO-like or month-name form. Partial dates resolve to the
     * first day of the period. The "present" token resolves against {@code clock}, so callers
     * should keep the literal token and resolve it only when validating.
     *
     * @return the date, or null when the text is not a recognizable date
     */
    public LocalDate normalizeDate(String text, Clock clock) {
        if (text == null || text.isBlank()) {
            return null;
        }
        if (isPresentToken(text)) {
            return LocalDate.now(clock);
        }
        String folded = TextNormalizer.fold(text).strip();
        try {
            return parseFolded(folded);
        } catch (DateTimeException e) {
            return null;
        }
    }

    private LocalDate parseFolded(String folded) {
        Matcher m = ISO_DATE.matcher(folded);
        if (m.matches()) {
            return LocalDate.of(Integer.parseInt(m.group(1)), Integer.parseInt(m.group(2)), Integer.parseInt(m.group(3)));
        }
        m = DAY_FIRST.matcher(folded);
        if (m.matches()) {
            int first = Integer.parseInt(m.group(1));
            int second = Integer.parseInt(m.group(2));
            int year = Integer.parseInt(m.group(3));
            // Day-first unless that cannot be a valid month
            if (second > 12 && first <= 12) {
                return LocalDate.of(year, first, second);
            }
            return LocalDate.of(year, second, first);
        }
        m = ISO_MONTH.matcher(folded);
        if (m.matches()) {
            return LocalDate.of(Integer.parseInt(m.group(1)), Integer.parseInt(m.group(2)), 1);
        }
        m = MONTH_YEAR_NUMERIC.matcher(folded);
        if (m.matches()) {
            return LocalDate.of(Integer.parseInt(m.group(2)), Integer.parseInt(m.group(1)), 1);
        }
        m = YEAR.matcher(folded);
        if (m.matches()) {
            return LocalDate.of(Integer.parseInt(m.group(1)), 1, 1);
        }
        m = DAY_MONTH_NAME_YEAR.matcher(folded);
        if (m.matches() && MONTHS.containsKey(m.group(2))) {
            return LocalDate.of(Integer.parseInt(m.group(3)), MONTHS.get(m.group(2)), Integer.parseInt(m.group(1)));
        }
        m = MONTH_NAME_DAY_YEAR.matcher(folded);
        if (m.matches() && MONTHS.containsKey(m.group(1))) {
            return LocalDate.of(Integer.parseInt(m.group(3)), MONTHS.get(m.group(1)), Integer.parseInt(m.group(2)));
        }
        m = MONTH_NAME_YEAR.matcher(folded);
        if (m.matches() && MONTHS.containsKey(m.group(1))) {
            return LocalDate.of(Integer.parseInt(m.group(2)), MONTHS.get(m.group(1)), 1);
        }
        return null;
    }

    /**
     * Split on comma, pipe, semicolon or bullet characters, trim, drop empties and
     * de-duplicate case-insensitively, keeping the first-seen casing and order.
     */
    public List<String> splitDelimitedList(String text) {
        if (text == null || text.isBlank()) {
            return List.of();
        }
        return dedupeIgnoreCase(List.of(LIST_DELIMITERS.split(text)));
    }

    /**
     * Trim, drop blanks and remove case-insensitive duplicates, first occurrence wins.
     */
    public List<String> dedupeIgnoreCase(Collection<String> items) {
        List<String> result = new ArrayList<>();
        Set<String> seen = new HashSet<>();
        for (String item : items) {
            if (item == null) {
                continue;
            }
            String trimmed = WHITESPACE.matcher(item).replaceAll(" ").strip();
            if (trimmed.isEmpty()) {
                continue;
            }
            if (seen.add(trimmed.toLowerCase(Locale.ROOT))) {
                result.add(trimmed);
            }
        }
        return result;
    }

    /**
     * @return lower-cased address without spaces, or null when it lacks an '@' or a dotted domain
     */
    public String normalizeEmail(String text) {
        if (text == null) {
            return null;
        }
        String email = WHITESPACE.matcher(text).replaceAll("").toLowerCase(Locale.ROOT);
        int at = email.indexOf('@');
        if (at <= 0 || email.indexOf('.', at) < 0) {
            return null;
        }
        return email;
    }

    public boolean isWellFormedEmail(String email) {
        return email != null && EMAIL.matcher(email).matches();
    }

    /**
     * Prefix bare hosts with https://.
     */
    public String normalizeUrl(String text) {
        if (text == null || text.isBlank()) {
            return null;
        }
        String url = text.strip();
        if (!url.regionMatches(true, 0, "http://", 0, 7) && !url.regionMatches(true, 0, "https://", 0, 8)) {
            url = "https://" + url;
        }
        return url;
    }
}
