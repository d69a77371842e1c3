package com.hiredoc.infrastructure.extraction.cv;

import com.hiredoc.infrastructure.extraction.preprocessing.FieldNormalizer;

import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * A period such as "Enero 2020 - Presente" or "03/2018 – 2021" found in a CV line.
 * Bounds are kept exactly as written; {@code end} is null for an ongoing period.
 */
record DateRange(String start, String end, boolean current, int from, int to) {

    private static final String DATE = "(?:(?:" + FieldNormalizer.MONTH_NAMES_REGEX + ")\\.?\\s+(?:de\\s+|del\\s+)?\\d{4}"
            + "|\\d{1,2}[/.-]\\d{4}|\\d{4}[/.-]\\d{1,2}|\\d{4})";

    private static final String PRESENT = "presente|present|actualidad|actualmente|actual|currently|current"
            + "|now|hoy|a\\s+la\\s+fecha|la\\s+fecha";

    private static final Pattern RANGE = Pattern.compile(
            "(?<![\\p{L}\\d])(?<start>" + DATE + ")\\s*(?:[-–—]+|\\bto\\b|\\ba\\b|\\bhasta\\b|\\bal\\b)\\s*"
                    + "(?<end>" + DATE + "|" + PRESENT + ")(?![\\p{L}\\d])",
            Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE
    );

    private static final Pattern SINGLE = Pattern.compile(
            "(?<![\\p{L}\\d])(" + DATE + ")(?![\\p{L}\\d])",
            Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE
    );

    private static final Pattern PRESENT_TOKEN = Pattern.compile("^(?:" + PRESENT + ")$",
            Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE);

    // What may surround a date range on a line of its own
    private static final Pattern RANGE_DECORATION = Pattern.compile("^[\\s()\\[\\]|,:;·•\\-–—]*$");

    static Optional<DateRange> find(String line) {
        if (line == null) {
            return Optional.empty();
        }
        Matcher m = RANGE.matcher(line);
        if (!m.find()) {
            return Optional.empty();
        }
        String end = m.group("end").strip();
        boolean current = PRESENT_TOKEN.matcher(end).matches();
        return Optional.of(new DateRange(m.group("start").strip(), current ? null : end, current, m.start(), m.end()));
    }

    /**
     * A lone date such as a graduation year; reported as an end date.
     */
    static Optional<DateRange> findSingle(String line) {
        if (line == null) {
            return Optional.empty();
        }
        Matcher m = SINGLE.matcher(line);
        if (!m.find()) {
            return Optional.empty();
        }
        return Optional.of(new DateRange(null, m.group(1).strip(), false, m.start(), m.end()));
    }

    /**
     * True when the line holds nothing but this range and punctuation.
     */
    boolean fillsLine(String line) {
        String rest = line.substring(0, from) + line.substring(to);
        return RANGE_DECORATION.matcher(rest).matches();
    }

    /**
     * The line with the range and the punctuation around it removed.
     */
    String removeFrom(String line) {
        String before = line.substring(0, from).replaceAll("[\\s(\\[|,·•\\-–—]+$", "");
        String after = line.substring(to).replaceAll("^[\\s)\\]|,·•\\-–—]+", "");
        return (before + " " + after).strip();
    }
}
