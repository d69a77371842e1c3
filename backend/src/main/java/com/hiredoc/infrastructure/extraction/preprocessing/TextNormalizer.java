package com.hiredoc.infrastructure.extraction.preprocessing;

import org.springframework.stereotype.Component;

import java.text.Normalizer;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Cleans decoded document text before classification and extraction:
 * - Unicode NFC normalization
 * - Invisible/control character removal
 * - Line ending and horizontal whitespace normalization (line structure is kept,
 *   the extractors rely on it)
 * <p>
 * Also provides the accent/case folding used for every keyword lookup.
 */
@Component
public class TextNormalizer {

    // Zero-width and invisible Unicode characters
    private static final Pattern INVISIBLE_CHARS = Pattern.compile(
            "[\\u200B\\u200C\\u200D\\uFEFF\\u00AD\\u2060\\u180E]"
    );

    // Control characters except common whitespace (\n, \r, \t)
    private static final Pattern CONTROL_CHARS = Pattern.compile(
            "[\\x00-\\x08\\x0B\\x0C\\x0E-\\x1F\\x7F]"
    );

    // PDF extractors emit non-breaking and typographic spaces
    private static final Pattern EXOTIC_SPACES = Pattern.compile("[\\u00A0\\u2000-\\u200A\\u202F\\u205F\\u3000]");

    private static final Pattern MULTIPLE_SPACES = Pattern.compile("[ \\t]{2,}");

    private static final Pattern TRAILING_SPACES = Pattern.compile("[ \\t]+\\n");

    // 3+ consecutive newlines → 2 newlines
    private static final Pattern EXCESSIVE_NEWLINES = Pattern.compile("\\n{3,}");

    private static final Pattern COMBINING_MARKS = Pattern.compile("\\p{M}+");

    /**
     * Normalize decoded document text.
     *
     * @param text raw document text
     * @return normalized text, or the input itself when null/empty
     */
    public String normalize(String text) {
        if (text == null || text.isEmpty()) {
            return text;
        }

        String result = Normalizer.normalize(text, Normalizer.Form.NFC);
        result = INVISIBLE_CHARS.matcher(result).replaceAll("");
        result = CONTROL_CHARS.matcher(result).replaceAll("");
        result = result.replace("\r\n", "\n").replace("\r", "\n");
        result = EXOTIC_SPACES.matcher(result).replaceAll(" ");
        result = MULTIPLE_SPACES.matcher(result).replaceAll(" ");
        result = TRAILING_SPACES.matcher(result).replaceAll("\n");
        result = EXCESSIVE_NEWLINES.matcher(result).replaceAll("\n\n");
        return result.strip();
    }

    /**
     * Collapse a fragment to a single line: any whitespace run becomes one space.
     */
    public String collapse(String text) {
        if (text == null) {
            return null;
        }
        return Normalizer.normalize(text, Normalizer.Form.NFC).replaceAll("\\s+", " ").strip();
    }

    /**
     * Accent- and case-insensitive key: "Educación" and "EDUCACION" both fold to "educacion".
     */
    public static String fold(String text) {
        if (text == null) {
            return "";
        }
        String decomposed = Normalizer.normalize(text, Normalizer.Form.NFD);
        return COMBINING_MARKS.matcher(decomposed).replaceAll("").toLowerCase(Locale.ROOT);
    }

    public static List<String> lines(String text) {
        if (text == null || text.isEmpty()) {
            return List.of();
        }
        return Arrays.asList(text.split("\n", -1));
    }
}
