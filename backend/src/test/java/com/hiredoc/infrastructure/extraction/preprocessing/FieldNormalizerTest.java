package com.hiredoc.infrastructure.extraction.preprocessing;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class FieldNormalizerTest {

    private static final Clock CLOCK = Clock.fixed(Instant.parse("2025-06-30T10:00:00Z"), ZoneOffset.UTC);

    private FieldNormalizer normalizer;

    @BeforeEach
    void setUp() {
        normalizer = new FieldNormalizer();
    }

    @Nested
    @DisplayName("normalizePhone")
    class Phone {

        @Test
        @DisplayName("Whitespace separators are stripped, + and punctuation kept")
        void stripsWhitespace() {
            assertThat(normalizer.normalizePhone("+52 55 1234 5678")).isEqualTo("+525512345678");
            assertThat(normalizer.normalizePhone("(55) 1234-5678")).isEqualTo("(55)1234-5678");
        }

        @Test
        @DisplayName("Letters make the value invalid")
        void rejectsLetters() {
            assertThat(normalizer.normalizePhone("call me 555")).isNull();
            assertThat(normalizer.normalizePhone("555-CALL")).isNull();
        }

        @Test
        @DisplayName("No digits or a misplaced + is invalid")
        void rejectsNonNumbers() {
            assertThat(normalizer.normalizePhone("---")).isNull();
            assertThat(normalizer.normalizePhone("55+1234")).isNull();
            assertThat(normalizer.normalizePhone(null)).isNull();
        }

        @ParameterizedTest
        @ValueSource(strings = {"+52 55 1234 5678", "(55) 1234-5678", "555.123.4567", "+1 (800) 555 0100"})
        @DisplayName("Normalization is idempotent")
        void idempotent(String input) {
            String once = normalizer.normalizePhone(input);
            assertThat(normalizer.normalizePhone(once)).isEqualTo(once);
        }

        @Test
        @DisplayName("Digit count ignores punctuation")
        void digitCount() {
            assertThat(normalizer.phoneDigitCount("+52(55)1234-5678")).isEqualTo(12);
            assertThat(normalizer.phoneDigitCount(null)).isZero();
        }
    }

    @Nested
    @DisplayName("normalizeDate")
    class Dates {

        @Test
        @DisplayName("ISO and numeric forms")
        void numericForms() {
            assertThat(normalizer.normalizeDate("2024-03-15", CLOCK)).isEqualTo(LocalDate.of(2024, 3, 15));
            assertThat(normalizer.normalizeDate("15/03/2024", CLOCK)).isEqualTo(LocalDate.of(2024, 3, 15));
            assertThat(normalizer.normalizeDate("2024-03", CLOCK)).isEqualTo(LocalDate.of(2024, 3, 1));
            assertThat(normalizer.normalizeDate("03/2024", CLOCK)).isEqualTo(LocalDate.of(2024, 3, 1));
            assertThat(normalizer.normalizeDate("2019", CLOCK)).isEqualTo(LocalDate.of(2019, 1, 1));
        }

        @Test
        @DisplayName("Month-first numeric date when the day cannot be a month")
        void monthFirstFallback() {
            assertThat(normalizer.normalizeDate("03/25/2024", CLOCK)).isEqualTo(LocalDate.of(2024, 3, 25));
        }

        @Test
        @DisplayName("Spanish and English month names")
        void monthNames() {
            assertThat(normalizer.normalizeDate("15 de marzo de 2024", CLOCK)).isEqualTo(LocalDate.of(2024, 3, 15));
            assertThat(normalizer.normalizeDate("March 15, 2024", CLOCK)).isEqualTo(LocalDate.of(2024, 3, 15));
            assertThat(normalizer.normalizeDate("Enero 2020", CLOCK)).isEqualTo(LocalDate.of(2020, 1, 1));
            assertThat(normalizer.normalizeDate("septiembre de 2018", CLOCK)).isEqualTo(LocalDate.of(2018, 9, 1));
        }

        @Test
        @DisplayName("present/presente resolve to the clock's date")
        void presentToken() {
            assertThat(normalizer.normalizeDate("Presente", CLOCK)).isEqualTo(LocalDate.of(2025, 6, 30));
            assertThat(normalizer.normalizeDate("present", CLOCK)).isEqualTo(LocalDate.of(2025, 6, 30));
            assertThat(normalizer.isPresentToken("Actualidad")).isTrue();
            assertThat(normalizer.isPresentToken("2020")).isFalse();
        }

        @Test
        @DisplayName("Unrecognized or impossible dates yield null")
        void invalid() {
            assertThat(normalizer.normalizeDate("someday", CLOCK)).isNull();
            assertThat(normalizer.normalizeDate("2024-13-45", CLOCK)).isNull();
            assertThat(normalizer.normalizeDate("  ", CLOCK)).isNull();
            assertThat(normalizer.normalizeDate("Foo 2024", CLOCK)).isNull();
        }
    }

    @Nested
    @DisplayName("splitDelimitedList")
    class Lists {

        @Test
        @DisplayName("Case-insensitive duplicates keep the first casing")
        void dedupesCaseInsensitively() {
            assertThat(normalizer.splitDelimitedList("Python, python, PYTHON")).containsExactly("Python");
        }

        @Test
        @DisplayName("Comma, pipe, semicolon and bullets all split")
        void allDelimiters() {
            assertThat(normalizer.splitDelimitedList("Java | Spring; Docker • Kubernetes, SQL"))
                    .containsExactly("Java", "Spring", "Docker", "Kubernetes", "SQL");
        }

        @Test
        @DisplayName("Empty items are dropped, order is preserved")
        void dropsEmpties() {
            assertThat(normalizer.splitDelimitedList("Go,, ,Rust ,Go")).containsExactly("Go", "Rust");
            assertThat(normalizer.splitDelimitedList("   ")).isEmpty();
        }

        @Test
        @DisplayName("dedupeIgnoreCase collapses inner whitespace")
        void dedupe() {
            assertThat(normalizer.dedupeIgnoreCase(List.of("Machine  Learning", "machine learning", " ")))
                    .containsExactly("Machine Learning");
        }
    }

    @Nested
    @DisplayName("Email and URL")
    class Contact {

        @Test
        @DisplayName("Email is lower-cased and stripped of spaces")
        void email() {
            assertThat(normalizer.normalizeEmail(" Juan.Perez@Example.COM ")).isEqualTo("juan.perez@example.com");
            assertThat(normalizer.isWellFormedEmail("juan.perez@example.com")).isTrue();
        }

        @Test
        @DisplayName("Email without @ or dotted domain is rejected")
        void malformedEmail() {
            assertThat(normalizer.normalizeEmail("juan.example.com")).isNull();
            assertThat(normalizer.normalizeEmail("juan@localhost")).isNull();
            assertThat(normalizer.isWellFormedEmail("juan@@x.com")).isFalse();
        }

        @Test
        @DisplayName("Bare hosts get https://")
        void url() {
            assertThat(normalizer.normalizeUrl("linkedin.com/in/juan")).isEqualTo("https://linkedin.com/in/juan");
            assertThat(normalizer.normalizeUrl("http://x.com")).isEqualTo("http://x.com");
            assertThat(normalizer.normalizeUrl(" ")).isNull();
        }
    }
}
