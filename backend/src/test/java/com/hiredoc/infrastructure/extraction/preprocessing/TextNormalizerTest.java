package com.hiredoc.infrastructure.extraction.preprocessing;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class TextNormalizerTest {

    private TextNormalizer normalizer;

    @BeforeEach
    void setUp() {
        normalizer = new TextNormalizer();
    }

    @Test
    @DisplayName("null and empty input are returned as is")
    void nullAndEmpty() {
        assertThat(normalizer.normalize(null)).isNull();
        assertThat(normalizer.normalize("")).isEmpty();
    }

    @Test
    @DisplayName("Invisible characters are removed")
    void removesInvisibleCharacters() {
        assertThat(normalizer.normalize("Experi\u200Bencia\uFEFF")).isEqualTo("Experiencia");
    }

    @Test
    @DisplayName("Control characters are removed")
    void removesControlCharacters() {
        assertThat(normalizer.normalize("Juan\u0001 Pérez\u0007")).isEqualTo("Juan Pérez");
    }

    @Test
    @DisplayName("\\r\\n and \\r become \\n")
    void normalizesLineEndings() {
        assertThat(normalizer.normalize("uno\r\ndos\rtres")).isEqualTo("uno\ndos\ntres");
    }

    @Test
    @DisplayName("Horizontal whitespace runs collapse, line structure is kept")
    void collapsesSpacesKeepsLines() {
        String input = "Senior   Developer  en\t\tTechCorp   \nEnero 2020";
        assertThat(normalizer.normalize(input)).isEqualTo("Senior Developer en TechCorp\nEnero 2020");
    }

    @Test
    @DisplayName("3+ newlines become 2")
    void limitsBlankLines() {
        assertThat(normalizer.normalize("uno\n\n\n\ndos")).isEqualTo("uno\n\ndos");
    }

    @Test
    @DisplayName("Decomposed accents are recomposed (NFC)")
    void recomposesAccents() {
        assertThat(normalizer.normalize("Educacio\u0301n")).isEqualTo("Educación");
    }

    @Test
    @DisplayName("Clean text is unchanged")
    void cleanTextUnchanged() {
        String input = "Sinceridad: 88.0\nEgocentrismo: 72.5";
        assertThat(normalizer.normalize(input)).isEqualTo(input);
    }

    @Test
    @DisplayName("fold drops accents and case")
    void fold() {
        assertThat(TextNormalizer.fold("EDUCACIÓN")).isEqualTo("educacion");
        assertThat(TextNormalizer.fold("Recomendación")).isEqualTo("recomendacion");
        assertThat(TextNormalizer.fold(null)).isEmpty();
    }

    @Test
    @DisplayName("collapse joins a fragment onto one line")
    void collapse() {
        assertThat(normalizer.collapse("  Senior\n  Developer \t ")).isEqualTo("Senior Developer");
        assertThat(normalizer.collapse(null)).isNull();
    }
}
