package com.hiredoc.infrastructure.extraction.cv;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class CvSectionSegmenterTest {

    private static final String CV = """
            Ana Ruiz
            ana@example.com
            Resumen: Backend developer.
            EXPERIENCIA LABORAL
            Dev en Globex
            Tecnologías: Docker, Kafka
            ## Education
            MIT
            SKILLS:
            Java, SQL
            """;

    private CvSectionSegmenter segmenter;

    @BeforeEach
    void setUp() {
        segmenter = new CvSectionSegmenter();
    }

    @Test
    @DisplayName("Lines before the first header form the contact block")
    void contactBlock() {
        CvSections sections = segmenter.segment(CV, 10);

        assertThat(sections.contactLines()).containsExactly("Ana Ruiz", "ana@example.com");
    }

    @Test
    @DisplayName("The contact block is capped")
    void contactBlockCap() {
        assertThat(segmenter.segment(CV, 1).contactLines()).containsExactly("Ana Ruiz");
    }

    @Test
    @DisplayName("Headers are matched regardless of case, accents and decoration")
    void headers() {
        CvSections sections = segmenter.segment(CV, 10);

        assertThat(sections.sections()).containsOnlyKeys(
                CvSections.SUMMARY, CvSections.EXPERIENCE, CvSections.EDUCATION, CvSections.SKILLS);
        assertThat(sections.body(CvSections.EDUCATION)).containsExactly("MIT");
        assertThat(sections.body(CvSections.SKILLS)).contains("Java, SQL");
    }

    @Test
    @DisplayName("An inline header keeps its content as the first body line")
    void inlineHeader() {
        CvSections sections = segmenter.segment(CV, 10);

        assertThat(sections.body(CvSections.SUMMARY)).containsExactly("Backend developer.");
    }

    @Test
    @DisplayName("Label lines inside a job entry stay in the entry")
    void labelInsideEntry() {
        CvSections sections = segmenter.segment(CV, 10);

        assertThat(sections.body(CvSections.EXPERIENCE))
                .containsExactly("Dev en Globex", "Tecnologías: Docker, Kafka");
    }

    @Test
    @DisplayName("A repeated header appends to the same section")
    void repeatedHeader() {
        CvSections sections = segmenter.segment("Skills\nJava\nIdiomas\nInglés\nSkills\nGo", 10);

        assertThat(sections.body(CvSections.SKILLS)).containsExactly("Java", "Go");
        assertThat(sections.has(CvSections.LANGUAGES)).isTrue();
        assertThat(sections.has(CvSections.EDUCATION)).isFalse();
    }

    @Test
    @DisplayName("Custom header tables can be supplied")
    void customTable() {
        CvSectionSegmenter custom = new CvSectionSegmenter(Map.of("experience", List.of("werdegang")));
        CvSections sections = custom.segment("Max\nWERDEGANG\nEntwickler", 10);

        assertThat(sections.body(CvSections.EXPERIENCE)).containsExactly("Entwickler");
    }
}
