package com.hiredoc.infrastructure.extraction.pipeline;

import com.hiredoc.domain.document.model.AssessmentData;
import com.hiredoc.domain.document.model.AssessmentDimension;
import com.hiredoc.domain.document.model.CvData;
import com.hiredoc.domain.document.model.DimensionCategory;
import com.hiredoc.domain.document.model.Education;
import com.hiredoc.domain.document.model.GenericDocument;
import com.hiredoc.domain.document.model.InterviewData;
import com.hiredoc.domain.document.model.WorkExperience;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class ConfidenceScorerTest {

    private final ConfidenceScorer scorer = new ConfidenceScorer();

    private static CvData cv(String name, String email, boolean experience, boolean education, boolean skills) {
        return new CvData(name, email, null, null, null, null,
                experience ? List.of(new WorkExperience("Acme", "Developer", "2020", null, true, null, null)) : List.of(),
                education ? List.of(new Education("UNAM", "Bachelor's Degree", null, "2012", "2016", false)) : List.of(),
                skills ? List.of("Java") : List.of(),
                List.of(), List.of(), "raw");
    }

    @Test
    @DisplayName("complete CV scores 1.0 exactly")
    void completeCv() {
        assertThat(scorer.score(cv("Juan", "juan@example.com", true, true, true))).isEqualTo(1.0);
    }

    @Test
    @DisplayName("name without email earns nothing for contact")
    void partialCv() {
        assertThat(scorer.score(cv("Juan", null, true, false, true))).isEqualTo(0.4);
        assertThat(scorer.score(cv("Juan", "juan@example.com", false, false, false))).isEqualTo(0.4);
        assertThat(scorer.score(cv(null, null, false, false, false))).isEqualTo(0.0);
    }

    @Test
    void assessment() {
        AssessmentDimension dimension = new AssessmentDimension("Egocentrism", 72.5, "Egocentrismo", DimensionCategory.DARK_FACTOR);
        assertThat(scorer.score(new AssessmentData("DFI", "personality_dark", null, null,
                List.of(dimension), List.of(), null, null, "raw"))).isEqualTo(0.85);
        assertThat(scorer.score(new AssessmentData("DFI", "personality_dark", null, null,
                List.of(), List.of(), null, null, "raw"))).isEqualTo(0.5);
    }

    @Test
    void interview() {
        assertThat(scorer.score(new InterviewData("general", null, null, "Buena entrevista.",
                List.of(), List.of(), List.of(), List.of(), "neutral", "REVIEW", "raw"))).isEqualTo(0.75);
        assertThat(scorer.score(new InterviewData("general", null, null, " ",
                List.of(), List.of(), List.of(), List.of(), "neutral", "REVIEW", "raw"))).isEqualTo(0.5);
    }

    @Test
    void genericDocument() {
        assertThat(scorer.score(new GenericDocument("Estimado equipo"))).isEqualTo(ConfidenceScorer.GENERIC_CONFIDENCE);
    }
}
