package com.hiredoc.domain.document.model;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ProcessingStatusTest {

    @Test
    @DisplayName("happy path moves one stage at a time")
    void forwardTransitions() {
        assertThat(ProcessingStatus.UPLOADED.canTransitionTo(ProcessingStatus.PARSING)).isTrue();
        assertThat(ProcessingStatus.PARSING.canTransitionTo(ProcessingStatus.EXTRACTING)).isTrue();
        assertThat(ProcessingStatus.EXTRACTING.canTransitionTo(ProcessingStatus.VALIDATING)).isTrue();
        assertThat(ProcessingStatus.VALIDATING.allowedNext()).containsExactlyInAnyOrder(
                ProcessingStatus.COMPLETED, ProcessingStatus.ERROR, ProcessingStatus.MANUAL_REVIEW);
        assertThat(ProcessingStatus.UPLOADED.canTransitionTo(ProcessingStatus.COMPLETED)).isFalse();
    }

    @Test
    @DisplayName("only manual review can be confirmed")
    void confirmation() {
        assertThat(ProcessingStatus.MANUAL_REVIEW.canTransitionTo(ProcessingStatus.CONFIRMED)).isTrue();
        assertThat(ProcessingStatus.COMPLETED.canTransitionTo(ProcessingStatus.CONFIRMED)).isFalse();
        assertThat(ProcessingStatus.MANUAL_REVIEW.isTerminal()).isFalse();
        assertThat(ProcessingStatus.COMPLETED.isTerminal()).isTrue();
        assertThat(ProcessingStatus.ERROR.isTerminal()).isTrue();
        assertThat(ProcessingStatus.CONFIRMED.isTerminal()).isTrue();
    }

    @Test
    @DisplayName("the envelope drops fields its status does not carry")
    void envelopeShape() {
        ExtractionResult extraction = new ExtractionResult(DocumentType.OTHER, 0.3, null,
                Instant.EPOCH, "1.0.0", null);

        ParseResult error = new ParseResult("d", ProcessingStatus.ERROR, "x", DocumentType.OTHER,
                null, extraction, null, "failed", 1);
        ParseResult completed = new ParseResult("d", ProcessingStatus.COMPLETED, "x", DocumentType.OTHER,
                null, extraction, null, "ignored", 1);

        assertThat(error.extraction()).isNull();
        assertThat(error.errorMessage()).isEqualTo("failed");
        assertThat(completed.errorMessage()).isNull();
        assertThat(completed.extraction().warnings()).isEqualTo(List.of());
        assertThatThrownBy(() -> new ParseResult("d", ProcessingStatus.MANUAL_REVIEW, "x", DocumentType.OTHER,
                null, null, null, null, 1))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void confidenceMustBeAFraction() {
        assertThatThrownBy(() -> new ExtractionResult(DocumentType.CV, 1.5, null, Instant.EPOCH, "1.0.0", null))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @ParameterizedTest
    @CsvSource({
            "cv, CV",
            "ASSESSMENT, ASSESSMENT",
            "cover_letter, COVER_LETTER",
            "resume, CV",
            "memo, OTHER",
            "'', OTHER"
    })
    void typeFromWireValue(String raw, DocumentType expected) {
        assertThat(DocumentType.fromValue(raw)).isEqualTo(expected);
    }
}
