package com.hiredoc.domain.document.model;

import java.util.EnumSet;
import java.util.Set;

/**
 * State of one pipeline run.
 * <pre>
 * UPLOADED → PARSING → EXTRACTING → VALIDATING → {COMPLETED | ERROR | MANUAL_REVIEW}
 * MANUAL_REVIEW → CONFIRMED
 * </pre>
 * Any non-terminal state may also fall to ERROR.
 */
public enum ProcessingStatus {
    UPLOADED,
    PARSING,
    EXTRACTING,
    VALIDATING,
    COMPLETED,
    ERROR,
    MANUAL_REVIEW,
    CONFIRMED;

    public Set<ProcessingStatus> allowedNext() {
        return switch (this) {
            case UPLOADED -> EnumSet.of(PARSING, ERROR);
            case PARSING -> EnumSet.of(EXTRACTING, ERROR);
            case EXTRACTING -> EnumSet.of(VALIDATING, ERROR);
            case VALIDATING -> EnumSet.of(COMPLETED, ERROR, MANUAL_REVIEW);
            case MANUAL_REVIEW -> EnumSet.of(CONFIRMED);
            case COMPLETED, ERROR, CONFIRMED -> EnumSet.noneOf(ProcessingStatus.class);
        };
    }

    public boolean canTransitionTo(ProcessingStatus next) {
        return allowedNext().contains(next);
    }

    public boolean isTerminal() {
        return allowedNext().isEmpty();
    }

    /**
     * True for the states in which an {@link ExtractionResult} is attached to the envelope.
     */
    public boolean carriesExtraction() {
        return this == COMPLETED || this == MANUAL_REVIEW || this == CONFIRMED;
    }
}
