package com.hiredoc.domain.document.model;

/**
 * A dimension whose source value fell outside [0, 100]. It is never turned into an
 * {@link AssessmentDimension}; the validator reports it as an error instead.
 */
public record RejectedDimension(String name, double rawValue, String description) {
}
