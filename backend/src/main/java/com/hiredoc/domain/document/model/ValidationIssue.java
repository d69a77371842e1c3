package com.hiredoc.domain.document.model;

/**
 * Individual validation finding.
 *
 * @param field    dotted path of the offending field, e.g. {@code scores.Egocentrism}
 * @param message  human-readable description
 * @param severity ERROR blocks validity, WARNING is flagged for review only
 */
public record ValidationIssue(
        String field,
        String message,
        Severity severity
) {
    public enum Severity {
        ERROR,
        WARNING
    }

    public static ValidationIssue error(String field, String message) {
        return new ValidationIssue(field, message, Severity.ERROR);
    }

    public static ValidationIssue warning(String field, String message) {
        return new ValidationIssue(field, message, Severity.WARNING);
    }
}
