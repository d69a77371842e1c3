package com.hiredoc.domain.document.model;

/**
 * Record for document types without a dedicated extractor (cover letters, unknown documents).
 */
public record GenericDocument(String rawText) implements ExtractedDocument {
}
