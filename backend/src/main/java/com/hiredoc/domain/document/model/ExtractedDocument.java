package com.hiredoc.domain.document.model;

/**
 * Marker for the typed records produced by the per-type extractors.
 */
public interface ExtractedDocument {

    /**
     * First characters of the source text, kept for reviewers.
     */
    String rawText();
}
