package com.hiredoc.domain.document.service;

import com.hiredoc.domain.document.model.DocumentType;
import com.hiredoc.domain.document.model.ExtractedDocument;

/**
 * Capability shared by the per-type extractors. One implementation per {@link DocumentType}
 * that has a dedicated record; the pipeline dispatches on {@link #supportedType()}.
 *
 * @param <T> the typed record this extractor produces
 */
public interface DocumentExtractor<T extends ExtractedDocument> {

    /**
     * @return the document type this extractor handles
     */
    DocumentType supportedType();

    /**
     * Extract a typed record from already-decoded document text.
     *
     * @param text the document text
     * @return the structured record, never partially populated on failure
     * @throws com.hiredoc.infrastructure.extraction.EmptyInputException if the text is blank
     */
    T extract(String text);
}
