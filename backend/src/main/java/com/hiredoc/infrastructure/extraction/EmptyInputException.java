package com.hiredoc.infrastructure.extraction;

import com.hiredoc.domain.document.model.DocumentType;

/**
 * Raised when extraction is attempted on blank or whitespace-only text.
 */
public class EmptyInputException extends ExtractionException {

    private final DocumentType documentType;

    public EmptyInputException(DocumentType documentType) {
        super("Cannot extract " + documentType.value() + " data from empty text");
        this.documentType = documentType;
    }

    public DocumentType getDocumentType() {
        return documentType;
    }

    /**
     * Guard used at the top of every extractor.
     */
    public static void requireText(String text, DocumentType documentType) {
        if (text == null || text.isBlank()) {
            throw new EmptyInputException(documentType);
        }
    }
}
