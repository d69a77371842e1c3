package com.hiredoc.application.document;

import com.hiredoc.application.document.exception.DocumentTooLargeException;
import com.hiredoc.domain.document.model.DocumentType;
import com.hiredoc.domain.document.model.ParseResult;
import com.hiredoc.infrastructure.extraction.ExtractionSettings;
import com.hiredoc.infrastructure.extraction.hash.ContentHashBuilder;
import com.hiredoc.infrastructure.extraction.pipeline.DocumentPipeline;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.Map;

/**
 * Entry point for the orchestration layer that feeds decoded documents in and
 * stores what comes out.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class DocumentParsingAppService {

    private final DocumentPipeline documentPipeline;
    private final ContentHashBuilder contentHashBuilder;
    private final ExtractionSettings settings;

    /**
     * Classify, extract and validate one document.
     *
     * @throws IllegalArgumentException  if {@code documentId} is blank
     * @throws DocumentTooLargeException if the text exceeds {@code extraction.max-text-length}
     */
    public ParseResult parse(String documentId, String text, String filenameHint, DocumentType typeHint) {
        if (documentId == null || documentId.isBlank()) {
            throw new IllegalArgumentException("documentId is required");
        }
        if (text != null && text.length() > settings.maxTextLength()) {
            log.warn("[DocumentParsing] {} rejected: {} characters", documentId, text.length());
            throw new DocumentTooLargeException(text.length(), settings.maxTextLength());
        }
        return documentPipeline.parse(documentId, text, filenameHint, typeHint);
    }

    public ParseResult parse(String documentId, String text, String filenameHint) {
        return parse(documentId, text, filenameHint, null);
    }

    /**
     * Submit reviewer-corrected data for a result in MANUAL_REVIEW.
     */
    public ParseResult confirm(ParseResult previous, Map<String, Object> confirmedData) {
        return documentPipeline.confirm(previous, confirmedData);
    }

    public String contentHash(String text) {
        return contentHashBuilder.hash(text);
    }

    /**
     * True when {@code text} is the same submission that produced {@code previous}.
     */
    public boolean isDuplicateOf(String text, ParseResult previous) {
        return contentHash(text).equals(previous.metadata().get("content_hash"));
    }
}
