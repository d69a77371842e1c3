package com.hiredoc.infrastructure.extraction.pipeline;

import com.hiredoc.domain.document.model.DocumentType;
import com.hiredoc.domain.document.model.ExtractionResult;
import com.hiredoc.domain.document.model.ParseResult;
import com.hiredoc.domain.document.model.ProcessingStatus;
import com.hiredoc.domain.document.model.ValidationResult;
import com.hiredoc.infrastructure.extraction.InvalidStatusTransitionException;
import lombok.Data;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Mutable context of one pipeline run. Owned by a single call; accumulates
 * the output of each stage and the status history.
 */
@Slf4j
@Data
public class DocumentPipelineContext {

    // --- Input ---
    private String documentId;
    private String originalText;
    private String filenameHint;
    private DocumentType typeHint;

    // --- Parsing / classification ---
    private String normalizedText;
    private DocumentType documentType;
    private boolean typeUndetermined;

    // --- Extraction / validation ---
    private ExtractionResult extraction;
    private ValidationResult validation;
    private String errorMessage;

    // --- Status ---
    private ProcessingStatus status = ProcessingStatus.UPLOADED;
    private List<ProcessingStatus> statusHistory = new ArrayList<>(List.of(ProcessingStatus.UPLOADED));
    private Map<String, Object> metadata = new LinkedHashMap<>();

    /**
     * Move to {@code next}, enforcing the {@link ProcessingStatus} state machine.
     *
     * @throws InvalidStatusTransitionException if the transition is not allowed
     */
    public void transitionTo(ProcessingStatus next) {
        if (!status.canTransitionTo(next)) {
            throw new InvalidStatusTransitionException(status, next);
        }
        log.debug("[DocumentPipeline] {}: {} -> {}", documentId, status, next);
        status = next;
        statusHistory.add(next);
    }

    /**
     * Build the result envelope from accumulated context.
     */
    public ParseResult toParseResult(long processingTimeMs) {
        Map<String, Object> meta = new LinkedHashMap<>(metadata);
        meta.put("status_history", statusHistory.stream().map(Enum::name).toList());

        return new ParseResult(
                documentId,
                status,
                resultText(),
                documentType,
                meta,
                extraction,
                validation,
                errorMessage,
                processingTimeMs
        );
    }

    // A failed document hands back the text exactly as submitted
    private String resultText() {
        if (status != ProcessingStatus.ERROR && normalizedText != null) {
            return normalizedText;
        }
        return originalText != null ? originalText : "";
    }
}
