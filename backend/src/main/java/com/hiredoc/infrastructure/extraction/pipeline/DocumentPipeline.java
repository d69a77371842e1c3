package com.hiredoc.infrastructure.extraction.pipeline;

import com.hiredoc.domain.document.model.AssessmentData;
import com.hiredoc.domain.document.model.DocumentType;
import com.hiredoc.domain.document.model.ExtractedDocument;
import com.hiredoc.domain.document.model.ExtractionResult;
import com.hiredoc.domain.document.model.GenericDocument;
import com.hiredoc.domain.document.model.ParseResult;
import com.hiredoc.domain.document.model.ProcessingStatus;
import com.hiredoc.domain.document.model.ValidationIssue;
import com.hiredoc.domain.document.model.ValidationResult;
import com.hiredoc.infrastructure.extraction.EmptyInputException;
import com.hiredoc.infrastructure.extraction.ExtractionSettings;
import com.hiredoc.infrastructure.extraction.InvalidStatusTransitionException;
import com.hiredoc.infrastructure.extraction.classification.DocumentTypeClassifier;
import com.hiredoc.infrastructure.extraction.hash.ContentHashBuilder;
import com.hiredoc.infrastructure.extraction.preprocessing.TextNormalizer;
import com.hiredoc.infrastructure.extraction.validation.ExtractionValidator;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Orchestrates one document run:
 * <p>
 * normalize → classify (or take the hint) → extract → score confidence → validate → route
 * </p>
 * Valid records end COMPLETED. Records with validation errors, or whose type could not be
 * determined, end in MANUAL_REVIEW. Any failure ends the run in ERROR with a short message;
 * nothing is rethrown to the caller.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class DocumentPipeline {

    static final String TYPE_UNDETERMINED_WARNING = "document type could not be determined";
    static final String EMPTY_DOCUMENT_MESSAGE = "The document contains no readable text.";
    static final String FAILED_DOCUMENT_MESSAGE = "The document could not be processed automatically. Please review it manually.";

    private final TextNormalizer textNormalizer;
    private final DocumentTypeClassifier classifier;
    private final ExtractorRegistry extractorRegistry;
    private final ExtractionValidator validator;
    private final ConfidenceScorer confidenceScorer;
    private final ExtractedDataMapper dataMapper;
    private final ContentHashBuilder hashBuilder;
    private final ExtractionSettings settings;
    private final Clock clock;

    /**
     * Run the pipeline over decoded document text.
     *
     * @param documentId   caller's identifier, echoed back
     * @param text         decoded document text
     * @param filenameHint original file name, informational only (nullable)
     * @param typeHint     caller-supplied type; skips the classifier but not extraction or validation (nullable)
     */
    public ParseResult parse(String documentId, String text, String filenameHint, DocumentType typeHint) {
        long start = System.nanoTime();

        DocumentPipelineContext ctx = new DocumentPipelineContext();
        ctx.setDocumentId(documentId);
        ctx.setOriginalText(text);
        ctx.setFilenameHint(filenameHint);
        ctx.setTypeHint(typeHint);
        ctx.getMetadata().put("content_hash", hashBuilder.hash(text));
        if (filenameHint != null && !filenameHint.isBlank()) {
            ctx.getMetadata().put("filename", filenameHint);
        }

        try {
            // 1. Parse + classify
            ctx.transitionTo(ProcessingStatus.PARSING);
            parseAndClassify(ctx);

            // 2. Extract
            ctx.transitionTo(ProcessingStatus.EXTRACTING);
            extract(ctx);

            // 3. Validate + route
            ctx.transitionTo(ProcessingStatus.VALIDATING);
            validateAndRoute(ctx);
        } catch (EmptyInputException e) {
            log.warn("[DocumentPipeline] {} has no extractable text ({})", documentId, e.getDocumentType().value());
            fail(ctx, EMPTY_DOCUMENT_MESSAGE);
        } catch (RuntimeException e) {
            log.error("[DocumentPipeline] {} failed in {}", documentId, ctx.getStatus(), e);
            fail(ctx, FAILED_DOCUMENT_MESSAGE);
        }

        long elapsedMs = (System.nanoTime() - start) / 1_000_000;
        ParseResult result = ctx.toParseResult(elapsedMs);

        log.info("[DocumentPipeline] {} done: type={}, status={}, confidence={}, errors={}, warnings={}, {}ms",
                documentId,
                result.documentType() != null ? result.documentType().value() : "-",
                result.status(),
                result.extraction() != null ? result.extraction().confidence() : "-",
                result.validation() != null ? result.validation().errors().size() : 0,
                result.validation() != null ? result.validation().warnings().size() : 0,
                elapsedMs);
        return result;
    }

    /**
     * Apply a reviewer's corrected record to a result waiting in MANUAL_REVIEW.
     * Valid data moves the result to CONFIRMED with confidence 1.0; invalid data leaves it
     * in MANUAL_REVIEW with the new validation report.
     *
     * @throws InvalidStatusTransitionException if {@code previous} is not in MANUAL_REVIEW
     */
    public ParseResult confirm(ParseResult previous, Map<String, Object> confirmedData) {
        if (previous.status() != ProcessingStatus.MANUAL_REVIEW) {
            throw new InvalidStatusTransitionException(previous.status(), ProcessingStatus.CONFIRMED);
        }
        long start = System.nanoTime();
        DocumentType type = previous.documentType();
        ValidationResult validation = validator.validate(type, confirmedData);

        if (!validation.isValid()) {
            log.warn("[DocumentPipeline] {} confirmation rejected, {} error(s) remain",
                    previous.documentId(), validation.errors().size());
            return new ParseResult(
                    previous.documentId(),
                    ProcessingStatus.MANUAL_REVIEW,
                    previous.text(),
                    type,
                    previous.metadata(),
                    previous.extraction(),
                    validation,
                    null,
                    (System.nanoTime() - start) / 1_000_000
            );
        }

        ExtractionResult confirmed = new ExtractionResult(
                type,
                1.0,
                confirmedData,
                Instant.now(clock),
                settings.extractorVersion(),
                List.of()
        );
        Map<String, Object> metadata = new LinkedHashMap<>(previous.metadata());
        List<Object> history = new ArrayList<>();
        if (metadata.get("status_history") instanceof List<?> previousHistory) {
            history.addAll(previousHistory);
        }
        history.add(ProcessingStatus.CONFIRMED.name());
        metadata.put("status_history", history);

        log.info("[DocumentPipeline] {} confirmed by reviewer", previous.documentId());
        return new ParseResult(
                previous.documentId(),
                ProcessingStatus.CONFIRMED,
                previous.text(),
                type,
                metadata,
                confirmed,
                validation,
                null,
                (System.nanoTime() - start) / 1_000_000
        );
    }

    // ===== Stages =====

    private void parseAndClassify(DocumentPipelineContext ctx) {
        String normalized = textNormalizer.normalize(ctx.getOriginalText());
        ctx.setNormalizedText(normalized != null ? normalized : "");
        ctx.getMetadata().put("character_count", ctx.getNormalizedText().length());

        if (ctx.getTypeHint() != null) {
            ctx.setDocumentType(ctx.getTypeHint());
            ctx.getMetadata().put("type_source", "hint");
            return;
        }
        DocumentType type = classifier.classify(ctx.getNormalizedText());
        ctx.setDocumentType(type);
        ctx.setTypeUndetermined(type == DocumentType.OTHER);
        ctx.getMetadata().put("type_source", "classifier");
    }

    private void extract(DocumentPipelineContext ctx) {
        DocumentType type = ctx.getDocumentType();
        String text = ctx.getNormalizedText();

        ExtractedDocument record = extractorRegistry.find(type)
                .<ExtractedDocument>map(extractor -> extractor.extract(text))
                .orElseGet(() -> genericRecord(type, text));

        List<String> warnings = new ArrayList<>();
        if (ctx.isTypeUndetermined()) {
            warnings.add(TYPE_UNDETERMINED_WARNING);
        }
        if (record instanceof AssessmentData assessment && !assessment.rejectedScores().isEmpty()) {
            warnings.add(assessment.rejectedScores().size() + " score(s) outside [0, 100] were rejected");
        }

        ctx.setExtraction(new ExtractionResult(
                type,
                confidenceScorer.score(record),
                dataMapper.toMap(record),
                Instant.now(clock),
                settings.extractorVersion(),
                warnings
        ));
    }

    private GenericDocument genericRecord(DocumentType type, String text) {
        EmptyInputException.requireText(text, type);
        return new GenericDocument(settings.truncateRaw(text));
    }

    private void validateAndRoute(DocumentPipelineContext ctx) {
        ValidationResult validation = validator.validate(ctx.getDocumentType(), ctx.getExtraction().data());
        ctx.setValidation(validation);

        if (!validation.isValid() || ctx.isTypeUndetermined()) {
            ctx.transitionTo(ProcessingStatus.MANUAL_REVIEW);
            if (!validation.isValid()) {
                log.warn("[DocumentPipeline] {} routed to manual review: {}",
                        ctx.getDocumentId(), validation.errors().stream().map(ValidationIssue::field).toList());
            } else {
                log.warn("[DocumentPipeline] {} routed to manual review: {}", ctx.getDocumentId(), TYPE_UNDETERMINED_WARNING);
            }
            return;
        }
        ctx.transitionTo(ProcessingStatus.COMPLETED);
    }

    private void fail(DocumentPipelineContext ctx, String message) {
        ctx.setErrorMessage(message);
        if (ctx.getStatus().canTransitionTo(ProcessingStatus.ERROR)) {
            ctx.transitionTo(ProcessingStatus.ERROR);
        }
    }
}
