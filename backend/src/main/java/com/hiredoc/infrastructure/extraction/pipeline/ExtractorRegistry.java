package com.hiredoc.infrastructure.extraction.pipeline;

import com.hiredoc.domain.document.model.DocumentType;
import com.hiredoc.domain.document.service.DocumentExtractor;
import org.springframework.stereotype.Component;

import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Closed mapping from document type to its extractor. Types without an entry
 * (cover letters, unknown documents) get a generic record from the pipeline.
 */
@Component
public class ExtractorRegistry {

    private final Map<DocumentType, DocumentExtractor<?>> extractors;

    public ExtractorRegistry(List<DocumentExtractor<?>> extractors) {
        Map<DocumentType, DocumentExtractor<?>> byType = new EnumMap<>(DocumentType.class);
        for (DocumentExtractor<?> extractor : extractors) {
            DocumentExtractor<?> previous = byType.put(extractor.supportedType(), extractor);
            if (previous != null) {
                throw new IllegalStateException("Two extractors registered for " + extractor.supportedType()
                        + ": " + previous.getClass().getSimpleName() + ", " + extractor.getClass().getSimpleName());
            }
        }
        this.extractors = Collections.unmodifiableMap(byType);
    }

    public Optional<DocumentExtractor<?>> find(DocumentType type) {
        return Optional.ofNullable(extractors.get(type));
    }
}
