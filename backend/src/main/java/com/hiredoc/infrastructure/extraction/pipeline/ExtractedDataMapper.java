package com.hiredoc.infrastructure.extraction.pipeline;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.hiredoc.domain.document.model.ExtractedDocument;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Flattens typed extraction records into the snake_case field map carried by
 * {@link com.hiredoc.domain.document.model.ExtractionResult} and checked by the validator.
 */
@Component
public class ExtractedDataMapper {

    private static final TypeReference<LinkedHashMap<String, Object>> FIELD_MAP = new TypeReference<>() {
    };

    private final ObjectMapper snakeCaseMapper;

    public ExtractedDataMapper(ObjectMapper objectMapper) {
        this.snakeCaseMapper = objectMapper.copy()
                .setPropertyNamingStrategy(PropertyNamingStrategies.SNAKE_CASE);
    }

    public Map<String, Object> toMap(ExtractedDocument document) {
        return snakeCaseMapper.convertValue(document, FIELD_MAP);
    }
}
