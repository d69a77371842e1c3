package com.hiredoc.infrastructure.extraction;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;
import org.springframework.validation.annotation.Validated;

/**
 * Tunables of the extraction pipeline, bound from {@code extraction.*}.
 *
 * @param extractorVersion  version stamped on every extraction result
 * @param maxTextLength     longest document text accepted by the application service
 * @param rawTextLimit      number of leading characters copied into {@code raw_text}
 * @param contactBlockLines how many leading CV lines may hold contact data
 * @param maxQuotes         cap on interview key quotes
 * @param maxFlags          cap on interview risk flags, strengths and concerns
 */
@Validated
@ConfigurationProperties(prefix = "extraction")
public record ExtractionSettings(
        @DefaultValue("1.0.0") @NotBlank String extractorVersion,
        @DefaultValue("200000") @Min(1) int maxTextLength,
        @DefaultValue("5000") @Min(100) int rawTextLimit,
        @DefaultValue("10") @Min(1) @Max(50) int contactBlockLines,
        @DefaultValue("5") @Min(1) int maxQuotes,
        @DefaultValue("5") @Min(1) int maxFlags
) {

    public static ExtractionSettings defaults() {
        return new ExtractionSettings("1.0.0", 200_000, 5000, 10, 5, 5);
    }

    public String truncateRaw(String text) {
        if (text == null || text.length() <= rawTextLimit) {
            return text;
        }
        return text.substring(0, rawTextLimit);
    }
}
