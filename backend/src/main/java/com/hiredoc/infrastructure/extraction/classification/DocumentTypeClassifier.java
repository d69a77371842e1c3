package com.hiredoc.infrastructure.extraction.classification;

import com.hiredoc.domain.document.model.DocumentType;
import com.hiredoc.infrastructure.extraction.preprocessing.KeywordTables;
import com.hiredoc.infrastructure.extraction.preprocessing.TextNormalizer;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Collections;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Scores document text against the per-type signal phrases and picks the best type.
 * <p>
 * Each phrase occurrence (whole-word, accent- and case-insensitive) adds the phrase weight to
 * its type. The highest non-zero score wins; ties go to the type with the lower
 * {@link DocumentType#classifierPriority()}. No hits at all yields {@link DocumentType#OTHER}.
 */
@Slf4j
@Component
public class DocumentTypeClassifier {

    private final Map<DocumentType, Map<Pattern, Integer>> signals;

    public DocumentTypeClassifier() {
        this(KeywordTables.documentSignals());
    }

    DocumentTypeClassifier(Map<DocumentType, Map<String, Integer>> phraseWeights) {
        Map<DocumentType, Map<Pattern, Integer>> compiled = new EnumMap<>(DocumentType.class);
        phraseWeights.forEach((type, phrases) -> {
            Map<Pattern, Integer> patterns = new LinkedHashMap<>();
            phrases.forEach((phrase, weight) -> patterns.put(phrasePattern(phrase), weight));
            compiled.put(type, Collections.unmodifiableMap(patterns));
        });
        this.signals = Collections.unmodifiableMap(compiled);
    }

    /**
     * Never throws; blank or unrecognized text is OTHER.
     */
    public DocumentType classify(String text) {
        if (text == null || text.isBlank()) {
            return DocumentType.OTHER;
        }
        Map<DocumentType, Integer> scores = score(text);

        DocumentType best = scores.entrySet().stream()
                .filter(e -> e.getValue() > 0)
                .min(Comparator.<Map.Entry<DocumentType, Integer>>comparingInt(Map.Entry::getValue).reversed()
                        .thenComparingInt(e -> e.getKey().classifierPriority()))
                .map(Map.Entry::getKey)
                .orElse(DocumentType.OTHER);

        log.debug("[Classifier] scores={} → {}", scores, best);
        return best;
    }

    /**
     * Weighted signal totals per type, in declaration order of the signal tables.
     */
    public Map<DocumentType, Integer> score(String text) {
        Map<DocumentType, Integer> scores = new EnumMap<>(DocumentType.class);
        String folded = TextNormalizer.fold(text);
        signals.forEach((type, patterns) -> {
            int total = 0;
            for (Map.Entry<Pattern, Integer> signal : patterns.entrySet()) {
                Matcher m = signal.getKey().matcher(folded);
                while (m.find()) {
                    total += signal.getValue();
                }
            }
            scores.put(type, total);
        });
        return scores;
    }

    private static Pattern phrasePattern(String phrase) {
        String[] words = phrase.strip().split("\\s+");
        StringBuilder regex = new StringBuilder("(?<![\\p{L}\\p{N}])");
        for (int i = 0; i < words.length; i++) {
            if (i > 0) {
                regex.append("\\s+");
            }
            regex.append(Pattern.quote(words[i]));
        }
        regex.append("(?![\\p{L}\\p{N}])");
        return Pattern.compile(regex.toString());
    }
}
