package com.hiredoc.infrastructure.extraction.assessment;

import com.hiredoc.domain.document.model.AssessmentData;
import com.hiredoc.domain.document.model.DimensionCategory;
import com.hiredoc.infrastructure.extraction.preprocessing.TextNormalizer;

import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Known psychometric test families and dimension names, Spanish and English.
 * Keys are folded (lower case, no accents).
 */
final class AssessmentDictionary {

    static final String UNKNOWN_TEST = AssessmentData.UNKNOWN_TEST_NAME;

    // Insertion order is match order
    private static final Map<String, String> TEST_ALIASES = orderedMap(
            "factor oscuro", "Dark Factor Inventory",
            "dark factor", "Dark Factor Inventory",
            "dfi", "Dark Factor Inventory",
            "dark triad", "Dark Triad",
            "triada oscura", "Dark Triad",
            "inteligencia ejecutiva", "Executive Intelligence",
            "executive intelligence", "Executive Intelligence",
            "disc", "DISC Assessment",
            "big five", "Big Five Personality",
            "cinco grandes", "Big Five Personality",
            "16pf", "16PF Personality",
            "mmi", "Multimodal Interview",
            "hogan", "Hogan Assessment",
            "papi", "PAPI Personality"
    );

    private static final Map<String, String> DIMENSIONS = orderedMap(
            // Dark factor
            "egocentrismo", "Egocentrism",
            "egocentrism", "Egocentrism",
            "egoismo", "Egoism",
            "egoism", "Egoism",
            "moralidad", "Moral Disengagement",
            "desapego moral", "Moral Disengagement",
            "desconexion moral", "Moral Disengagement",
            "moral disengagement", "Moral Disengagement",
            "narcisismo", "Narcissism",
            "narcissism", "Narcissism",
            "sicopatia", "Psychopathy",
            "psicopatia", "Psychopathy",
            "psychopathy", "Psychopathy",
            "manuabilidad", "Manipulativeness",
            "manipulacion", "Manipulativeness",
            "manipulativeness", "Manipulativeness",
            "machiavellian", "Machiavellianism",
            "machiavellianism", "Machiavellianism",
            "maquiavelismo", "Machiavellianism",
            "mentalidad psicopatica", "Psychopathic Mindset",
            "volatilidad", "Volatility",
            "volatility", "Volatility",
            "sadismo", "Sadism",
            "sadism", "Sadism",
            "resentimiento", "Spitefulness",
            "spitefulness", "Spitefulness",
            "interes propio", "Self-Interest",
            "self-interest", "Self-Interest",
            "superioridad", "Superiority",
            "superiority", "Superiority",
            "indiferencia", "Indifference",
            "indifference", "Indifference",
            "crueldad", "Cruelty",
            "cruelty", "Cruelty",
            // DISC
            "dominancia", "Dominance",
            "dominance", "Dominance",
            "influencia", "Influence",
            "influence", "Influence",
            "estabilidad", "Steadiness",
            "steadiness", "Steadiness",
            "cumplimiento", "Compliance",
            "conformidad", "Compliance",
            "compliance", "Compliance",
            // Big five
            "apertura", "Openness",
            "apertura a la experiencia", "Openness",
            "openness", "Openness",
            "consciencia", "Conscientiousness",
            "responsabilidad", "Conscientiousness",
            "conscientiousness", "Conscientiousness",
            "extraversion", "Extraversion",
            "extroversion", "Extraversion",
            "amabilidad", "Agreeableness",
            "agreeableness", "Agreeableness",
            "neuroticismo", "Neuroticism",
            "neuroticism", "Neuroticism",
            "estabilidad emocional", "Emotional Stability",
            "emotional stability", "Emotional Stability",
            // Executive intelligence
            "integracion", "Integration",
            "integration", "Integration",
            "imaginacion", "Imagination",
            "imagination", "Imagination",
            "innovacion", "Innovation",
            "innovation", "Innovation",
            "implementacion", "Implementation",
            "implementation", "Implementation",
            "ejecucion", "Execution",
            "execution", "Execution",
            "analisis", "Analysis",
            "analysis", "Analysis",
            "planeacion", "Planning",
            "planificacion", "Planning",
            "planning", "Planning",
            "sintesis", "Synthesis",
            "synthesis", "Synthesis"
    );

    private static final Map<String, DimensionCategory> CATEGORIES = categoryTable();

    // Validity scales: a separate trust indicator, never a dimension
    private static final Pattern SINCERITY_LABEL = Pattern.compile(
            "(?<!\\p{L})(?:sinceridad|sincerity|consistencia|consistency|validez|validity|validacion|validation"
                    + "|deseabilidad social|social desirability)(?!\\p{L})");

    // Header/metadata labels that carry numbers but are not scores
    private static final Set<String> NON_SCORE_LABELS = Set.of(
            "fecha", "date", "edad", "age", "nombre", "name", "candidato", "candidata", "candidate",
            "id", "folio", "telefono", "phone", "pagina", "page", "version", "tiempo", "time",
            "duracion", "duration", "hora", "ano", "year", "percentil", "percentile", "dimension",
            "dimensiones", "puntaje", "score", "no", "n", "total de reactivos", "reactivos", "items"
    );

    private static final List<Map.Entry<Pattern, String>> DIMENSION_PHRASES = DIMENSIONS.entrySet().stream()
            .sorted(Comparator.comparingInt((Map.Entry<String, String> e) -> e.getKey().length()).reversed())
            .map(e -> Map.entry(wholeWords(e.getKey()), e.getValue()))
            .toList();

    private static final List<Map.Entry<Pattern, String>> TEST_PHRASES = TEST_ALIASES.entrySet().stream()
            .map(e -> Map.entry(wholeWords(e.getKey()), e.getValue()))
            .toList();

    private AssessmentDictionary() {
    }

    /**
     * Canonical test family named anywhere in the folded text.
     */
    static Optional<String> testFamily(String foldedText) {
        return TEST_PHRASES.stream()
                .filter(e -> e.getKey().matcher(foldedText).find())
                .map(Map.Entry::getValue)
                .findFirst();
    }

    /**
     * Canonical dimension for a score label: exact alias first, then the longest alias
     * contained in the label as whole words.
     */
    static Optional<String> canonicalDimension(String foldedLabel) {
        String exact = DIMENSIONS.get(foldedLabel);
        if (exact != null) {
            return Optional.of(exact);
        }
        return DIMENSION_PHRASES.stream()
                .filter(e -> e.getKey().matcher(foldedLabel).find())
                .map(Map.Entry::getValue)
                .findFirst();
    }

    static DimensionCategory categoryOf(String canonicalName) {
        DimensionCategory category = CATEGORIES.get(canonicalName);
        return category != null ? category : DimensionCategory.OTHER;
    }

    static boolean isSincerityLabel(String foldedLabel) {
        return SINCERITY_LABEL.matcher(foldedLabel).find();
    }

    static boolean isNonScoreLabel(String foldedLabel) {
        if (NON_SCORE_LABELS.contains(foldedLabel)) {
            return true;
        }
        int space = foldedLabel.indexOf(' ');
        return space > 0 && NON_SCORE_LABELS.contains(foldedLabel.substring(0, space))
                && canonicalDimension(foldedLabel).isEmpty();
    }

    private static Map<String, DimensionCategory> categoryTable() {
        Map<String, DimensionCategory> table = new LinkedHashMap<>();
        for (String name : List.of("Egocentrism", "Egoism", "Moral Disengagement", "Narcissism", "Psychopathy",
                "Manipulativeness", "Machiavellianism", "Psychopathic Mindset", "Volatility", "Sadism",
                "Spitefulness", "Self-Interest", "Superiority", "Indifference", "Cruelty")) {
            table.put(name, DimensionCategory.DARK_FACTOR);
        }
        for (String name : List.of("Dominance", "Influence", "Steadiness", "Compliance")) {
            table.put(name, DimensionCategory.DISC);
        }
        for (String name : List.of("Openness", "Conscientiousness", "Extraversion", "Agreeableness",
                "Neuroticism", "Emotional Stability")) {
            table.put(name, DimensionCategory.BIG5);
        }
        for (String name : List.of("Integration", "Imagination", "Innovation", "Implementation", "Execution",
                "Analysis", "Planning", "Synthesis")) {
            table.put(name, DimensionCategory.COGNITIVE);
        }
        return Collections.unmodifiableMap(table);
    }

    private static Pattern wholeWords(String phrase) {
        return Pattern.compile("(?<![\\p{L}\\p{N}])" + Pattern.quote(phrase) + "(?![\\p{L}\\p{N}])");
    }

    private static Map<String, String> orderedMap(String... keyValues) {
        Map<String, String> map = new LinkedHashMap<>();
        for (int i = 0; i < keyValues.length; i += 2) {
            map.put(TextNormalizer.fold(keyValues[i]), keyValues[i + 1]);
        }
        return Collections.unmodifiableMap(map);
    }
}
