package com.hiredoc.infrastructure.extraction.interview;

import com.hiredoc.domain.document.model.DocumentType;
import com.hiredoc.domain.document.model.InterviewData;
import com.hiredoc.domain.document.model.InterviewQuote;
import com.hiredoc.domain.document.service.DocumentExtractor;
import com.hiredoc.infrastructure.extraction.EmptyInputException;
import com.hiredoc.infrastructure.extraction.ExtractionSettings;
import com.hiredoc.infrastructure.extraction.preprocessing.EntityCleaner;
import com.hiredoc.infrastructure.extraction.preprocessing.TextNormalizer;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Extracts an {@link InterviewData} record from interview notes.
 * <p>
 * Key-value header lines give interviewer, date and type. Quoted text, and dash lines under a
 * "candidate responses" header, become key quotes; the remaining prose is the summary. The last
 * "Recomendación/Recommendation:" line sets the recommendation and overall sentiment; without
 * one the sentiment comes from the quote tags and the recommendation from a keyword score.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class InterviewExtractor implements DocumentExtractor<InterviewData> {

    static final String HIGH_RISK_PREFIX = "HIGH RISK: ";
    static final String MEDIUM_RISK_PREFIX = "MEDIUM RISK: ";

    static final String PROCEED = "PROCEED";
    static final String REVIEW = "REVIEW";
    static final String REJECT = "REJECT";

    private static final int CASE_FLAGS = Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE;

    // === Layout ===

    private static final Pattern METADATA_LINE = Pattern.compile(
            "^(?<key>entrevistador(?:a)?|interviewer|evaluador(?:a)?|reclutador(?:a)?|recruiter|fecha(?:\\s+de\\s+(?:la\\s+)?entrevista)?"
                    + "|date|tipo(?:\\s+de\\s+entrevista)?|(?:interview\\s+)?type|candidat[oa]|candidate|puesto|position|vacante)"
                    + "\\s*:\\s*(?<value>.+)$",
            CASE_FLAGS
    );

    private static final Pattern RECOMMENDATION_LINE = Pattern.compile(
            "^(?:recomendaci[oó]n|recommendation)(?:\\s+final)?\\s*:\\s*(.+)$", CASE_FLAGS);

    // "Respuestas del candidato:", "Observaciones:"
    private static final Pattern SECTION_HEADER = Pattern.compile("^[\\p{L}][\\p{L}\\s]{1,40}:$");

    private static final Pattern RESPONSES_HEADER = Pattern.compile(
            "^(?:respuestas(?:\\s+(?:del|de\\s+la)\\s+candidat[oa]|\\s+destacadas|\\s+clave)?|candidate\\s+responses"
                    + "|responses|citas(?:\\s+(?:textuales|clave))?|key\\s+quotes|quotes)$");

    private static final Pattern QUOTED = Pattern.compile("[\"“«]([^\"“”«»\\n]{3,}?)[\"”»]");

    private static final Pattern DASH_LINE = Pattern.compile("^[-–—•*]\\s*(.+)$");

    private static final Pattern SENTENCE_BREAK = Pattern.compile("(?<=[.!?])\\s+|\\n+");

    private static final int MAX_SUMMARY_SENTENCES = 5;
    private static final int MIN_FALLBACK_QUOTE = 50;
    private static final int MAX_FALLBACK_QUOTE = 300;
    private static final int MAX_FLAG_CONTEXT = 100;
    private static final int MAX_FINDING_CONTEXT = 150;
    private static final int MIN_FINDING_CONTEXT = 20;

    // === Lexicon (folded) ===

    private static final Pattern HIGH_RISK = words(
            "despedido", "despedida", "fired", "demandado", "demanda", "sued", "hostil", "hostile", "agresion",
            "agresivo", "aggression", "aggressive", "violencia", "violence", "drogas", "drugs", "fraude", "fraud",
            "robo", "theft", "mentir", "mintio", "lying", "lied", "falsificar", "falsifico", "acoso", "harassment");

    private static final Pattern MEDIUM_RISK = words(
            "conflicto", "conflictos", "conflict", "conflicts", "discusion", "argument", "problema", "problemas",
            "problem", "problems", "dificultad", "difficulty", "desacuerdo", "disagreement", "tension", "queja",
            "complaint", "reclamo", "grievance", "sancion", "sanction");

    private static final Pattern STRENGTH = words(
            "liderazgo", "leadership", "iniciativa", "initiative", "proactivo", "proactiva", "proactive",
            "resultados", "results", "logros", "achievements", "exito", "success", "excelente", "excellent",
            "destacado", "destacada", "outstanding", "innovacion", "innovation", "creatividad", "creativity",
            "trabajo en equipo", "teamwork", "colaboracion", "collaboration", "comunicacion", "communication",
            "negociacion", "negotiation", "adaptabilidad", "adaptability", "flexibilidad", "flexibility",
            "fortaleza", "fortalezas", "strength", "strengths");

    private static final Pattern CONCERN = words(
            "falta", "lack", "carencia", "deficiency", "ausencia", "absence", "limitado", "limitada", "limited",
            "insuficiente", "insufficient", "debil", "weak", "debilidad", "weakness", "necesita", "needs",
            "requiere", "requires", "mejorar", "improvement", "inexperiencia", "inexperience", "novato", "novice",
            "principiante", "beginner", "duda", "dudas", "doubt", "doubts", "incertidumbre", "uncertainty",
            "riesgo", "risk");

    private static final Pattern POSITIVE = words(
            "excelente", "excellent", "bueno", "buena", "good", "great", "genial", "fuerte", "strong", "logre",
            "logramos", "achieved", "exito", "success", "successful", "disfruto", "enjoy", "enjoyed", "me encanta",
            "love", "motivado", "motivada", "motivated", "orgulloso", "orgullosa", "proud", "aprendi", "learned",
            "mejore", "improved", "positivo", "positiva", "positive", "feliz", "happy", "satisfecho", "satisfied",
            "destacado", "outstanding", "resolvi", "solved", "lidere", "led", "apasiona", "passionate");

    private static final Pattern NEGATIVE = words(
            "malo", "mala", "bad", "dificil", "difficult", "problema", "problem", "conflicto", "conflict",
            "despedido", "fired", "odio", "hate", "frustrado", "frustrada", "frustrated", "fracaso", "failure",
            "falle", "failed", "error", "mistake", "negativo", "negativa", "negative", "debil", "weak", "tarde",
            "late", "no me gusta", "dislike", "aburrido", "bored", "estres", "stress", "stressed", "renuncie",
            "quit", "queja", "complaint", "pelea", "fight", "hostil", "hostile", "injusto", "unfair");

    // Recommendation values
    private static final Pattern REJECT_VALUE = words(
            "no recomendado", "no recomendada", "no recomendable", "no apto", "no apta", "rechazar", "rechazado",
            "descartar", "descartado", "no contratar", "desfavorable", "not recommended", "reject", "rejected",
            "do not hire", "no hire", "no avanzar", "no continuar");

    private static final Pattern REVIEW_VALUE = words(
            "revisar", "revision", "review", "con reservas", "condicional", "en espera", "on hold", "dudas",
            "pendiente", "maybe", "tal vez", "segunda entrevista", "second interview");

    private static final Pattern PROCEED_VALUE = words(
            "recomendado", "recomendada", "recomendable", "apto", "apta", "avanzar", "continuar", "contratar",
            "aprobado", "aprobada", "favorable", "proceed", "hire", "recommended", "advance", "si", "yes");

    // Checked in order; the first type with a hit wins
    private static final List<Map.Entry<String, Pattern>> INTERVIEW_TYPES = List.of(
            Map.entry("technical", words("tecnica", "tecnico", "technical", "coding", "codigo", "programacion")),
            Map.entry("behavioral", words("conductual", "behavioral", "behavioural", "situacional", "situational", "star")),
            Map.entry("cultural_fit", words("cultural", "cultura", "culture fit", "fit cultural")),
            Map.entry("competency", words("competencias", "competency", "competencies", "por competencias")),
            Map.entry("final", words("final", "cierre", "closing")),
            Map.entry("screening", words("inicial", "initial", "screening", "filtro", "preseleccion", "telefonica", "phone screen"))
    );

    private static final String GENERAL_TYPE = "general";

    private final TextNormalizer textNormalizer;
    private final EntityCleaner entityCleaner;
    private final ExtractionSettings settings;

    @Override
    public DocumentType supportedType() {
        return DocumentType.INTERVIEW;
    }

    @Override
    public InterviewData extract(String text) {
        EmptyInputException.requireText(text, DocumentType.INTERVIEW);
        String normalized = textNormalizer.normalize(text);
        EmptyInputException.requireText(normalized, DocumentType.INTERVIEW);

        Layout layout = readLayout(normalized);
        List<InterviewQuote> quotes = layout.quotes.isEmpty() ? fallbackQuotes(normalized) : layout.quotes;
        quotes = quotes.subList(0, Math.min(quotes.size(), settings.maxQuotes()));

        List<String> sentences = sentences(normalized);
        List<String> flags = detectFlags(sentences);
        List<String> strengths = findings(sentences, STRENGTH);
        List<String> concerns = findings(sentences, CONCERN);

        String overallSentiment;
        String recommendation;
        if (layout.recommendation != null) {
            recommendation = canonicalRecommendation(layout.recommendation);
            overallSentiment = sentimentOfRecommendation(recommendation);
        } else {
            overallSentiment = sentimentFromQuotes(quotes);
            recommendation = recommend(flags, strengths, concerns, overallSentiment);
        }

        String interviewType = layout.type != null
                ? detectType(TextNormalizer.fold(layout.type))
                : detectType(TextNormalizer.fold(layout.typeSource()));

        log.debug("[InterviewExtractor] type={}, quotes={}, flags={}, strengths={}, concerns={}, recommendation={}",
                interviewType, quotes.size(), flags.size(), strengths.size(), concerns.size(), recommendation);

        return new InterviewData(
                interviewType,
                layout.interviewer,
                layout.date,
                summarize(layout.narrative),
                quotes,
                flags,
                strengths,
                concerns,
                overallSentiment,
                recommendation,
                settings.truncateRaw(normalized)
        );
    }

    // ===== Layout: metadata, quotes, narrative =====

    private static final class Layout {
        private String interviewer;
        private String date;
        private String type;
        private String title;
        private String recommendation;
        private final List<InterviewQuote> quotes = new ArrayList<>();
        private final List<String> narrative = new ArrayList<>();

        String typeSource() {
            return (title != null ? title + "\n" : "") + String.join("\n", narrative);
        }
    }

    private Layout readLayout(String text) {
        Layout layout = new Layout();
        boolean inResponses = false;

        for (String rawLine : TextNormalizer.lines(text)) {
            String line = rawLine.strip();
            if (line.isEmpty()) {
                continue;
            }
            if (layout.title == null) {
                layout.title = line;
            }
            Matcher recommendation = RECOMMENDATION_LINE.matcher(line);
            if (recommendation.matches()) {
                // Last explicit recommendation wins
                layout.recommendation = recommendation.group(1).strip();
                continue;
            }
            Matcher meta = METADATA_LINE.matcher(line);
            if (meta.matches()) {
                readMetadata(layout, TextNormalizer.fold(meta.group("key")), meta.group("value").strip());
                continue;
            }
            if (SECTION_HEADER.matcher(line).matches()) {
                String header = TextNormalizer.fold(line.substring(0, line.length() - 1)).strip();
                inResponses = RESPONSES_HEADER.matcher(header).matches();
                continue;
            }

            Matcher dash = DASH_LINE.matcher(line);
            if (inResponses && dash.matches()) {
                addQuote(layout.quotes, stripQuotes(dash.group(1)));
                continue;
            }
            Matcher quoted = QUOTED.matcher(line);
            boolean hadQuote = false;
            while (quoted.find()) {
                addQuote(layout.quotes, quoted.group(1));
                hadQuote = true;
            }
            String prose = hadQuote ? QUOTED.matcher(line).replaceAll(" ").strip() : line;
            if (!prose.isEmpty() && prose.chars().anyMatch(Character::isLetter)) {
                layout.narrative.add(prose);
            }
        }
        return layout;
    }

    private void readMetadata(Layout layout, String key, String value) {
        if (key.startsWith("entrevistador") || key.equals("interviewer") || key.startsWith("evaluador")
                || key.startsWith("reclutador") || key.equals("recruiter")) {
            if (layout.interviewer == null) {
                layout.interviewer = entityCleaner.cleanPersonName(value);
            }
        } else if (key.startsWith("fecha") || key.equals("date")) {
            if (layout.date == null) {
                layout.date = value;
            }
        } else if (key.startsWith("tipo") || key.endsWith("type")) {
            if (layout.type == null) {
                layout.type = value;
            }
        }
    }

    private void addQuote(List<InterviewQuote> quotes, String rawText) {
        String quote = textNormalizer.collapse(rawText);
        if (quote == null || quote.isEmpty()) {
            return;
        }
        String folded = TextNormalizer.fold(quote);
        quotes.add(new InterviewQuote(quote, categorize(folded), polarity(folded)));
    }

    private static String stripQuotes(String text) {
        return text.strip().replaceAll("^[\"“«]+|[\"”»]+$", "");
    }

    /**
     * Without explicit quotes, notable sentences that mention a risk or a strength stand in.
     */
    private List<InterviewQuote> fallbackQuotes(String text) {
        List<InterviewQuote> quotes = new ArrayList<>();
        for (String sentence : sentences(text)) {
            if (sentence.length() <= MIN_FALLBACK_QUOTE || sentence.length() >= MAX_FALLBACK_QUOTE) {
                continue;
            }
            if (METADATA_LINE.matcher(sentence).matches() || RECOMMENDATION_LINE.matcher(sentence).matches()) {
                continue;
            }
            String folded = TextNormalizer.fold(sentence);
            if (HIGH_RISK.matcher(folded).find() || STRENGTH.matcher(folded).find()) {
                addQuote(quotes, sentence);
            }
        }
        return quotes;
    }

    // ===== Tagging =====

    String categorize(String folded) {
        if (HIGH_RISK.matcher(folded).find() || MEDIUM_RISK.matcher(folded).find()) {
            return "risk";
        }
        if (STRENGTH.matcher(folded).find()) {
            return "strength";
        }
        if (CONCERN.matcher(folded).find()) {
            return "concern";
        }
        return "neutral";
    }

    String polarity(String folded) {
        int positive = count(POSITIVE, folded);
        int negative = count(NEGATIVE, folded);
        if (positive > negative) {
            return "positive";
        }
        if (negative > positive) {
            return "negative";
        }
        return "neutral";
    }

    private static String sentimentFromQuotes(List<InterviewQuote> quotes) {
        boolean positive = quotes.stream().anyMatch(q -> "positive".equals(q.sentiment()));
        boolean negative = quotes.stream().anyMatch(q -> "negative".equals(q.sentiment()));
        if (positive && negative) {
            return "mixed";
        }
        if (positive) {
            return "positive";
        }
        if (negative) {
            return "negative";
        }
        return "neutral";
    }

    // ===== Recommendation =====

    /**
     * Map a written recommendation to PROCEED, REVIEW or REJECT; unrecognized text is kept as written.
     */
    String canonicalRecommendation(String value) {
        String folded = TextNormalizer.fold(value);
        if (REJECT_VALUE.matcher(folded).find()) {
            return REJECT;
        }
        if (REVIEW_VALUE.matcher(folded).find()) {
            return REVIEW;
        }
        if (PROCEED_VALUE.matcher(folded).find()) {
            return PROCEED;
        }
        return textNormalizer.collapse(value);
    }

    private static String sentimentOfRecommendation(String recommendation) {
        return switch (recommendation) {
            case PROCEED -> "positive";
            case REJECT -> "negative";
            case REVIEW -> "mixed";
            default -> "neutral";
        };
    }

    /**
     * Keyword score: +2 per strength, -5 per high risk, -2 per medium risk, -1 per concern,
     * +/-3 for positive/negative sentiment. Any high risk or a score below -5 rejects; a score
     * above 5 with non-negative sentiment proceeds; anything else needs review.
     */
    String recommend(List<String> flags, List<String> strengths, List<String> concerns, String sentiment) {
        long high = flags.stream().filter(f -> f.startsWith(HIGH_RISK_PREFIX)).count();
        long medium = flags.stream().filter(f -> f.startsWith(MEDIUM_RISK_PREFIX)).count();

        long score = strengths.size() * 2L - high * 5 - medium * 2 - concerns.size();
        if ("positive".equals(sentiment)) {
            score += 3;
        } else if ("negative".equals(sentiment)) {
            score -= 3;
        }

        if (high > 0 || score < -5) {
            return REJECT;
        }
        if (score > 5 && ("positive".equals(sentiment) || "neutral".equals(sentiment))) {
            return PROCEED;
        }
        return REVIEW;
    }

    // ===== Findings =====

    private List<String> detectFlags(List<String> sentences) {
        List<String> flags = new ArrayList<>();
        List<String> contexts = new ArrayList<>();
        addFlags(sentences, HIGH_RISK, HIGH_RISK_PREFIX, flags, contexts);
        addFlags(sentences, MEDIUM_RISK, MEDIUM_RISK_PREFIX, flags, contexts);
        return flags.subList(0, Math.min(flags.size(), settings.maxFlags()));
    }

    private void addFlags(List<String> sentences, Pattern keywords, String prefix,
                          List<String> flags, List<String> contexts) {
        for (String sentence : sentences) {
            if (RECOMMENDATION_LINE.matcher(sentence).matches()) {
                continue;
            }
            if (keywords.matcher(TextNormalizer.fold(sentence)).find() && !contexts.contains(sentence)) {
                contexts.add(sentence);
                flags.add(prefix + truncate(sentence, MAX_FLAG_CONTEXT));
            }
        }
    }

    private List<String> findings(List<String> sentences, Pattern keywords) {
        List<String> found = new ArrayList<>();
        for (String sentence : sentences) {
            if (sentence.length() <= MIN_FINDING_CONTEXT) {
                continue;
            }
            if (METADATA_LINE.matcher(sentence).matches() || RECOMMENDATION_LINE.matcher(sentence).matches()) {
                continue;
            }
            if (keywords.matcher(TextNormalizer.fold(sentence)).find()) {
                String context = truncate(sentence, MAX_FINDING_CONTEXT);
                if (!found.contains(context)) {
                    found.add(context);
                }
            }
            if (found.size() == settings.maxFlags()) {
                break;
            }
        }
        return found;
    }

    // ===== Helpers =====

    String detectType(String folded) {
        for (Map.Entry<String, Pattern> type : INTERVIEW_TYPES) {
            if (type.getValue().matcher(folded).find()) {
                return type.getKey();
            }
        }
        return GENERAL_TYPE;
    }

    private String summarize(List<String> narrative) {
        String joined = textNormalizer.collapse(String.join(" ", narrative));
        if (joined == null || joined.isEmpty()) {
            return null;
        }
        String[] parts = joined.split("(?<=[.!?])\\s+");
        return String.join(" ", Arrays.asList(parts).subList(0, Math.min(parts.length, MAX_SUMMARY_SENTENCES)));
    }

    private List<String> sentences(String text) {
        return Arrays.stream(SENTENCE_BREAK.split(text))
                .map(String::strip)
                .map(s -> DASH_LINE.matcher(s).replaceFirst("$1"))
                .filter(s -> !s.isEmpty())
                .toList();
    }

    private static String truncate(String text, int max) {
        return text.length() <= max ? text : text.substring(0, max).strip();
    }

    private static int count(Pattern pattern, String text) {
        Matcher m = pattern.matcher(text);
        int n = 0;
        while (m.find()) {
            n++;
        }
        return n;
    }

    private static Pattern words(String... phrases) {
        String alternation = String.join("|", Arrays.stream(phrases)
                .map(p -> Pattern.quote(p).replace(" ", "\\E\\s+\\Q"))
                .toList());
        return Pattern.compile("(?<!\\p{L})(?:" + alternation + ")(?!\\p{L})");
    }
}
