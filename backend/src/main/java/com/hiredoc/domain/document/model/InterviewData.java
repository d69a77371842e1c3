package com.hiredoc.domain.document.model;

import java.util.List;

public record InterviewData(
        String interviewType,
        String interviewer,
        String date,
        String summary,
        List<InterviewQuote> keyQuotes,
        List<String> flags,
        List<String> strengths,
        List<String> concerns,
        String overallSentiment,
        String recommendation,
        String rawText
) implements ExtractedDocument {
    public InterviewData {
        keyQuotes = keyQuotes == null ? List.of() : List.copyOf(keyQuotes);
        flags = flags == null ? List.of() : List.copyOf(flags);
        strengths = strengths == null ? List.of() : List.copyOf(strengths);
        concerns = concerns == null ? List.of() : List.copyOf(concerns);
    }
}
