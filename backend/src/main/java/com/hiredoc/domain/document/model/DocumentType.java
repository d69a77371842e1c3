package com.hiredoc.domain.document.model;

/**
 * Coarse semantic category of an input document. Assigned once per run.
 * <p>
 * {@code classifierPriority} breaks score ties: lower wins. Assessment and interview
 * vocabularies are narrower, so they outrank CV vocabulary.
 */
public enum DocumentType {
    CV("cv", 3),
    ASSESSMENT("assessment", 1),
    INTERVIEW("interview", 2),
    COVER_LETTER("cover_letter", 4),
    OTHER("other", 5);

    private final String value;
    private final int classifierPriority;

    DocumentType(String value, int classifierPriority) {
        this.value = value;
        this.classifierPriority = classifierPriority;
    }

    public String value() {
        return value;
    }

    public int classifierPriority() {
        return classifierPriority;
    }

    /**
     * Lenient lookup by wire value or enum name. Unknown or blank input maps to OTHER.
     */
    public static DocumentType fromValue(String raw) {
        if (raw == null || raw.isBlank()) {
            return OTHER;
        }
        String key = raw.strip();
        for (DocumentType type : values()) {
            if (type.value.equalsIgnoreCase(key) || type.name().equalsIgnoreCase(key)) {
                return type;
            }
        }
        if ("resume".equalsIgnoreCase(key)) {
            return CV;
        }
        return OTHER;
    }
}
