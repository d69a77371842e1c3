package com.hiredoc.infrastructure.extraction.preprocessing;

import com.hiredoc.domain.document.model.DocumentType;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class KeywordTablesTest {

    @Test
    @DisplayName("Section headers cover every CV section")
    void sectionHeaders() {
        assertThat(KeywordTables.sectionHeaders())
                .containsKeys("summary", "experience", "education", "skills", "languages", "certifications");
        assertThat(KeywordTables.sectionHeaders().get("experience"))
                .contains("experiencia laboral", "work experience");
    }

    @Test
    @DisplayName("Signal tables exist for every classifiable type, with folded keys")
    void documentSignals() {
        assertThat(KeywordTables.documentSignals())
                .containsKeys(DocumentType.CV, DocumentType.ASSESSMENT, DocumentType.INTERVIEW, DocumentType.COVER_LETTER)
                .doesNotContainKey(DocumentType.OTHER);
        assertThat(KeywordTables.documentSignals().get(DocumentType.CV)).containsKey("educacion");
        assertThat(KeywordTables.documentSignals().values())
                .allSatisfy(signals -> assertThat(signals.values()).allMatch(weight -> weight > 0));
    }

    @Test
    @DisplayName("Tables are read-only")
    void immutable() {
        assertThatThrownBy(() -> KeywordTables.sectionHeaders().put("hobbies", java.util.List.of()))
                .isInstanceOf(UnsupportedOperationException.class);
        assertThatThrownBy(() -> KeywordTables.documentSignals().get(DocumentType.CV).put("x", 1))
                .isInstanceOf(UnsupportedOperationException.class);
    }
}
