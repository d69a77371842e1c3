package com.hiredoc;

import com.hiredoc.application.document.DocumentParsingAppService;
import com.hiredoc.domain.document.model.DocumentType;
import com.hiredoc.domain.document.model.ParseResult;
import com.hiredoc.domain.document.model.ProcessingStatus;
import com.hiredoc.infrastructure.extraction.ExtractionSettings;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;

import static org.assertj.core.api.Assertions.assertThat;

@SpringBootTest(properties = "extraction.max-quotes=3")
class HireDocApplicationTest {

    @Autowired
    private DocumentParsingAppService parsingService;

    @Autowired
    private ExtractionSettings settings;

    @Test
    void settingsBoundFromProperties() {
        assertThat(settings.maxQuotes()).isEqualTo(3);
        assertThat(settings.extractorVersion()).isEqualTo("1.0.0");
    }

    @Test
    void parsesThroughTheWiredPipeline() {
        ParseResult result = parsingService.parse("ctx-1",
                "Reporte Factor Oscuro de la Personalidad\nSinceridad: 88.0\nEgocentrismo: 72.5", "dfi.txt");

        assertThat(result.status()).isEqualTo(ProcessingStatus.COMPLETED);
        assertThat(result.documentType()).isEqualTo(DocumentType.ASSESSMENT);
        assertThat(result.extraction().data()).containsEntry("test_name", "Dark Factor Inventory");
    }
}
