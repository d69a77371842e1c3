package com.hiredoc.infrastructure.extraction.cv;

import com.hiredoc.domain.document.model.CvData;
import com.hiredoc.domain.document.model.DocumentType;
import com.hiredoc.domain.document.model.Education;
import com.hiredoc.domain.document.model.WorkExperience;
import com.hiredoc.infrastructure.extraction.EmptyInputException;
import com.hiredoc.infrastructure.extraction.ExtractionSettings;
import com.hiredoc.infrastructure.extraction.preprocessing.EntityCleaner;
import com.hiredoc.infrastructure.extraction.preprocessing.FieldNormalizer;
import com.hiredoc.infrastructure.extraction.preprocessing.TextNormalizer;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.NullAndEmptySource;
import org.junit.jupiter.params.provider.ValueSource;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class CvExtractorTest {

    private static final String FULL_CV = """
            Juan Pérez
            juan.perez@example.com | +52 55 1234 5678 | Ciudad de México, México
            linkedin.com/in/juanperez

            RESUMEN
            Desarrollador con 8 años de experiencia. Especialista en backend.

            EXPERIENCIA LABORAL
            Senior Developer en TechCorp
            Enero 2020 - Presente
            - Lideré la migración a microservicios

            Backend Developer, Acme S.A.
            Marzo 2017 - Diciembre 2019
            Ubicación: Monterrey

            EDUCACIÓN
            Licenciatura en Informática, Universidad Nacional Autónoma de México
            2012 - 2016

            HABILIDADES
            Python, python, PYTHON, Java, js

            IDIOMAS
            Español (nativo), Inglés avanzado
            """;

    private CvExtractor extractor;

    @BeforeEach
    void setUp() {
        extractor = new CvExtractor(
                new TextNormalizer(),
                new FieldNormalizer(),
                new EntityCleaner(),
                new CvSectionSegmenter(),
                ExtractionSettings.defaults()
        );
    }

    @Test
    @DisplayName("Handles the CV type")
    void supportedType() {
        assertThat(extractor.supportedType()).isEqualTo(DocumentType.CV);
    }

    @Nested
    @DisplayName("Contact block")
    class Contact {

        @Test
        @DisplayName("Name, email, phone, LinkedIn and location from a one-line header")
        void inlineContact() {
            CvData cv = extractor.extract(FULL_CV);

            assertThat(cv.fullName()).isEqualTo("Juan Pérez");
            assertThat(cv.email()).isEqualTo("juan.perez@example.com");
            assertThat(cv.phone()).isEqualTo("+525512345678");
            assertThat(cv.linkedin()).isEqualTo("https://linkedin.com/in/juanperez");
            assertThat(cv.location()).isEqualTo("Ciudad de México, México");
        }

        @Test
        @DisplayName("Labeled fields, document title and honorific")
        void labeledContact() {
            String text = """
                    CURRICULUM VITAE
                    Lic. Carlos Gómez
                    Tel: (55) 1234-5678
                    LinkedIn: carlosgomez
                    Ubicación: Guadalajara, Jalisco
                    """;

            CvData cv = extractor.extract(text);

            assertThat(cv.fullName()).isEqualTo("Carlos Gómez");
            assertThat(cv.phone()).isEqualTo("(55)1234-5678");
            assertThat(cv.linkedin()).isEqualTo("https://linkedin.com/in/carlosgomez");
            assertThat(cv.location()).isEqualTo("Guadalajara, Jalisco");
            assertThat(cv.email()).isNull();
        }
    }

    @Nested
    @DisplayName("Experience")
    class Experience {

        @Test
        @DisplayName("\"Title en Company\" followed by a current date range")
        void titleEnCompanyCurrent() {
            CvData cv = extractor.extract("Juan\nEXPERIENCIA\nSenior Developer en TechCorp\nEnero 2020 - Presente");

            assertThat(cv.experience()).hasSize(1);
            WorkExperience job = cv.experience().get(0);
            assertThat(job.title()).isEqualTo("Senior Developer");
            assertThat(job.company()).isEqualTo("TechCorp");
            assertThat(job.current()).isTrue();
            assertThat(job.endDate()).isNull();
            assertThat(job.startDate()).isEqualTo("Enero 2020");
        }

        @Test
        @DisplayName("Several entries with description, legal suffix and location")
        void severalEntries() {
            CvData cv = extractor.extract(FULL_CV);

            assertThat(cv.experience()).hasSize(2);
            WorkExperience first = cv.experience().get(0);
            assertThat(first.description()).isEqualTo("Lideré la migración a microservicios");

            WorkExperience second = cv.experience().get(1);
            assertThat(second.title()).isEqualTo("Backend Developer");
            assertThat(second.company()).isEqualTo("Acme");
            assertThat(second.startDate()).isEqualTo("Marzo 2017");
            assertThat(second.endDate()).isEqualTo("Diciembre 2019");
            assertThat(second.current()).isFalse();
            assertThat(second.location()).isEqualTo("Monterrey");
        }

        @Test
        @DisplayName("Dates on the header line")
        void inlineDates() {
            CvData cv = extractor.extract("Ana\nWork Experience\nEngineer at Acme Inc. | Jan 2018 - Dec 2019");

            WorkExperience job = cv.experience().get(0);
            assertThat(job.title()).isEqualTo("Engineer");
            assertThat(job.company()).isEqualTo("Acme");
            assertThat(job.startDate()).isEqualTo("Jan 2018");
            assertThat(job.endDate()).isEqualTo("Dec 2019");
        }
    }

    @Nested
    @DisplayName("Education")
    class EducationEntries {

        @Test
        @DisplayName("Degree en field, institution and year range")
        void degreeFieldInstitution() {
            Education education = extractor.extract(FULL_CV).education().get(0);

            assertThat(education.degree()).isEqualTo("Bachelor's Degree");
            assertThat(education.fieldOfStudy()).isEqualTo("Informática");
            assertThat(education.institution()).isEqualTo("Universidad Nacional Autónoma de México");
            assertThat(education.startDate()).isEqualTo("2012");
            assertThat(education.endDate()).isEqualTo("2016");
        }

        @Test
        @DisplayName("A single year is the end date")
        void singleYear() {
            Education education = extractor.extract("Ana\nEDUCATION\nMBA, IE Business School, 2019").education().get(0);

            assertThat(education.degree()).isEqualTo("MBA");
            assertThat(education.institution()).isEqualTo("IE Business School");
            assertThat(education.startDate()).isNull();
            assertThat(education.endDate()).isEqualTo("2019");
            assertThat(education.current()).isFalse();
        }
    }

    @Nested
    @DisplayName("Skills, languages, summary")
    class Lists {

        @Test
        @DisplayName("Case variants collapse to the first spelling, aliases are canonicalized")
        void delimitedSkills() {
            assertThat(extractor.extract(FULL_CV).skills()).containsExactly("Python", "Java", "JavaScript");
        }

        @Test
        @DisplayName("Free-form skills prose falls back to the technical-term scan")
        void proseSkills() {
            CvData cv = extractor.extract("Ana\nHABILIDADES\nExperiencia sólida en Python y desarrollo con React y Docker");

            assertThat(cv.skills()).containsExactly("Python", "React", "Docker");
        }

        @Test
        @DisplayName("A prose line with a comma is scanned for terms, list lines are still split")
        void proseLineWithComma() {
            CvData cv = extractor.extract("""
                    Ana Ruiz
                    HABILIDADES
                    Tengo experiencia con Python y Docker, además de PostgreSQL
                    Git, Jira
                    """);

            assertThat(cv.skills()).containsExactly("Python", "Docker", "PostgreSQL", "Git", "Jira");
        }

        @Test
        @DisplayName("Without a skills section the whole text is scanned")
        void noSkillsSection() {
            CvData cv = extractor.extract("María López\nmaria@example.com\nTrabajé con Docker y Kubernetes sobre AWS.");

            assertThat(cv.skills()).containsExactly("Docker", "Kubernetes", "AWS");
        }

        @Test
        @DisplayName("Known language names are listed once")
        void languages() {
            assertThat(extractor.extract(FULL_CV).languages()).containsExactly("Español", "Inglés");
        }

        @Test
        @DisplayName("Summary section is collapsed to one paragraph")
        void summary() {
            assertThat(extractor.extract(FULL_CV).summary())
                    .isEqualTo("Desarrollador con 8 años de experiencia. Especialista en backend.");
        }

        @Test
        @DisplayName("Raw text is kept")
        void rawText() {
            assertThat(extractor.extract(FULL_CV).rawText()).startsWith("Juan Pérez");
        }
    }

    @Nested
    @DisplayName("Empty input")
    class EmptyInput {

        @ParameterizedTest
        @NullAndEmptySource
        @ValueSource(strings = {"   ", "\n\t\n"})
        @DisplayName("Blank text raises EmptyInputException")
        void blank(String text) {
            assertThatThrownBy(() -> extractor.extract(text))
                    .isInstanceOf(EmptyInputException.class)
                    .satisfies(e -> assertThat(((EmptyInputException) e).getDocumentType()).isEqualTo(DocumentType.CV));
        }
    }
}
