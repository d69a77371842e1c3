package com.hiredoc.infrastructure.extraction.preprocessing;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class EntityCleanerTest {

    private EntityCleaner cleaner;

    @BeforeEach
    void setUp() {
        cleaner = new EntityCleaner();
    }

    @Nested
    @DisplayName("Person names")
    class PersonNames {

        @Test
        @DisplayName("Honorifics are dropped and particles stay lower case")
        void honorificsAndParticles() {
            assertThat(cleaner.cleanPersonName("DR. JUAN DE LA CRUZ")).isEqualTo("Juan de la Cruz");
            assertThat(cleaner.cleanPersonName("Lic. María del Carmen López")).isEqualTo("María del Carmen López");
        }

        @Test
        @DisplayName("Stacked honorifics are all removed")
        void stackedHonorifics() {
            assertThat(cleaner.cleanPersonName("Sr. Ing. pedro ramírez")).isEqualTo("Pedro Ramírez");
        }

        @Test
        @DisplayName("Digits and symbols are removed")
        void strayCharacters() {
            assertThat(cleaner.cleanPersonName("Ana  Gómez #1")).isEqualTo("Ana Gómez");
        }

        @Test
        @DisplayName("A leading particle is capitalized")
        void leadingParticle() {
            assertThat(cleaner.cleanPersonName("de la fuente")).isEqualTo("De la Fuente");
        }

        @Test
        @DisplayName("Blank or symbol-only input yields null")
        void blank() {
            assertThat(cleaner.cleanPersonName("  ")).isNull();
            assertThat(cleaner.cleanPersonName("###")).isNull();
        }
    }

    @Nested
    @DisplayName("Company names")
    class Companies {

        @Test
        @DisplayName("Legal-form suffixes are removed")
        void suffixes() {
            assertThat(cleaner.cleanCompanyName("TechCorp S.A. de C.V.")).isEqualTo("TechCorp");
            assertThat(cleaner.cleanCompanyName("Acme, Inc.")).isEqualTo("Acme");
            assertThat(cleaner.cleanCompanyName("Globex LLC")).isEqualTo("Globex");
        }

        @Test
        @DisplayName("A suffix glued to the name is part of the name")
        void gluedSuffix() {
            assertThat(cleaner.cleanCompanyName("TechCorp")).isEqualTo("TechCorp");
        }

        @Test
        @DisplayName("A name that is only a suffix is kept")
        void onlySuffix() {
            assertThat(cleaner.cleanCompanyName("LLC")).isEqualTo("LLC");
        }
    }

    @Nested
    @DisplayName("Skills and degrees")
    class SkillsAndDegrees {

        @Test
        @DisplayName("Aliases map to canonical names")
        void aliases() {
            assertThat(cleaner.canonicalSkill("js")).isEqualTo("JavaScript");
            assertThat(cleaner.canonicalSkill("K8s")).isEqualTo("Kubernetes");
            assertThat(cleaner.canonicalSkill("golang")).isEqualTo("Go");
        }

        @Test
        @DisplayName("Case variants of non-aliases are kept as written")
        void caseVariantsUntouched() {
            assertThat(cleaner.canonicalSkill("python")).isEqualTo("python");
            assertThat(cleaner.canonicalSkill("  Spring Boot ")).isEqualTo("Spring Boot");
        }

        @Test
        @DisplayName("Degrees are standardized, unknown ones kept")
        void degrees() {
            assertThat(cleaner.standardizeDegree("Licenciatura en Informática")).isEqualTo("Bachelor's Degree");
            assertThat(cleaner.standardizeDegree("Maestría en Ciencia de Datos")).isEqualTo("Master's Degree");
            assertThat(cleaner.standardizeDegree("Ph.D. in Physics")).isEqualTo("PhD");
            assertThat(cleaner.standardizeDegree("Diplomado en Ventas")).isEqualTo("Diplomado en Ventas");
        }
    }
}
