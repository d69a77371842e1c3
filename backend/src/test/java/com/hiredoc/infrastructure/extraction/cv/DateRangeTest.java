package com.hiredoc.infrastructure.extraction.cv;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class DateRangeTest {

    @Test
    @DisplayName("Month-name range ending in Presente is current")
    void currentRange() {
        DateRange range = DateRange.find("Enero 2020 - Presente").orElseThrow();

        assertThat(range.start()).isEqualTo("Enero 2020");
        assertThat(range.end()).isNull();
        assertThat(range.current()).isTrue();
        assertThat(range.fillsLine("Enero 2020 - Presente")).isTrue();
    }

    @Test
    @DisplayName("Numeric and English forms")
    void otherForms() {
        DateRange numeric = DateRange.find("03/2018 – 2021").orElseThrow();
        assertThat(numeric.start()).isEqualTo("03/2018");
        assertThat(numeric.end()).isEqualTo("2021");
        assertThat(numeric.current()).isFalse();

        DateRange english = DateRange.find("Jan 2019 to Mar 2021").orElseThrow();
        assertThat(english.start()).isEqualTo("Jan 2019");
        assertThat(english.end()).isEqualTo("Mar 2021");

        DateRange compact = DateRange.find("2015-2018").orElseThrow();
        assertThat(compact.start()).isEqualTo("2015");
        assertThat(compact.end()).isEqualTo("2018");
    }

    @Test
    @DisplayName("Text around the range is kept apart")
    void surroundingText() {
        String line = "Madrid | 2015 - 2018";
        DateRange range = DateRange.find(line).orElseThrow();

        assertThat(range.fillsLine(line)).isFalse();
        assertThat(range.removeFrom(line)).isEqualTo("Madrid");
    }

    @Test
    @DisplayName("A lone year is an end date")
    void singleDate() {
        DateRange single = DateRange.findSingle("Graduado 2016").orElseThrow();

        assertThat(single.start()).isNull();
        assertThat(single.end()).isEqualTo("2016");
    }

    @Test
    @DisplayName("Lines without a range")
    void noRange() {
        assertThat(DateRange.find("Versión 2.0 del sistema")).isEmpty();
        assertThat(DateRange.find(null)).isEmpty();
    }
}
