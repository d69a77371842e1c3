package com.hiredoc.infrastructure.extraction.hash;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class ContentHashBuilderTest {

    private final ContentHashBuilder builder = new ContentHashBuilder();

    @Test
    void knownDigests() {
        assertThat(builder.hash("abc"))
                .isEqualTo("ba7816bf8f01cfea414140de5dae2223b00361a396177a9cb410ff61f20015ad");
        assertThat(builder.hash(""))
                .isEqualTo("e3b0c44298fc1c149afbf4c8996fb92427ae41e4649b934ca495991b7852b855");
    }

    @Test
    void nullHashesLikeEmpty() {
        assertThat(builder.hash(null)).isEqualTo(builder.hash(""));
    }

    @Test
    void hashIsOfTheExactText() {
        assertThat(builder.hash("Juan Pérez")).isEqualTo(builder.hash("Juan Pérez"));
        assertThat(builder.hash("Juan Pérez")).isNotEqualTo(builder.hash("Juan Perez"));
    }
}
