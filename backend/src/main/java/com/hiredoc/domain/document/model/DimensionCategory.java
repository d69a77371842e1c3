package com.hiredoc.domain.document.model;

import com.fasterxml.jackson.annotation.JsonValue;

public enum DimensionCategory {
    DARK_FACTOR("dark_factor"),
    DISC("disc"),
    BIG5("big5"),
    COGNITIVE("cognitive"),
    OTHER("other");

    private final String value;

    DimensionCategory(String value) {
        this.value = value;
    }

    @JsonValue
    public String value() {
        return value;
    }
}
