package com.hiredoc.domain.document.model;

import com.fasterxml.jackson.annotation.JsonProperty;

public record Education(
        String institution,
        String degree,
        String fieldOfStudy,
        String startDate,
        String endDate,
        @JsonProperty("is_current") boolean current
) {
    public Education {
        if (current) {
            endDate = null;
        }
    }
}
