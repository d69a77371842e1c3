package com.hiredoc.domain.document.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * One work-experience entry of a CV. Dates are kept as written in the source;
 * the validator turns them into ISO-8601 values.
 * <p>
 * {@code current == true} implies {@code endDate == null}.
 */
public record WorkExperience(
        String company,
        String title,
        String startDate,
        String endDate,
        @JsonProperty("is_current") boolean current,
        String description,
        String location
) {
    public WorkExperience {
        if (current) {
            endDate = null;
        }
    }
}
