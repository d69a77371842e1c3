package com.hiredoc.domain.document.model;

import java.util.List;

/**
 * Structured résumé record.
 *
 * @param skills case-insensitively unique, in order of first appearance, first-seen casing
 */
public record CvData(
        String fullName,
        String email,
        String phone,
        String location,
        String linkedin,
        String summary,
        List<WorkExperience> experience,
        List<Education> education,
        List<String> skills,
        List<String> languages,
        List<String> certifications,
        String rawText
) implements ExtractedDocument {
    public CvData {
        experience = experience == null ? List.of() : List.copyOf(experience);
        education = education == null ? List.of() : List.copyOf(education);
        skills = skills == null ? List.of() : List.copyOf(skills);
        languages = languages == null ? List.of() : List.copyOf(languages);
        certifications = certifications == null ? List.of() : List.copyOf(certifications);
    }
}
