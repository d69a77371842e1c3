package com.hiredoc.infrastructure.extraction.pipeline;

import com.hiredoc.domain.document.model.AssessmentData;
import com.hiredoc.domain.document.model.CvData;
import com.hiredoc.domain.document.model.ExtractedDocument;
import com.hiredoc.domain.document.model.InterviewData;
import org.springframework.stereotype.Component;

/**
 * Document-level confidence from field completeness. Incomplete records rank lower
 * but are never rejected here.
 * <ul>
 *   <li>CV: name and email 0.4, any experience 0.3, any education 0.2, any skill 0.1</li>
 *   <li>Assessment: 0.85 with at least one dimension, else 0.5</li>
 *   <li>Interview: 0.75 with a summary, else 0.5</li>
 *   <li>Anything else: 0.3</li>
 * </ul>
 */
@Component
public class ConfidenceScorer {

    static final double GENERIC_CONFIDENCE = 0.3;

    public double score(ExtractedDocument document) {
        if (document instanceof CvData cv) {
            return scoreCv(cv);
        }
        if (document instanceof AssessmentData assessment) {
            return assessment.scores().isEmpty() ? 0.5 : 0.85;
        }
        if (document instanceof InterviewData interview) {
            return isBlank(interview.summary()) ? 0.5 : 0.75;
        }
        return GENERIC_CONFIDENCE;
    }

    private double scoreCv(CvData cv) {
        // Summed in tenths to keep the result exact
        int tenths = 0;
        if (!isBlank(cv.fullName()) && !isBlank(cv.email())) {
            tenths += 4;
        }
        if (!cv.experience().isEmpty()) {
            tenths += 3;
        }
        if (!cv.education().isEmpty()) {
            tenths += 2;
        }
        if (!cv.skills().isEmpty()) {
            tenths += 1;
        }
        return tenths / 10.0;
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
