package com.hiredoc.domain.document.model;

/**
 * @param category  risk, strength, concern or neutral
 * @param sentiment positive, negative or neutral
 */
public record InterviewQuote(String text, String category, String sentiment) {
}
