package com.hiredoc.application.document.exception;

public class DocumentTooLargeException extends RuntimeException {
    public DocumentTooLargeException(int length, int maxLength) {
        super(String.format("Document text has %d characters; at most %d are accepted.", length, maxLength));
    }
}
