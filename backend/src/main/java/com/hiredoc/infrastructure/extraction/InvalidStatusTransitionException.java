package com.hiredoc.infrastructure.extraction;

import com.hiredoc.domain.document.model.ProcessingStatus;

public class InvalidStatusTransitionException extends RuntimeException {

    public InvalidStatusTransitionException(ProcessingStatus from, ProcessingStatus to) {
        super("Illegal processing status transition: " + from + " -> " + to);
    }
}
