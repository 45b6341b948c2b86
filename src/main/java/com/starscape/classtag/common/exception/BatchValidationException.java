package com.starscape.classtag.common.exception;

import java.util.Map;

public class BatchValidationException extends DomainValidationException {

    public BatchValidationException(String message) {
        super(message);
    }

    public BatchValidationException(String message, Map<String, String> details) {
        super(message, details);
    }
}
