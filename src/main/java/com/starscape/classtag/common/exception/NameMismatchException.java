package com.starscape.classtag.common.exception;

import java.util.Map;

public class NameMismatchException extends DomainValidationException {

    public NameMismatchException(String expected, String provided) {
        super("Student name mismatch", Map.of("expected", expected, "provided", provided));
    }
}
