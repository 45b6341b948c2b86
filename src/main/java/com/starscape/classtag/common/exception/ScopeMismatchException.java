package com.starscape.classtag.common.exception;

public class ScopeMismatchException extends DomainValidationException {

    public ScopeMismatchException(String message) {
        super(message);
    }
}
