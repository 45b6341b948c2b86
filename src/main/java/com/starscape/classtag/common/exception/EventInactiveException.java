package com.starscape.classtag.common.exception;

public class EventInactiveException extends DomainValidationException {

    public EventInactiveException() {
        super("Event not active");
    }
}
