package com.starscape.classtag.common.exception;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Base class for request-level rule violations that carry structured details
 * back to the caller.
 */
public abstract class DomainValidationException extends RuntimeException {

    private final Map<String, String> details;

    protected DomainValidationException(String message) {
        this(message, Map.of());
    }

    protected DomainValidationException(String message, Map<String, String> details) {
        super(message);
        this.details = Collections.unmodifiableMap(new LinkedHashMap<>(details));
    }

    public Map<String, String> getDetails() {
        return details;
    }
}
