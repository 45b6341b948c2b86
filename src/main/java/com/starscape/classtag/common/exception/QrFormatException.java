package com.starscape.classtag.common.exception;

import java.util.Map;

public class QrFormatException extends DomainValidationException {

    public static final String MESSAGE = "Invalid QR code format";

    public QrFormatException(String reason) {
        super(MESSAGE, Map.of("reason", reason));
    }
}
