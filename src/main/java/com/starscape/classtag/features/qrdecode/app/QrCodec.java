package com.starscape.classtag.features.qrdecode.app;

import com.starscape.classtag.common.exception.QrFormatException;
import com.starscape.classtag.features.qrdecode.domain.QrPayload;
import com.starscape.classtag.features.subjects.domain.Subject;
import org.springframework.stereotype.Component;

import java.util.UUID;
import java.util.regex.Pattern;

/**
 * Codec for student QR payloads: {@code STUDENT:<subjectId>:<subjectName>:<eventId>}.
 *
 * Decoding is purely syntactic and rejects anything malformed before a
 * repository is touched. Names may not contain ':' so the four fields split
 * unambiguously.
 */
@Component
public class QrCodec {

    static final String TAG = "STUDENT";
    static final int MAX_NAME_LENGTH = 100;
    static final int MAX_PAYLOAD_LENGTH = 512;

    private static final String SEPARATOR = ":";
    private static final Pattern UUID_FORMAT =
            Pattern.compile("^[0-9a-fA-F]{8}-[0-9a-fA-F]{4}-[0-9a-fA-F]{4}-[0-9a-fA-F]{4}-[0-9a-fA-F]{12}$");

    public QrPayload decode(String payload) {
        if (payload == null || payload.isBlank()) {
            throw new QrFormatException("empty payload");
        }
        if (payload.length() > MAX_PAYLOAD_LENGTH) {
            throw new QrFormatException("payload too long");
        }

        String[] parts = payload.strip().split(SEPARATOR, -1);
        if (parts.length != 4) {
            throw new QrFormatException("expected 4 fields but found " + parts.length);
        }
        if (!TAG.equals(parts[0])) {
            throw new QrFormatException("unknown tag");
        }

        UUID subjectId = parseUuid(parts[1], "subject id");
        UUID eventId = parseUuid(parts[3], "event id");
        rejectControlCharacters(parts[2]);
        String name = parts[2].strip();
        validateName(name);

        return new QrPayload(subjectId, name, eventId);
    }

    public String encode(Subject subject) {
        return encode(new QrPayload(subject.getSubjectId(), subject.getName(), subject.getEventId()));
    }

    public String encode(QrPayload payload) {
        validateName(payload.subjectName());
        return String.join(SEPARATOR,
                TAG,
                payload.subjectId().toString(),
                payload.subjectName(),
                payload.eventId().toString());
    }

    private static UUID parseUuid(String value, String field) {
        if (value.isEmpty() || !UUID_FORMAT.matcher(value).matches()) {
            throw new QrFormatException(field + " is not a valid UUID");
        }
        return UUID.fromString(value);
    }

    private static void validateName(String name) {
        if (name == null || name.isEmpty()) {
            throw new QrFormatException("subject name is empty");
        }
        if (name.length() > MAX_NAME_LENGTH) {
            throw new QrFormatException("subject name too long");
        }
        if (name.contains(SEPARATOR)) {
            throw new QrFormatException("subject name contains a separator");
        }
        rejectControlCharacters(name);
    }

    private static void rejectControlCharacters(String name) {
        for (int i = 0; i < name.length(); i++) {
            if (Character.isISOControl(name.charAt(i))) {
                throw new QrFormatException("subject name contains control characters");
            }
        }
    }
}
