package com.starscape.classtag.features.qrdecode.app;

import com.starscape.classtag.common.exception.QrFormatException;
import com.starscape.classtag.features.qrdecode.domain.QrPayload;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

class QrCodecTest {

    private static final UUID SUBJECT_ID = UUID.fromString("2f1c6a4e-8a3b-4d5e-9f10-1a2b3c4d5e6f");
    private static final UUID EVENT_ID = UUID.fromString("7e8d9c0b-1a2b-4c3d-8e4f-5a6b7c8d9e0f");

    private final QrCodec qrCodec = new QrCodec();

    @Test
    @DisplayName("decode - Well-formed payload yields its three claims")
    void decode_WellFormed() {
        QrPayload payload = qrCodec.decode("STUDENT:" + SUBJECT_ID + ":Juan Pérez:" + EVENT_ID);

        assertEquals(SUBJECT_ID, payload.subjectId());
        assertEquals("Juan Pérez", payload.subjectName());
        assertEquals(EVENT_ID, payload.eventId());
    }

    @Test
    @DisplayName("encode - Decoding an encoded payload returns the same claims")
    void encode_DecodesBack() {
        QrPayload original = new QrPayload(SUBJECT_ID, "María José", EVENT_ID);

        String encoded = qrCodec.encode(original);

        assertEquals("STUDENT:" + SUBJECT_ID + ":María José:" + EVENT_ID, encoded);
        assertEquals(original, qrCodec.decode(encoded));
    }

    @ParameterizedTest
    @ValueSource(strings = {
        "",
        "   ",
        "INVALID:FORMAT",
        "RANDOM_STRING",
        "STUDENT:",
        "STUDENT:invalid-uuid:Name:invalid-event",
        "PARENT:2f1c6a4e-8a3b-4d5e-9f10-1a2b3c4d5e6f:Name:7e8d9c0b-1a2b-4c3d-8e4f-5a6b7c8d9e0f",
        "STUDENT:2f1c6a4e-8a3b-4d5e-9f10-1a2b3c4d5e6f:Name:7e8d9c0b-1a2b-4c3d-8e4f-5a6b7c8d9e0f:extra",
        "STUDENT:2f1c6a4e-8a3b-4d5e-9f10-1a2b3c4d5e6f::7e8d9c0b-1a2b-4c3d-8e4f-5a6b7c8d9e0f"
    })
    @DisplayName("decode - Malformed payloads are rejected")
    void decode_Malformed(String input) {
        QrFormatException ex = assertThrows(QrFormatException.class, () -> qrCodec.decode(input));

        assertEquals(QrFormatException.MESSAGE, ex.getMessage());
        assertTrue(ex.getDetails().containsKey("reason"));
    }

    @Test
    @DisplayName("decode - Null payload is rejected")
    void decode_Null() {
        assertThrows(QrFormatException.class, () -> qrCodec.decode(null));
    }

    @Test
    @DisplayName("decode - Name longer than the limit is rejected")
    void decode_NameTooLong() {
        String name = "a".repeat(QrCodec.MAX_NAME_LENGTH + 1);

        assertThrows(QrFormatException.class,
                () -> qrCodec.decode("STUDENT:" + SUBJECT_ID + ":" + name + ":" + EVENT_ID));
    }

    @Test
    @DisplayName("decode - Name with control characters is rejected")
    void decode_ControlCharacters() {
        assertThrows(QrFormatException.class,
                () -> qrCodec.decode("STUDENT:" + SUBJECT_ID + ":Ana\u0007:" + EVENT_ID));
    }

    @Test
    @DisplayName("decode - Control characters at the edges of the name are rejected, not trimmed")
    void decode_EdgeControlCharacters() {
        assertThrows(QrFormatException.class,
                () -> qrCodec.decode("STUDENT:" + SUBJECT_ID + ":\tAna:" + EVENT_ID));
        assertThrows(QrFormatException.class,
                () -> qrCodec.decode("STUDENT:" + SUBJECT_ID + ":Ana\u001F:" + EVENT_ID));
    }

    @Test
    @DisplayName("decode - Surrounding spaces are trimmed from the name and payload")
    void decode_TrimsSpaces() {
        QrPayload payload = qrCodec.decode("STUDENT:" + SUBJECT_ID + ":  Ana María :" + EVENT_ID + "\n");

        assertEquals("Ana María", payload.subjectName());
        assertEquals(EVENT_ID, payload.eventId());
    }

    @Test
    @DisplayName("encode - Name containing the separator cannot be encoded")
    void encode_RejectsSeparatorInName() {
        assertThrows(QrFormatException.class,
                () -> qrCodec.encode(new QrPayload(SUBJECT_ID, "Ana:Maria", EVENT_ID)));
    }
}
