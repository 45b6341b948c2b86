package com.starscape.classtag.features.accesstoken.domain;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

class AccessTokenTest {

    private static final Instant NOW = Instant.parse("2026-03-01T10:00:00Z");

    @Test
    @DisplayName("statusAt - Fresh token is active and defaults to read-only")
    void statusAt_Active() {
        AccessToken token = token(null, NOW.plus(Duration.ofDays(1)));

        assertEquals(TokenStatus.ACTIVE, token.statusAt(NOW));
        assertEquals(AccessLevel.READ_ONLY, token.getAccessLevel());
        assertTrue(token.isValidAt(NOW));
    }

    @Test
    @DisplayName("statusAt - Token is expired from its expiry instant on")
    void statusAt_Expired() {
        AccessToken token = token(null, NOW);

        assertEquals(TokenStatus.EXPIRED, token.statusAt(NOW));
        assertEquals(TokenStatus.ACTIVE, token.statusAt(NOW.minusSeconds(1)));
    }

    @Test
    @DisplayName("revoke - One-way and keeps the first timestamp")
    void revoke_OneWay() {
        AccessToken token = token(null, NOW.plus(Duration.ofDays(1)));

        assertTrue(token.revoke(NOW));
        assertFalse(token.revoke(NOW.plusSeconds(60)));
        assertEquals(NOW, token.getRevokedAt());
        assertEquals(TokenStatus.REVOKED, token.statusAt(NOW.plusSeconds(1)));
    }

    @Test
    @DisplayName("constructor - maxUses must be positive")
    void constructor_RejectsNonPositiveMaxUses() {
        assertThrows(IllegalArgumentException.class, () -> token(0, null));
    }

    private static AccessToken token(Integer maxUses, Instant expiresAt) {
        return new AccessToken("tok_1", TokenScope.EVENT, UUID.randomUUID(), null, false,
                new byte[32], new byte[16], "E_abcdefgh", maxUses, expiresAt, "staff-1", NOW);
    }
}
