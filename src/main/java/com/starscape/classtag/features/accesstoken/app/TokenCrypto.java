package com.starscape.classtag.features.accesstoken.app;

import com.starscape.classtag.features.accesstoken.domain.TokenScope;
import org.springframework.stereotype.Component;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.security.SecureRandom;
import java.util.Base64;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Generation, hashing and constant-time verification of access tokens.
 *
 * Plaintext format: {@code <E|C|F>_<43 base64url chars>} (32 random bytes).
 * Stored form: SHA-256(plaintext bytes || 16-byte salt) plus the first
 * {@value #PREFIX_LENGTH} plaintext characters as a non-secret lookup key.
 */
@Component
public class TokenCrypto {

    public static final int PREFIX_LENGTH = 10;

    static final int SECRET_BYTES = 32;
    static final int SALT_BYTES = 16;

    private static final Pattern TOKEN_FORMAT = Pattern.compile("^[ECF]_[A-Za-z0-9_-]{43}$");
    private static final Base64.Encoder ENCODER = Base64.getUrlEncoder().withoutPadding();

    private final SecureRandom secureRandom;
    private final byte[] dummySalt;
    private final byte[] dummyHash;

    public TokenCrypto() {
        this(new SecureRandom());
    }

    TokenCrypto(SecureRandom secureRandom) {
        this.secureRandom = secureRandom;
        this.dummySalt = randomBytes(SALT_BYTES);
        this.dummyHash = hash("X_" + ENCODER.encodeToString(randomBytes(SECRET_BYTES)), dummySalt);
    }

    public GeneratedToken generate(TokenScope scope) {
        String plaintext = scope.getLetter() + "_" + ENCODER.encodeToString(randomBytes(SECRET_BYTES));
        byte[] salt = randomBytes(SALT_BYTES);
        return new GeneratedToken(plaintext, plaintext.substring(0, PREFIX_LENGTH), hash(plaintext, salt), salt);
    }

    /**
     * Lookup prefix of a presented token, or empty when the value cannot be a token at all.
     */
    public Optional<String> prefixOf(String presented) {
        if (presented == null || !TOKEN_FORMAT.matcher(presented).matches()) {
            return Optional.empty();
        }
        return Optional.of(presented.substring(0, PREFIX_LENGTH));
    }

    public boolean matches(String presented, byte[] salt, byte[] expectedHash) {
        return MessageDigest.isEqual(hash(presented, salt), expectedHash);
    }

    /**
     * Perform the same hashing work as a real comparison against a value that never matches.
     * Used when no candidate exists for a prefix.
     */
    public void burnComparison(String presented) {
        MessageDigest.isEqual(hash(presented == null ? "" : presented, dummySalt), dummyHash);
    }

    byte[] hash(String plaintext, byte[] salt) {
        MessageDigest digest = sha256();
        digest.update(plaintext.getBytes(StandardCharsets.UTF_8));
        digest.update(salt);
        return digest.digest();
    }

    /**
     * Display form of a token prefix, e.g. {@code tok_a1B***}. Safe for logs and responses.
     */
    public static String mask(String prefix) {
        if (prefix == null || prefix.length() < 5) {
            return "tok_***";
        }
        return "tok_" + prefix.substring(2, 5) + "***";
    }

    private byte[] randomBytes(int length) {
        byte[] bytes = new byte[length];
        secureRandom.nextBytes(bytes);
        return bytes;
    }

    private static MessageDigest sha256() {
        try {
            return MessageDigest.getInstance("SHA-256");
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }

    /**
     * Freshly generated token. The plaintext must be handed to the issuer and then discarded.
     */
    public record GeneratedToken(String plaintext, String prefix, byte[] hash, byte[] salt) {

        @Override
        public String toString() {
            return "GeneratedToken[prefix=" + mask(prefix) + "]";
        }
    }
}
