package com.starscape.classtag.features.accesstoken.domain;

/**
 * Hierarchical reach of an access token. The token's {@code resourceId} names
 * an event, a course or a single subject (family access) depending on scope.
 */
public enum TokenScope {

    EVENT('E', "event"),
    COURSE('C', "course"),
    FAMILY('F', "subject");

    private final char letter;
    private final String resourceKind;

    TokenScope(char letter, String resourceKind) {
        this.letter = letter;
        this.resourceKind = resourceKind;
    }

    /**
     * Single-letter marker that opens every plaintext token of this scope.
     */
    public char getLetter() {
        return letter;
    }

    /**
     * What {@code resourceId} refers to for this scope.
     */
    public String getResourceKind() {
        return resourceKind;
    }

    public static TokenScope fromLetter(char letter) {
        for (TokenScope scope : values()) {
            if (scope.letter == letter) {
                return scope;
            }
        }
        throw new IllegalArgumentException("Unknown token scope marker: " + letter);
    }
}
