package com.starscape.classtag.features.qrdecode.app;

import org.springframework.stereotype.Component;

import java.text.Normalizer;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Decides whether a scanned name refers to the stored subject name.
 *
 * An exact match wins. Otherwise both sides are folded: Unicode NFKD,
 * combining marks removed, lower-cased in the root locale, runs of whitespace
 * collapsed and trimmed. The stored name is always the canonical result.
 */
@Component
public class NameReconciler {

    private static final Pattern COMBINING_MARKS = Pattern.compile("\\p{M}+");
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    public Reconciliation reconcile(String provided, String stored) {
        if (provided == null || stored == null) {
            return Reconciliation.mismatch();
        }
        if (provided.equals(stored)) {
            return Reconciliation.match(stored);
        }
        if (fold(provided).equals(fold(stored))) {
            return Reconciliation.match(stored);
        }
        return Reconciliation.mismatch();
    }

    static String fold(String name) {
        String decomposed = Normalizer.normalize(name, Normalizer.Form.NFKD);
        String stripped = COMBINING_MARKS.matcher(decomposed).replaceAll("");
        String lowered = stripped.toLowerCase(Locale.ROOT);
        return WHITESPACE.matcher(lowered).replaceAll(" ").trim();
    }

    public record Reconciliation(boolean matches, String canonicalName) {

        static Reconciliation match(String canonicalName) {
            return new Reconciliation(true, canonicalName);
        }

        static Reconciliation mismatch() {
            return new Reconciliation(false, null);
        }
    }
}
