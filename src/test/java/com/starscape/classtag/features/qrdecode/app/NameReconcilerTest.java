package com.starscape.classtag.features.qrdecode.app;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class NameReconcilerTest {

    private final NameReconciler reconciler = new NameReconciler();

    @Test
    @DisplayName("reconcile - Accent difference matches and stored name is canonical")
    void reconcile_AccentInsensitive() {
        NameReconciler.Reconciliation result = reconciler.reconcile("Juan Perez", "Juan Pérez");

        assertTrue(result.matches());
        assertEquals("Juan Pérez", result.canonicalName());
    }

    @Test
    @DisplayName("reconcile - Case and whitespace differences match")
    void reconcile_CaseAndWhitespace() {
        NameReconciler.Reconciliation result = reconciler.reconcile("  MARÍA   josé ", "María José");

        assertTrue(result.matches());
        assertEquals("María José", result.canonicalName());
    }

    @Test
    @DisplayName("reconcile - Different names do not match")
    void reconcile_Mismatch() {
        NameReconciler.Reconciliation result = reconciler.reconcile("Wrong Name", "Juan Pérez");

        assertFalse(result.matches());
        assertNull(result.canonicalName());
    }

    @Test
    @DisplayName("fold - Decomposes compatibility characters")
    void fold_Compatibility() {
        assertEquals("fiona", NameReconciler.fold("ﬁona"));
        assertEquals("nono", NameReconciler.fold("Ñoño"));
    }
}
