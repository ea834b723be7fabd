// Copyright (c)2025 Jython Developers.
// Licensed to PSF under a contributor agreement.
package uk.co.farowl.vsl.runtime;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

/** Test binding and look-up in chains of {@link Environment} frames. */
@DisplayName("An Environment")
class EnvironmentTest {

    static final LispSymbol X = new LispSymbol("x");
    static final LispSymbol Y = new LispSymbol("y");

    @Test
    @DisplayName("binds a symbol in the frame itself")
    void setAndGet() {
        Environment env = new Environment(null);
        LispObject v = Lisp.val(42);
        assertSame(v, env.set(X, v));
        assertSame(v, env.get(X));
        assertSame(v, env.get("x"));
        assertSame(env, env.find(X));
    }

    @Test
    @DisplayName("finds a binding in an enclosing frame")
    void findsOuter() {
        Environment outer = new Environment(null);
        Environment inner = new Environment(outer);
        outer.set(X, Lisp.val(1));
        assertSame(outer, inner.find(X));
        assertSame(outer, inner.getOuter());
        assertEquals(Lisp.val(1), inner.get(X));
    }

    @Test
    @DisplayName("shadows an outer binding without changing it")
    void shadowing() {
        Environment outer = new Environment(null);
        Environment inner = new Environment(outer);
        outer.set(X, Lisp.val(1));
        inner.set(X, Lisp.val(2));
        assertEquals(Lisp.val(2), inner.get(X));
        assertEquals(Lisp.val(1), outer.get(X));
    }

    @Test
    @DisplayName("binds parameters to arguments positionally")
    void bindsParameters() {
        Environment env = new Environment(null, new LispSymbol[] {X, Y},
                new LispObject[] {Lisp.val(1), Lisp.str("b")});
        assertEquals(Lisp.val(1), env.get(X));
        assertEquals(Lisp.str("b"), env.get(Y));
    }

    @Test
    @DisplayName("raises UnboundSymbolError for an unknown symbol")
    void unbound() {
        Environment env = new Environment(new Environment(null));
        assertNull(env.find(X));
        UnboundSymbolError e =
                assertThrows(UnboundSymbolError.class, () -> env.get(X));
        assertEquals("x", e.getName());
        assertEquals("'x' not found", e.getMessage());
        assertEquals(Lisp.str("'x' not found"), e.getPayload());
    }
}
