// Copyright (c)2025 Jython Developers.
// Licensed to PSF under a contributor agreement.
package uk.co.farowl.vsl.runtime;

/**
 * The closed set of kinds to which every {@link LispObject} belongs.
 * Components that must treat each kind differently do so with a
 * {@code switch} over this {@code enum}, without a {@code default}
 * case, so that the compiler reports every site that has to change when
 * a kind is added.
 */
public enum LispType {
    NIL("nil"),
    BOOLEAN("boolean"),
    INTEGER("integer"),
    STRING("string"),
    SYMBOL("symbol"),
    KEYWORD("keyword"),
    LIST("list"),
    VECTOR("vector"),
    MAP("map"),
    ATOM("atom"),
    FUNCTION("function");

    /** Name of the kind as it appears in error messages. */
    private final String label;

    private LispType(String label) { this.label = label; }

    @Override
    public String toString() { return label; }
}
