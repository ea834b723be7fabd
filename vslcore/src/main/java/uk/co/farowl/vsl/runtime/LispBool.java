// Copyright (c)2025 Jython Developers.
// Licensed to PSF under a contributor agreement.
package uk.co.farowl.vsl.runtime;

/** The Lisp {@code true} and {@code false} objects. */
public final class LispBool implements LispObject {

    /** Lisp {@code true}. */
    static final LispBool TRUE = new LispBool(true);
    /** Lisp {@code false}. */
    static final LispBool FALSE = new LispBool(false);

    /** The Java value. */
    final boolean value;

    private LispBool(boolean value) { this.value = value; }

    /**
     * Return the Lisp boolean corresponding to a Java one.
     *
     * @param b Java value
     * @return {@link #TRUE} or {@link #FALSE}
     */
    static LispBool valueOf(boolean b) { return b ? TRUE : FALSE; }

    /** @return the Java value */
    public boolean booleanValue() { return value; }

    @Override
    public LispType getType() { return LispType.BOOLEAN; }

    @Override
    public String toString() { return value ? "true" : "false"; }
}
