// Copyright (c)2025 Jython Developers.
// Licensed to PSF under a contributor agreement.
package uk.co.farowl.vsl.runtime;

/** The Lisp {@code nil} object, a singleton. */
public final class LispNil implements LispObject {

    /** The only instance. */
    static final LispNil INSTANCE = new LispNil();

    private LispNil() {}

    @Override
    public LispType getType() { return LispType.NIL; }

    @Override
    public String toString() { return "nil"; }
}
