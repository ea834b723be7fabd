// Copyright (c)2025 Jython Developers.
// Licensed to PSF under a contributor agreement.
package uk.co.farowl.vsl.runtime;

/**
 * A Lisp function, which is either a {@link NativeFunction} implemented
 * in Java or a {@link Closure} defined by {@code fn*}. Both are invoked
 * the same way through {@link #call(LispObject...)}, so that primitives
 * such as {@code map} and {@code swap!} need not know which they hold.
 * Functions are equal only to themselves.
 */
public abstract sealed class LispFunction implements LispObject
        permits NativeFunction, Closure {

    /**
     * Call this function with the given arguments.
     *
     * @param args the (evaluated) arguments
     * @return the result of the call
     * @throws LispError from the implementation of the function
     */
    public abstract LispObject call(LispObject... args) throws LispError;

    /**
     * The name of the function, for messages. Only native functions
     * have one.
     *
     * @return the name or {@code null}
     */
    public abstract String getName();

    @Override
    public LispType getType() { return LispType.FUNCTION; }

    @Override
    public String toString() { return Printer.print(this, true); }
}
