// Copyright (c)2025 Jython Developers.
// Licensed to PSF under a contributor agreement.
package uk.co.farowl.vsl.runtime;

/**
 * The Lisp integer, represented by a Java {@code long}. Arithmetic that
 * would overflow fails rather than wrapping (see {@link CoreModule}).
 */
public final class LispInteger implements LispObject {

    /** Integers commonly created in loops are shared. */
    private static final LispInteger[] SMALL = new LispInteger[256 + 1024];
    static {
        for (int i = 0; i < SMALL.length; i++) {
            SMALL[i] = new LispInteger(i - 256);
        }
    }

    /** The Java value. */
    final long value;

    private LispInteger(long value) { this.value = value; }

    /**
     * Return a Lisp integer with the given value.
     *
     * @param v the value
     * @return a (possibly shared) Lisp integer
     */
    public static LispInteger valueOf(long v) {
        if (v >= -256 && v < SMALL.length - 256) {
            return SMALL[(int)v + 256];
        }
        return new LispInteger(v);
    }

    /** @return the Java value */
    public long longValue() { return value; }

    @Override
    public LispType getType() { return LispType.INTEGER; }

    @Override
    public boolean equals(Object other) {
        return other instanceof LispInteger i && i.value == value;
    }

    @Override
    public int hashCode() { return Long.hashCode(value); }

    @Override
    public String toString() { return Long.toString(value); }
}
