// Copyright (c)2025 Jython Developers.
// Licensed to PSF under a contributor agreement.
package uk.co.farowl.vsl.runtime;

/** Constants and factory methods for Lisp values. */
public class Lisp {

    /** Lisp {@code nil}. */
    public static final LispObject NIL = LispNil.INSTANCE;

    /** Lisp {@code true}. */
    public static final LispObject TRUE = LispBool.TRUE;

    /** Lisp {@code false}. */
    public static final LispObject FALSE = LispBool.FALSE;

    /** Instances are not allowed. */
    private Lisp() {};

    /**
     * Return a Lisp integer.
     *
     * @param v the value
     * @return the Lisp integer
     */
    public static LispInteger val(long v) { return LispInteger.valueOf(v); }

    /**
     * Return a Lisp boolean.
     *
     * @param b the value
     * @return {@link #TRUE} or {@link #FALSE}
     */
    public static LispObject val(boolean b) { return LispBool.valueOf(b); }

    /**
     * Return a Lisp string.
     *
     * @param s the text
     * @return the Lisp string
     */
    public static LispString str(String s) { return new LispString(s); }

    /**
     * Return a Lisp symbol.
     *
     * @param name of the symbol
     * @return the symbol
     */
    public static LispSymbol symbol(String name) {
        return new LispSymbol(name);
    }

    /**
     * Return a Lisp keyword.
     *
     * @param name of the keyword without the leading marker
     * @return the keyword
     */
    public static LispKeyword keyword(String name) {
        return new LispKeyword(name);
    }

    /**
     * Return a Lisp list.
     *
     * @param elements of the list
     * @return the list
     */
    public static LispList list(LispObject... elements) {
        return LispList.of(elements);
    }

    /**
     * Return a Lisp vector.
     *
     * @param elements of the vector
     * @return the vector
     */
    public static LispVector vector(LispObject... elements) {
        return LispVector.of(elements);
    }

    /**
     * Return a Lisp map.
     *
     * @param kvs keys and values alternately
     * @return the map
     */
    public static LispMap map(LispObject... kvs) {
        return LispMap.fromPairs(kvs);
    }
}
