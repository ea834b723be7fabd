// Copyright (c)2025 Jython Developers.
// Licensed to PSF under a contributor agreement.
package uk.co.farowl.vsl.runtime;

import java.util.Map;

/**
 * The comparison operations available as primitives. The ordering
 * comparisons accept only integers. Equality ({@link #EQ}) accepts any
 * two values and never fails: it is structural for sequences (where a
 * list may equal a vector) and maps (where the order of entries does
 * not matter), and otherwise requires the same kind and the same
 * content. Atoms and functions are equal only to themselves.
 */
enum Comparison {

    /** The {@code <} operation. */
    LT("<") {

        @Override
        boolean test(long v, long w) { return v < w; }
    },

    /** The {@code <=} operation. */
    LE("<=") {

        @Override
        boolean test(long v, long w) { return v <= w; }
    },

    /** The {@code >} operation. */
    GT(">") {

        @Override
        boolean test(long v, long w) { return v > w; }
    },

    /** The {@code >=} operation. */
    GE(">=") {

        @Override
        boolean test(long v, long w) { return v >= w; }
    },

    /** The {@code =} operation. */
    EQ("=") {

        @Override
        boolean test(long v, long w) { return v == w; }

        @Override
        LispObject apply(LispObject v, LispObject w) {
            return LispBool.valueOf(equal(v, w));
        }
    };

    /** Name of the primitive. */
    final String text;

    Comparison(String text) { this.text = text; }

    /**
     * Compare two Java integers.
     *
     * @param v left operand
     * @param w right operand
     * @return outcome of the comparison
     */
    abstract boolean test(long v, long w);

    /**
     * Perform the comparison on Lisp values, which (except for
     * {@link #EQ}) must be integers.
     *
     * @param v left operand
     * @param w right operand
     * @return the Lisp boolean result
     * @throws TypeMismatchError if the operands are not integers
     */
    LispObject apply(LispObject v, LispObject w) throws TypeMismatchError {
        return LispBool.valueOf(
                test(Abstract.asLong(v, text), Abstract.asLong(w, text)));
    }

    /**
     * Structural equality of Lisp values, as the {@code =} primitive.
     *
     * @param v left operand
     * @param w right operand
     * @return whether they are equal
     */
    static boolean equal(LispObject v, LispObject w) {
        if (v == w) { return true; }
        LispType t = v.getType();
        return switch (t) {
            case LIST, VECTOR -> w instanceof LispSequence ws
                    && sequenceEqual((LispSequence)v, ws);
            case MAP -> w instanceof LispMap wm
                    && mapEqual((LispMap)v, wm);
            case INTEGER, STRING, SYMBOL, KEYWORD -> t == w.getType()
                    && v.equals(w);
            // Singletons or identity-based
            case NIL, BOOLEAN, ATOM, FUNCTION -> false;
        };
    }

    private static boolean sequenceEqual(LispSequence v, LispSequence w) {
        int n = v.size();
        if (n != w.size()) { return false; }
        for (int i = 0; i < n; i++) {
            if (!equal(v.get(i), w.get(i))) { return false; }
        }
        return true;
    }

    private static boolean mapEqual(LispMap v, LispMap w) {
        if (v.size() != w.size()) { return false; }
        for (Map.Entry<LispObject, LispObject> e : v.entrySet()) {
            LispObject wv = w.get(e.getKey());
            if (wv == null || !equal(e.getValue(), wv)) { return false; }
        }
        return true;
    }
}
