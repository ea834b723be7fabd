// Copyright (c)2025 Jython Developers.
// Licensed to PSF under a contributor agreement.
package uk.co.farowl.vsl.runtime;

/**
 * Operations on Lisp values that check the kind of their argument and
 * raise a {@link TypeMismatchError} naming the operation if it is not
 * what the operation needs. The primitives of {@link CoreModule} and the
 * special forms of the {@link Evaluator} use these to unpack their
 * arguments.
 */
class Abstract {

    private Abstract() {} // no instances

    /**
     * Test a value for truth: every value is true except {@code nil}
     * and {@code false}.
     *
     * @param v to test
     * @return whether {@code v} is true
     */
    static boolean isTrue(LispObject v) {
        return v != LispNil.INSTANCE && v != LispBool.FALSE;
    }

    /**
     * @param v value
     * @param op name of operation for messages
     * @return Java value of integer {@code v}
     * @throws TypeMismatchError if {@code v} is not an integer
     */
    static long asLong(LispObject v, String op) throws TypeMismatchError {
        if (v instanceof LispInteger i) { return i.value; }
        throw TypeMismatchError.expected(op, LispType.INTEGER, v);
    }

    /**
     * @param v value
     * @param op name of operation for messages
     * @return {@code v} as a list or vector
     * @throws TypeMismatchError if {@code v} is neither
     */
    static LispSequence asSequence(LispObject v, String op)
            throws TypeMismatchError {
        if (v instanceof LispSequence s) { return s; }
        throw TypeMismatchError.expected(op, "list or vector", v);
    }

    /**
     * @param v value
     * @param op name of operation for messages
     * @return {@code v} as a list
     * @throws TypeMismatchError if {@code v} is not a list
     */
    static LispList asList(LispObject v, String op)
            throws TypeMismatchError {
        if (v instanceof LispList s) { return s; }
        throw TypeMismatchError.expected(op, LispType.LIST, v);
    }

    /**
     * @param v value
     * @param op name of operation for messages
     * @return {@code v} as a map
     * @throws TypeMismatchError if {@code v} is not a map
     */
    static LispMap asMap(LispObject v, String op)
            throws TypeMismatchError {
        if (v instanceof LispMap m) { return m; }
        throw TypeMismatchError.expected(op, LispType.MAP, v);
    }

    /**
     * @param v value
     * @param op name of operation for messages
     * @return {@code v} as an atom
     * @throws TypeMismatchError if {@code v} is not an atom
     */
    static LispAtom asAtom(LispObject v, String op)
            throws TypeMismatchError {
        if (v instanceof LispAtom a) { return a; }
        throw TypeMismatchError.expected(op, LispType.ATOM, v);
    }

    /**
     * @param v value
     * @param op name of operation for messages
     * @return {@code v} as a function
     * @throws TypeMismatchError if {@code v} is not a function
     */
    static LispFunction asFunction(LispObject v, String op)
            throws TypeMismatchError {
        if (v instanceof LispFunction f) { return f; }
        throw TypeMismatchError.expected(op, LispType.FUNCTION, v);
    }

    /**
     * @param v value
     * @param op name of operation for messages
     * @return {@code v} as a symbol
     * @throws TypeMismatchError if {@code v} is not a symbol
     */
    static LispSymbol asSymbol(LispObject v, String op)
            throws TypeMismatchError {
        if (v instanceof LispSymbol s) { return s; }
        throw TypeMismatchError.expected(op, LispType.SYMBOL, v);
    }

    /**
     * @param v value
     * @param op name of operation for messages
     * @return Java value of string {@code v}
     * @throws TypeMismatchError if {@code v} is not a string
     */
    static String asString(LispObject v, String op)
            throws TypeMismatchError {
        if (v instanceof LispString s) { return s.value; }
        throw TypeMismatchError.expected(op, LispType.STRING, v);
    }
}
