// Copyright (c)2025 Jython Developers.
// Licensed to PSF under a contributor agreement.
package uk.co.farowl.vsl.runtime;

import java.util.Collection;

/**
 * The Lisp vector, written in square brackets. The {@link Evaluator}
 * evaluates the elements of a vector but never treats it as an
 * application.
 */
public final class LispVector extends LispSequence {

    /** Convenient constant for a vector with zero elements. */
    public static final LispVector EMPTY =
            new LispVector(new LispObject[0]);

    private LispVector(LispObject[] value) { super(value); }

    /**
     * Construct a vector from zero or more elements. The argument is
     * copied for use, so it is safe to modify an array passed in.
     *
     * @param elements of the new vector
     * @return a vector with the given contents
     */
    public static LispVector of(LispObject... elements) {
        return wrap(elements.clone());
    }

    /**
     * Construct a vector from the elements of a collection.
     *
     * @param c source of the elements
     * @return a vector with the given contents
     */
    public static LispVector from(Collection<? extends LispObject> c) {
        return wrap(c.toArray(new LispObject[c.size()]));
    }

    /**
     * As {@link LispList#wrap(LispObject[])}, the client promises not to
     * modify the array.
     *
     * @param value of the new vector
     * @return a vector with the given contents or {@link #EMPTY}
     */
    static LispVector wrap(LispObject[] value) {
        return value.length == 0 ? EMPTY : new LispVector(value);
    }

    @Override
    public LispType getType() { return LispType.VECTOR; }
}
