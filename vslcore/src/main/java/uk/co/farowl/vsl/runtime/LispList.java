// Copyright (c)2025 Jython Developers.
// Licensed to PSF under a contributor agreement.
package uk.co.farowl.vsl.runtime;

import java.util.Collection;

/**
 * The Lisp list, written in parentheses. A non-empty list is also the
 * executable form that the {@link Evaluator} treats as a special form
 * or an application.
 */
public final class LispList extends LispSequence {

    /** Convenient constant for a list with zero elements. */
    public static final LispList EMPTY = new LispList(new LispObject[0]);

    private LispList(LispObject[] value) { super(value); }

    /**
     * Construct a list from zero or more elements. The argument is
     * copied for use, so it is safe to modify an array passed in.
     *
     * @param elements of the new list
     * @return a list with the given contents
     */
    public static LispList of(LispObject... elements) {
        return wrap(elements.clone());
    }

    /**
     * Construct a list from the elements of a collection.
     *
     * @param c source of the elements
     * @return a list with the given contents
     */
    public static LispList from(Collection<? extends LispObject> c) {
        return wrap(c.toArray(new LispObject[c.size()]));
    }

    /**
     * Unsafely wrap an array in a list. The array becomes embedded as
     * the value of the list. <b>The client therefore promises not to
     * modify the content.</b> For this reason, this method has only
     * package visibility.
     *
     * @param value of the new list
     * @return a list with the given contents or {@link #EMPTY}
     */
    static LispList wrap(LispObject[] value) {
        return value.length == 0 ? EMPTY : new LispList(value);
    }

    @Override
    public LispType getType() { return LispType.LIST; }
}
