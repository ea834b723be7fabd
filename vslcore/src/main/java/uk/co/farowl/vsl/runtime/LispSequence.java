// Copyright (c)2025 Jython Developers.
// Licensed to PSF under a contributor agreement.
package uk.co.farowl.vsl.runtime;

import java.util.AbstractList;
import java.util.Arrays;
import java.util.Iterator;
import java.util.List;

/**
 * Common implementation of the two sequence kinds {@link LispList} and
 * {@link LispVector}. The elements are held in an array that is never
 * modified after construction: every operation that "changes" a
 * sequence makes a new one.
 * <p>
 * A list and a vector with equal elements are equal (in the sense of
 * {@link Object#equals(Object)} and of the Lisp {@code =}), and have
 * the same hash code.
 */
public abstract sealed class LispSequence
        implements LispObject, Iterable<LispObject>
        permits LispList, LispVector {

    /** The elements, never modified once construction completes. */
    final LispObject[] value;

    /**
     * Construct a sequence on the array, which the caller promises not
     * to modify subsequently.
     *
     * @param value the elements
     */
    LispSequence(LispObject[] value) { this.value = value; }

    /** @return the number of elements */
    public int size() { return value.length; }

    /** @return {@code true} iff there are no elements */
    public boolean isEmpty() { return value.length == 0; }

    /**
     * Return the element at the given index.
     *
     * @param i index of the element
     * @return the element
     * @throws IndexOutOfBoundsException if {@code i} is out of range
     */
    public LispObject get(int i) { return value[i]; }

    /**
     * Return a copy of a slice of the elements.
     *
     * @param start first element to include
     * @return the elements from {@code start} to the end
     */
    LispObject[] from(int start) {
        return Arrays.copyOfRange(value, start, value.length);
    }

    /**
     * A read-only {@code List} view of the elements.
     *
     * @return the elements as a {@code List}
     */
    public List<LispObject> asList() {
        return new AbstractList<LispObject>() {

            @Override
            public LispObject get(int index) { return value[index]; }

            @Override
            public int size() { return value.length; }
        };
    }

    @Override
    public Iterator<LispObject> iterator() {
        return asList().iterator();
    }

    @Override
    public boolean equals(Object other) {
        return other instanceof LispObject o
                && Comparison.equal(this, o);
    }

    @Override
    public int hashCode() { return Arrays.hashCode(value); }

    @Override
    public String toString() { return Printer.print(this, true); }
}
