// Copyright (c)2025 Jython Developers.
// Licensed to PSF under a contributor agreement.
package uk.co.farowl.vsl.runtime;

/**
 * The Lisp reference cell ("atom"): a single mutable slot holding a
 * value. This is the only mutable kind of value. Two atoms are never
 * equal unless they are the same atom, whatever they hold, so this
 * class keeps the identity-based {@code equals} of {@code Object}.
 * <p>
 * Execution is single-threaded: a change made through one reference is
 * immediately visible through every other.
 */
public final class LispAtom implements LispObject {

    /** The current content. */
    private LispObject value;

    /**
     * Create an atom with the given initial content.
     *
     * @param value initial content
     */
    public LispAtom(LispObject value) { this.value = value; }

    /** @return the current content */
    public LispObject deref() { return value; }

    /**
     * Replace the content.
     *
     * @param value new content
     * @return {@code value}
     */
    public LispObject reset(LispObject value) {
        this.value = value;
        return value;
    }

    @Override
    public LispType getType() { return LispType.ATOM; }

    @Override
    public String toString() { return Printer.print(this, true); }
}
