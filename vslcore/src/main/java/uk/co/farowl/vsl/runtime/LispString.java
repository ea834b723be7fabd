// Copyright (c)2025 Jython Developers.
// Licensed to PSF under a contributor agreement.
package uk.co.farowl.vsl.runtime;

/**
 * The Lisp string. A string is also the usual payload of a
 * {@link LispError}, and may be a key in a {@link LispMap}, where it is
 * never equal to the {@link LispKeyword} of the same text.
 */
public final class LispString implements LispObject {

    /** The Java value. */
    final String value;

    /**
     * Create a Lisp string.
     *
     * @param value the text
     */
    public LispString(String value) { this.value = value; }

    /** @return the text of this string */
    public String asString() { return value; }

    @Override
    public LispType getType() { return LispType.STRING; }

    @Override
    public boolean equals(Object other) {
        return other instanceof LispString s && s.value.equals(value);
    }

    @Override
    public int hashCode() { return value.hashCode(); }

    @Override
    public String toString() { return Printer.print(this, true); }
}
