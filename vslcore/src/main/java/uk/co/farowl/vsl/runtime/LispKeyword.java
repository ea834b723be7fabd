// Copyright (c)2025 Jython Developers.
// Licensed to PSF under a contributor agreement.
package uk.co.farowl.vsl.runtime;

/**
 * The Lisp keyword, written with a leading {@code :}. Keywords evaluate
 * to themselves and are mostly used as {@link LispMap} keys. The colon
 * is not part of {@link #getName()}.
 */
public final class LispKeyword implements LispObject {

    /** The marker that introduces a keyword in source text. */
    public static final char MARKER = ':';

    /** The name of the keyword, without the leading marker. */
    final String name;

    /**
     * Create a keyword.
     *
     * @param name of the keyword without the leading marker
     */
    public LispKeyword(String name) { this.name = name; }

    /** @return the name of the keyword without the leading marker */
    public String getName() { return name; }

    @Override
    public LispType getType() { return LispType.KEYWORD; }

    @Override
    public boolean equals(Object other) {
        return other instanceof LispKeyword k && k.name.equals(name);
    }

    @Override
    public int hashCode() { return ~name.hashCode(); }

    @Override
    public String toString() { return MARKER + name; }
}
