// Copyright (c)2025 Jython Developers.
// Licensed to PSF under a contributor agreement.
package uk.co.farowl.vsl.runtime;

/**
 * The Lisp symbol: a name that evaluates to whatever is bound to it in
 * the {@link Environment}. Symbols are equal when their names are.
 */
public final class LispSymbol implements LispObject {

    /** The name of the symbol. */
    final String name;

    /**
     * Create a symbol.
     *
     * @param name of the symbol
     */
    public LispSymbol(String name) { this.name = name; }

    /** @return the name of the symbol */
    public String getName() { return name; }

    @Override
    public LispType getType() { return LispType.SYMBOL; }

    @Override
    public boolean equals(Object other) {
        return other instanceof LispSymbol s && s.name.equals(name);
    }

    @Override
    public int hashCode() { return name.hashCode(); }

    @Override
    public String toString() { return name; }
}
