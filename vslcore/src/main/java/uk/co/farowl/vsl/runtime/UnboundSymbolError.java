// Copyright (c)2025 Jython Developers.
// Licensed to PSF under a contributor agreement.
package uk.co.farowl.vsl.runtime;

/** No frame in the environment chain binds the symbol looked up. */
public class UnboundSymbolError extends LispError {
    private static final long serialVersionUID = 1L;

    /** The symbol that was not found. */
    private final String name;

    /**
     * Constructor specifying the symbol.
     *
     * @param symbol that was not found
     */
    public UnboundSymbolError(LispSymbol symbol) {
        super("'%s' not found", symbol.name);
        this.name = symbol.name;
    }

    /** @return the name of the symbol that was not found */
    public String getName() { return name; }
}
