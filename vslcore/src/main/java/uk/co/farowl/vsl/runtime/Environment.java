// Copyright (c)2025 Jython Developers.
// Licensed to PSF under a contributor agreement.
package uk.co.farowl.vsl.runtime;

import java.util.HashMap;
import java.util.Map;

/**
 * A frame of bindings from symbols to values, with a link to the frame
 * that encloses it. Look-up searches outwards through the chain of
 * frames, so that an inner binding shadows an outer one of the same
 * symbol. Definition always affects the frame on which it is called.
 * <p>
 * A frame is shared, not copied, by every {@link Closure} created while
 * it was current, so it may outlive the evaluation that created it, and
 * a change to it is seen by all those closures.
 */
public class Environment {

    /** The enclosing frame or {@code null} for the root. */
    private final Environment outer;

    /** The bindings made in this frame. */
    private final Map<LispSymbol, LispObject> bindings = new HashMap<>();

    /**
     * Create a frame enclosed by another.
     *
     * @param outer enclosing frame or {@code null} for a root frame
     */
    public Environment(Environment outer) { this.outer = outer; }

    /**
     * Create a frame enclosed by another and bind each parameter in turn
     * to the corresponding argument. The frame itself does not check
     * that the number of arguments matches the number of parameters
     * (see {@link Closure#bind(LispObject[])}): bindings are made only
     * for as many as both arrays have.
     *
     * @param outer enclosing frame or {@code null} for a root frame
     * @param params symbols to bind
     * @param args values to bind them to
     */
    public Environment(Environment outer, LispSymbol[] params,
            LispObject[] args) {
        this(outer);
        int n = Math.min(params.length, args.length);
        for (int i = 0; i < n; i++) { bindings.put(params[i], args[i]); }
    }

    /**
     * Bind a symbol in this frame, replacing any binding it has here.
     * Frames further out are not affected.
     *
     * @param symbol to bind
     * @param value to bind it to
     * @return {@code value}
     */
    public LispObject set(LispSymbol symbol, LispObject value) {
        bindings.put(symbol, value);
        return value;
    }

    /**
     * Bind a symbol by name in this frame.
     *
     * @param name of the symbol to bind
     * @param value to bind it to
     * @return {@code value}
     */
    public LispObject set(String name, LispObject value) {
        return set(new LispSymbol(name), value);
    }

    /**
     * Find the innermost frame, starting with this one, that binds the
     * symbol.
     *
     * @param symbol to find
     * @return the frame or {@code null} if no frame binds it
     */
    public Environment find(LispSymbol symbol) {
        for (Environment e = this; e != null; e = e.outer) {
            if (e.bindings.containsKey(symbol)) { return e; }
        }
        return null;
    }

    /**
     * Return the value bound to the symbol in the innermost frame,
     * starting with this one, that binds it.
     *
     * @param symbol to look up
     * @return the value
     * @throws UnboundSymbolError if no frame binds the symbol
     */
    public LispObject get(LispSymbol symbol) throws UnboundSymbolError {
        Environment e = find(symbol);
        if (e == null) { throw new UnboundSymbolError(symbol); }
        return e.bindings.get(symbol);
    }

    /**
     * Return the value bound to a symbol, given its name.
     *
     * @param name of the symbol to look up
     * @return the value
     * @throws UnboundSymbolError if no frame binds the symbol
     */
    public LispObject get(String name) throws UnboundSymbolError {
        return get(new LispSymbol(name));
    }

    /** @return the enclosing frame or {@code null} */
    public Environment getOuter() { return outer; }

    @Override
    public String toString() {
        return String.format("Environment(%d bindings%s)",
                bindings.size(), outer == null ? "" : ", enclosed");
    }
}
