// Copyright (c)2025 Jython Developers.
// Licensed to PSF under a contributor agreement.
package uk.co.farowl.vsl.runtime;

/** Integer arithmetic overflowed, or a division was by zero. */
public class ArithmeticError extends LispError {
    private static final long serialVersionUID = 1L;

    /**
     * Constructor specifying a message.
     *
     * @param msg a Java format string for the message
     * @param args to insert in the format string
     */
    public ArithmeticError(String msg, Object... args) {
        super(msg, args);
    }
}
