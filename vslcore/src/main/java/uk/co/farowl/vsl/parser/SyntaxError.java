// Copyright (c)2025 Jython Developers.
// Licensed to PSF under a contributor agreement.
package uk.co.farowl.vsl.parser;

import uk.co.farowl.vsl.runtime.LispError;

/** Source text given to the {@link Reader} is not well formed. */
public class SyntaxError extends LispError {
    private static final long serialVersionUID = 1L;

    /**
     * Constructor specifying a message.
     *
     * @param msg a Java format string for the message
     * @param args to insert in the format string
     */
    public SyntaxError(String msg, Object... args) { super(msg, args); }
}
