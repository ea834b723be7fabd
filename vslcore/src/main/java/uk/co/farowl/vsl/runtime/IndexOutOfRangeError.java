// Copyright (c)2025 Jython Developers.
// Licensed to PSF under a contributor agreement.
package uk.co.farowl.vsl.runtime;

/** A sequence was indexed outside its bounds. */
public class IndexOutOfRangeError extends LispError {
    private static final long serialVersionUID = 1L;

    /**
     * Constructor specifying a message.
     *
     * @param msg a Java format string for the message
     * @param args to insert in the format string
     */
    public IndexOutOfRangeError(String msg, Object... args) {
        super(msg, args);
    }
}
