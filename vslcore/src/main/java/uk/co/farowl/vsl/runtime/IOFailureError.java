// Copyright (c)2025 Jython Developers.
// Licensed to PSF under a contributor agreement.
package uk.co.farowl.vsl.runtime;

/** A file could not be read (for example by {@code slurp}). */
public class IOFailureError extends LispError {
    private static final long serialVersionUID = 1L;

    /**
     * Constructor specifying the Java exception behind the failure.
     *
     * @param cause the Java exception
     * @param msg a Java format string for the message
     * @param args to insert in the format string
     */
    public IOFailureError(Exception cause, String msg,
            Object... args) {
        super(msg, args);
        initCause(cause);
    }
}
