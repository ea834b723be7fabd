// Copyright (c)2025 Jython Developers.
// Licensed to PSF under a contributor agreement.
package uk.co.farowl.vsl.runtime;

/**
 * The base of all errors that Lisp evaluation may raise. Every such
 * error carries a Lisp value as its payload: a {@link LispString}
 * holding the message for errors detected by the run-time system, or
 * whatever value was given to {@code throw} (see {@link UserRaised}).
 * <p>
 * A driver wishing to report errors and continue should catch
 * {@code LispError}. Errors that indicate a fault in the run-time system
 * itself are {@code InterpreterError}s and are not caught that way.
 */
public abstract class LispError extends RuntimeException {
    private static final long serialVersionUID = 1L;

    /** The Lisp value describing the error. */
    private final transient LispObject payload;

    /**
     * Constructor for errors detected by the run-time, where the payload
     * is the message as a Lisp string.
     *
     * @param msg a Java format string for the message
     * @param args to insert in the format string
     */
    protected LispError(String msg, Object... args) {
        super(args.length == 0 ? msg : String.format(msg, args));
        this.payload = new LispString(getMessage());
    }

    /**
     * Constructor specifying the payload and a message derived from it.
     *
     * @param payload the Lisp value describing the error
     * @param msg the message
     */
    protected LispError(LispObject payload, String msg) {
        super(msg);
        this.payload = payload;
    }

    /**
     * The Lisp value describing the error.
     *
     * @return the payload
     */
    public LispObject getPayload() { return payload; }

    @Override
    public String toString() {
        return String.format("%s: %s", getClass().getSimpleName(),
                getMessage());
    }
}
