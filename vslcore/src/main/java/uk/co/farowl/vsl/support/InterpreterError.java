// Copyright (c)2025 Jython Developers.
// Licensed to PSF under a contributor agreement.
package uk.co.farowl.vsl.support;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Internal error thrown when the run-time system cannot be relied on to
 * work. A Lisp error (one that a program could in principle expect and
 * report) is not then appropriate. An {@code InterpreterError} is
 * typically thrown while building the root environment, when a module
 * defines its primitives incorrectly, or for irrecoverable internal
 * errors.
 * <p>
 * This class is deliberately not a subclass of
 * {@code uk.co.farowl.vsl.runtime.LispError}: a driver that reports Lisp
 * errors and carries on should not treat these the same way.
 */
public class InterpreterError extends RuntimeException {
    private static final long serialVersionUID = 1L;

    /**
     * Logger for interpreter errors. A proportion of these are thrown
     * while the root environment is being built, where a driver may not
     * yet be in a position to report them.
     */
    static final Logger logger =
            LoggerFactory.getLogger(InterpreterError.class);

    /**
     * Constructor specifying a message.
     *
     * @param msg a Java format string for the message
     * @param args to insert in the format string
     */
    public InterpreterError(String msg, Object... args) {
        super(String.format(msg, args));
        logger.atInfo().log(getMessage());
    }

    /**
     * Constructor specifying a cause and a message.
     *
     * @param cause a Java exception behind the interpreter error
     * @param msg a Java format string for the message
     * @param args to insert in the format string
     */
    public InterpreterError(Throwable cause, String msg,
            Object... args) {
        super(String.format(msg, args), cause);
        logger.atInfo().log(getMessage());
        logger.atInfo().log(cause.getMessage());
    }
}
