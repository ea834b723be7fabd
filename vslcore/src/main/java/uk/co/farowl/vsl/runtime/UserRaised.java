// Copyright (c)2025 Jython Developers.
// Licensed to PSF under a contributor agreement.
package uk.co.farowl.vsl.runtime;

/**
 * The error raised by the {@code throw} primitive, carrying an arbitrary
 * Lisp value. Unlike the other errors, it describes a condition the Lisp
 * program itself chose to signal, not a violation detected by the
 * run-time.
 */
public class UserRaised extends LispError {
    private static final long serialVersionUID = 1L;

    /**
     * Constructor specifying the value thrown.
     *
     * @param value thrown
     */
    public UserRaised(LispObject value) {
        super(value, Printer.print(value, false));
    }
}
