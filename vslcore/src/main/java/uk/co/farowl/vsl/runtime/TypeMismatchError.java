// Copyright (c)2025 Jython Developers.
// Licensed to PSF under a contributor agreement.
package uk.co.farowl.vsl.runtime;

/**
 * An operation received a value of the wrong kind, the wrong number of
 * arguments, or a special form was not well formed.
 */
public class TypeMismatchError extends LispError {
    private static final long serialVersionUID = 1L;

    /**
     * Constructor specifying a message.
     *
     * @param msg a Java format string for the message
     * @param args to insert in the format string
     */
    public TypeMismatchError(String msg, Object... args) {
        super(msg, args);
    }

    /**
     * Create an error for an operation given a value not of the
     * expected kind.
     *
     * @param op name of the operation
     * @param expected description of the expected kind(s)
     * @param actual the value given
     * @return the error to throw
     */
    static TypeMismatchError expected(String op, Object expected,
            LispObject actual) {
        return new TypeMismatchError("'%s' expects %s, not %s", op,
                expected, actual.getType());
    }

    /**
     * Create an error for a function given the wrong number of
     * arguments.
     *
     * @param name of the function
     * @param required number of arguments
     * @param collector whether more than {@code required} are allowed
     * @param given number of arguments actually given
     * @return the error to throw
     */
    static TypeMismatchError argumentCount(String name, int required,
            boolean collector, int given) {
        String s = required == 1 ? "" : "s";
        if (collector) {
            return new TypeMismatchError(
                    "'%s' takes at least %d argument%s (%d given)", name,
                    required, s, given);
        } else {
            return new TypeMismatchError(
                    "'%s' takes %d argument%s (%d given)", name, required,
                    s, given);
        }
    }
}
