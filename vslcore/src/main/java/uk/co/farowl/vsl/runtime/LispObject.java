// Copyright (c)2025 Jython Developers.
// Licensed to PSF under a contributor agreement.
package uk.co.farowl.vsl.runtime;

/**
 * All values in the Lisp run-time implement this interface. The value
 * model is closed: the only implementations are the {@code Lisp*}
 * classes of this package, one for each constant of {@link LispType}
 * (with {@link LispFunction} having a native and a closure form).
 * <p>
 * Every kind except {@link LispAtom} is immutable once constructed.
 */
public interface LispObject {

    /**
     * The kind of this value, used to dispatch in the evaluator,
     * printer and primitive operations.
     *
     * @return the kind of this value
     */
    LispType getType();
}
