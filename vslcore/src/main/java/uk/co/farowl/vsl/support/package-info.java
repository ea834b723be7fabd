/**
 * Classes that support the run-time system but are not part of the
 * Lisp value model, chiefly the internal {@link InterpreterError}.
 */
package uk.co.farowl.vsl.support;
