/**
 * The Lisp value model, environments, the evaluator, the printer and the
 * primitive functions. {@link uk.co.farowl.vsl.runtime.Interpreter} is
 * the entry point for an application.
 */
package uk.co.farowl.vsl.runtime;
