/**
 * The reader, which turns Lisp source text into the values of
 * {@code uk.co.farowl.vsl.runtime}.
 */
package uk.co.farowl.vsl.parser;
