// Copyright (c)2025 Jython Developers.
// Licensed to PSF under a contributor agreement.
package uk.co.farowl.vsl.parser;

/** The kinds of {@link Token} the {@link Tokenizer} produces. */
public enum TokenType {
    /** {@code (} */
    LPAR("("),
    /** {@code )} */
    RPAR(")"),
    /** {@code [} */
    LSQB("["),
    /** {@code ]} */
    RSQB("]"),
    /** Left brace. */
    LBRACE("{"),
    /** Right brace. */
    RBRACE("}"),
    /** A string literal, including the quotes. */
    STRING("string"),
    /** A symbol, keyword, number or constant. */
    ATOM("atom"),
    /**
     * One of the reader macro characters {@code ' ` ~ ~@ @ ^}, which
     * this reader does not support.
     */
    MACRO("macro"),
    /** A string literal missing its closing quote. */
    ERRORTOKEN("error");

    /** The text or description of the token. */
    final String text;

    TokenType(String text) { this.text = text; }
}
