// Copyright (c)2025 Jython Developers.
// Licensed to PSF under a contributor agreement.
package uk.co.farowl.vsl.parser;

/** A token of Lisp source text and its position. */
public class Token {

    /** The kind of token. */
    final TokenType type;

    /** The source text of the token. */
    final String text;

    /** Offset of the start of the token in the source. */
    final int offset;

    /**
     * Create a token.
     *
     * @param type kind of token
     * @param text source text of the token
     * @param offset of the token in the source
     */
    Token(TokenType type, String text, int offset) {
        this.type = type;
        this.text = text;
        this.offset = offset;
    }

    /** @return the kind of token */
    public TokenType getType() { return type; }

    /** @return the source text of the token */
    public String getText() { return text; }

    @Override
    public String toString() {
        return String.format("%s('%s')@%d", type, text, offset);
    }
}
