// Copyright (c)2025 Jython Developers.
// Licensed to PSF under a contributor agreement.
package uk.co.farowl.vsl.parser;

import java.util.Iterator;
import java.util.NoSuchElementException;

/**
 * The Tokenizer is an iterator that takes a {@code CharSequence} and
 * returns the tokens in the provided text. Whitespace and commas
 * separate tokens and are otherwise ignored, as is a comment, which
 * runs from a {@code ;} to the end of the line.
 */
public class Tokenizer implements Iterator<Token> {

    /** Characters that end an atom (as well as whitespace). */
    private static final String DELIMITERS = "[]{}()'\"`,;";

    private final CharSequence source;
    private int pos = 0;

    /** The token {@link #next()} will return, or {@code null}. */
    private Token pending;

    /**
     * Create a tokenizer on the given text.
     *
     * @param source text to tokenize
     */
    public Tokenizer(CharSequence source) { this.source = source; }

    @Override
    public boolean hasNext() {
        if (pending == null) { pending = get(); }
        return pending != null;
    }

    @Override
    public Token next() {
        if (!hasNext()) { throw new NoSuchElementException(); }
        Token t = pending;
        pending = null;
        return t;
    }

    /**
     * Return the token that {@link #next()} will return, without
     * consuming it.
     *
     * @return the next token or {@code null} at the end of the source
     */
    public Token peek() { return hasNext() ? pending : null; }

    private char nextc() {
        return pos < source.length() ? source.charAt(pos++) : '\0';
    }

    private char peekc() {
        return pos < source.length() ? source.charAt(pos) : '\0';
    }

    private boolean atEnd() { return pos >= source.length(); }

    private static boolean isSeparator(char c) {
        return Character.isWhitespace(c) || c == ',';
    }

    /**
     * Scan the source for the next token.
     *
     * @return the token or {@code null} at the end of the source
     */
    private Token get() {
        // Skip separators and comments
        for (;;) {
            if (atEnd()) { return null; }
            char c = peekc();
            if (isSeparator(c)) {
                pos++;
            } else if (c == ';') {
                while (!atEnd() && peekc() != '\n') { pos++; }
            } else {
                break;
            }
        }

        int start = pos;
        char c = nextc();
        switch (c) {
            case '(':
                return token(TokenType.LPAR, start);
            case ')':
                return token(TokenType.RPAR, start);
            case '[':
                return token(TokenType.LSQB, start);
            case ']':
                return token(TokenType.RSQB, start);
            case '{':
                return token(TokenType.LBRACE, start);
            case '}':
                return token(TokenType.RBRACE, start);
            case '~':
                if (peekc() == '@') { pos++; }
                return token(TokenType.MACRO, start);
            case '\'':
            case '`':
            case '@':
            case '^':
                return token(TokenType.MACRO, start);
            case '"':
                return string(start);
            default:
                while (!atEnd() && !isSeparator(peekc())
                        && DELIMITERS.indexOf(peekc()) < 0) {
                    pos++;
                }
                return token(TokenType.ATOM, start);
        }
    }

    /** Scan the rest of a string literal, after the opening quote. */
    private Token string(int start) {
        while (!atEnd()) {
            char c = nextc();
            if (c == '\\') {
                // Skip the escaped character (if there is one)
                nextc();
            } else if (c == '"') {
                return token(TokenType.STRING, start);
            }
        }
        pos = source.length();
        return token(TokenType.ERRORTOKEN, start);
    }

    private Token token(TokenType type, int start) {
        return new Token(type, source.subSequence(start, pos).toString(),
                start);
    }
}
