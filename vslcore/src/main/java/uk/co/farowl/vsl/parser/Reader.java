// Copyright (c)2025 Jython Developers.
// Licensed to PSF under a contributor agreement.
package uk.co.farowl.vsl.parser;

import java.util.ArrayList;
import java.util.List;

import uk.co.farowl.vsl.runtime.Lisp;
import uk.co.farowl.vsl.runtime.LispKeyword;
import uk.co.farowl.vsl.runtime.LispList;
import uk.co.farowl.vsl.runtime.LispMap;
import uk.co.farowl.vsl.runtime.LispObject;
import uk.co.farowl.vsl.runtime.LispVector;
import uk.co.farowl.vsl.runtime.TypeMismatchError;

/**
 * The Lisp reader, which turns source text into Lisp values. It
 * understands lists {@code (...)}, vectors {@code [...]}, maps in
 * braces, string literals with the escapes {@code \"}, {@code \\} and
 * {@code \n}, integers, keywords ({@code :name}), the constants
 * {@code nil}, {@code true} and {@code false}, and symbols. Every
 * malformed text, including a map literal with a key that is not a
 * string or keyword, raises a {@link SyntaxError}.
 */
public class Reader {

    private final Tokenizer tokens;

    private Reader(String source) { this.tokens = new Tokenizer(source); }

    /**
     * Read the first form in the source text.
     *
     * @param source text to read
     * @return the form read or {@code null} if the source contains only
     *     whitespace and comments
     * @throws SyntaxError if the text is not well formed
     */
    public static LispObject readString(String source) throws SyntaxError {
        Reader reader = new Reader(source);
        return reader.tokens.hasNext() ? reader.readForm() : null;
    }

    private LispObject readForm() throws SyntaxError {
        Token t = tokens.next();
        return switch (t.type) {
            case LPAR -> LispList.from(readElements(TokenType.RPAR));
            case LSQB -> LispVector.from(readElements(TokenType.RSQB));
            case LBRACE -> readMap();
            case RPAR, RSQB, RBRACE -> throw new SyntaxError(
                    "unexpected '%s' at %d", t.text, t.offset);
            case STRING -> Lisp.str(unescape(t.text));
            case ATOM -> readAtom(t.text);
            case MACRO -> throw new SyntaxError(
                    "reader macro '%s' is not supported", t.text);
            case ERRORTOKEN -> throw new SyntaxError(
                    "unbalanced string at %d", t.offset);
        };
    }

    /**
     * Read forms up to the given closing token, which is consumed.
     *
     * @param close type of the closing token
     * @return the forms read
     */
    private List<LispObject> readElements(TokenType close)
            throws SyntaxError {
        List<LispObject> elements = new ArrayList<>();
        for (;;) {
            Token t = tokens.peek();
            if (t == null) {
                throw new SyntaxError("expected '%s', got EOF",
                        close.text);
            } else if (t.type == close) {
                tokens.next();
                return elements;
            }
            elements.add(readForm());
        }
    }

    private LispMap readMap() throws SyntaxError {
        List<LispObject> kvs = readElements(TokenType.RBRACE);
        if (kvs.size() % 2 != 0) {
            throw new SyntaxError("map literal needs an even number "
                    + "of forms (%d given)", kvs.size());
        }
        try {
            return LispMap.fromPairs(kvs.toArray(new LispObject[0]));
        } catch (TypeMismatchError e) {
            throw new SyntaxError("bad map literal: %s", e.getMessage());
        }
    }

    private static LispObject readAtom(String text) throws SyntaxError {
        switch (text) {
            case "nil":
                return Lisp.NIL;
            case "true":
                return Lisp.TRUE;
            case "false":
                return Lisp.FALSE;
            default:
                break;
        }

        if (isInteger(text)) {
            try {
                return Lisp.val(Long.parseLong(text));
            } catch (NumberFormatException e) {
                throw new SyntaxError("integer literal too large: %s",
                        text);
            }
        } else if (text.charAt(0) == LispKeyword.MARKER) {
            return Lisp.keyword(text.substring(1));
        } else {
            return Lisp.symbol(text);
        }
    }

    /** Test for an optional minus sign followed by decimal digits. */
    private static boolean isInteger(String text) {
        int i = text.charAt(0) == '-' ? 1 : 0;
        if (i == text.length()) { return false; }
        for (; i < text.length(); i++) {
            char c = text.charAt(i);
            if (c < '0' || c > '9') { return false; }
        }
        return true;
    }

    /**
     * Remove the quotes from a string literal and process its escapes.
     *
     * @param literal including the quotes
     * @return the content
     */
    private static String unescape(String literal) {
        StringBuilder sb = new StringBuilder(literal.length());
        int end = literal.length() - 1;
        for (int i = 1; i < end; i++) {
            char c = literal.charAt(i);
            if (c == '\\' && i + 1 < end) {
                char e = literal.charAt(++i);
                sb.append(e == 'n' ? '\n' : e);
            } else {
                sb.append(c);
            }
        }
        return sb.toString();
    }
}
