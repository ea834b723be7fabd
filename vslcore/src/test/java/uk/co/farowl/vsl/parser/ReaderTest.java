// Copyright (c)2025 Jython Developers.
// Licensed to PSF under a contributor agreement.
package uk.co.farowl.vsl.parser;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.util.stream.Stream;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.Arguments;
import org.junit.jupiter.params.provider.MethodSource;

import uk.co.farowl.vsl.runtime.Lisp;
import uk.co.farowl.vsl.runtime.LispKeyword;
import uk.co.farowl.vsl.runtime.LispList;
import uk.co.farowl.vsl.runtime.LispMap;
import uk.co.farowl.vsl.runtime.LispObject;
import uk.co.farowl.vsl.runtime.LispType;
import uk.co.farowl.vsl.runtime.LispVector;

/** Test the {@link Reader}. */
class ReaderTest {

    private static LispObject read(String source) {
        return Reader.readString(source);
    }

    @Nested
    @DisplayName("Atoms")
    class Atoms {

        @Test
        @DisplayName("nil, true and false are the constants")
        void constants() {
            assertSame(Lisp.NIL, read("nil"));
            assertSame(Lisp.TRUE, read("true"));
            assertSame(Lisp.FALSE, read("false"));
        }

        @Test
        @DisplayName("integers may be negative")
        void integers() {
            assertEquals(Lisp.val(0), read("0"));
            assertEquals(Lisp.val(123), read("123"));
            assertEquals(Lisp.val(-45), read("-45"));
            assertEquals(Lisp.val(Long.MIN_VALUE),
                    read("-9223372036854775808"));
        }

        @Test
        @DisplayName("keywords begin with a colon")
        void keywords() {
            assertEquals(Lisp.keyword("abc"), read(":abc"));
            assertEquals(LispType.KEYWORD, read(":a-b?").getType());
        }

        @Test
        @DisplayName("anything else is a symbol")
        void symbols() {
            assertEquals(Lisp.symbol("abc"), read("abc"));
            assertEquals(Lisp.symbol("-"), read("-"));
            assertEquals(Lisp.symbol("-x"), read("-x"));
            assertEquals(Lisp.symbol("1a"), read("1a"));
            assertEquals(Lisp.symbol("nil?"), read("nil?"));
            assertEquals(Lisp.symbol("*ARGV*"), read("*ARGV*"));
        }

        @Test
        @DisplayName("strings are unescaped")
        void strings() {
            assertEquals(Lisp.str(""), read("\"\""));
            assertEquals(Lisp.str("a\nb"), read("\"a\\nb\""));
            assertEquals(Lisp.str("say \"x\""), read("\"say \\\"x\\\"\""));
            assertEquals(Lisp.str("back\\slash"),
                    read("\"back\\\\slash\""));
            assertEquals(Lisp.str("semi;colon, comma"),
                    read("\"semi;colon, comma\""));
        }
    }

    @Nested
    @DisplayName("Collections")
    class Collections {

        @Test
        @DisplayName("lists and vectors are distinct kinds")
        void sequences() {
            LispObject list = read("(1 [2 3] ())");
            LispList l = assertInstanceOf(LispList.class, list);
            assertEquals(3, l.size());
            assertInstanceOf(LispVector.class, l.get(1));
            assertEquals(LispList.EMPTY, l.get(2));
            assertEquals(Lisp.vector(), read("[]"));
        }

        @Test
        @DisplayName("maps keep the order of their entries")
        void maps() {
            LispMap m = assertInstanceOf(LispMap.class,
                    read("{:b 1, \"a\" {:c [nil]}}"));
            assertEquals(2, m.size());
            assertEquals("(:b \"a\")", m.keys().toString());
            assertEquals(Lisp.val(1), m.get(Lisp.keyword("b")));
        }

        @Test
        @DisplayName("a map key must be a string or keyword")
        void badKey() {
            SyntaxError e =
                    assertThrows(SyntaxError.class, () -> read("{1 2}"));
            assertEquals("bad map literal: map key must be a string or "
                    + "keyword, not integer", e.getMessage());
            assertThrows(SyntaxError.class, () -> read("{:a 1 [] 2}"));
        }

        @Test
        @DisplayName("a keyword has the marker only in its printed form")
        void keywordMarker() {
            LispKeyword k = assertInstanceOf(LispKeyword.class,
                    read(LispKeyword.MARKER + "name"));
            assertEquals("name", k.getName());
            assertEquals(":name", k.toString());
        }
    }

    @Test
    @DisplayName("Only the first form is read")
    void firstForm() {
        assertEquals(Lisp.val(1), read("1 2 3"));
        assertEquals(Lisp.list(Lisp.symbol("a")), read(" ;c\n (a) (b"));
    }

    @Test
    @DisplayName("Text with no form reads as null")
    void noForm() {
        assertNull(read(""));
        assertNull(read("  \n\t ,"));
        assertNull(read(";; just a comment"));
    }

    static Stream<Arguments> syntaxErrors() {
        return Stream.of( //
                Arguments.of("(1 2", "expected ')', got EOF"),
                Arguments.of("[1 (2)", "expected ']', got EOF"),
                Arguments.of("{:a 1", "expected '}', got EOF"),
                Arguments.of("(1 2]", "unexpected ']' at 4"),
                Arguments.of(")", "unexpected ')' at 0"),
                Arguments.of("\"abc", "unbalanced string at 0"),
                Arguments.of("(\"abc\\\")", "unbalanced string at 1"),
                Arguments.of("{:a 1 :b}",
                        "map literal needs an even number of forms (3 given)"),
                Arguments.of("'a", "reader macro ''' is not supported"),
                Arguments.of("(a ~@b)", "reader macro '~@' is not supported"),
                Arguments.of("@a", "reader macro '@' is not supported"),
                Arguments.of("99999999999999999999",
                        "integer literal too large: 99999999999999999999"));
    }

    @DisplayName("Malformed text raises SyntaxError")
    @ParameterizedTest(name = "{0}")
    @MethodSource("syntaxErrors")
    void syntaxError(String source, String message) {
        SyntaxError e =
                assertThrows(SyntaxError.class, () -> read(source));
        assertEquals(message, e.getMessage());
    }
}
