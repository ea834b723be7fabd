// Copyright (c)2025 Jython Developers.
// Licensed to PSF under a contributor agreement.
package uk.co.farowl.vsl.runtime;

import java.util.Map;

/**
 * Conversion of Lisp values to text. In the "readable" form, strings are
 * quoted and escaped so that the {@code Reader} reproduces an equal
 * value from the text. Otherwise, strings appear as their bare content,
 * which is the form {@code str} and {@code println} want.
 */
public class Printer {

    private Printer() {} // no instances

    /**
     * Return the printed form of a value.
     *
     * @param v to print
     * @param readable whether to quote and escape strings
     * @return the printed form
     */
    public static String print(LispObject v, boolean readable) {
        StringBuilder sb = new StringBuilder();
        append(sb, v, readable);
        return sb.toString();
    }

    /**
     * Return the printed forms of several values, separated by the
     * given text.
     *
     * @param values to print
     * @param readable whether to quote and escape strings
     * @param sep separator
     * @return the printed form
     */
    public static String print(LispObject[] values, boolean readable,
            String sep) {
        StringBuilder sb = new StringBuilder();
        for (int i = 0; i < values.length; i++) {
            if (i > 0) { sb.append(sep); }
            append(sb, values[i], readable);
        }
        return sb.toString();
    }

    private static StringBuilder append(StringBuilder sb, LispObject v,
            boolean readable) {
        return switch (v.getType()) {
            case NIL, BOOLEAN, INTEGER, SYMBOL, KEYWORD -> sb.append(v);
            case STRING -> readable
                    ? appendEscaped(sb, ((LispString)v).value)
                    : sb.append(((LispString)v).value);
            case LIST -> appendSequence(sb, (LispSequence)v, readable,
                    '(', ')');
            case VECTOR -> appendSequence(sb, (LispSequence)v, readable,
                    '[', ']');
            case MAP -> appendMap(sb, (LispMap)v, readable);
            case ATOM -> append(sb.append("(atom "), ((LispAtom)v).deref(),
                    readable).append(')');
            case FUNCTION -> appendFunction(sb, (LispFunction)v);
        };
    }

    private static StringBuilder appendSequence(StringBuilder sb,
            LispSequence seq, boolean readable, char open, char close) {
        sb.append(open);
        for (int i = 0; i < seq.size(); i++) {
            if (i > 0) { sb.append(' '); }
            append(sb, seq.get(i), readable);
        }
        return sb.append(close);
    }

    private static StringBuilder appendMap(StringBuilder sb, LispMap map,
            boolean readable) {
        sb.append('{');
        String sep = "";
        for (Map.Entry<LispObject, LispObject> e : map.entrySet()) {
            append(sb.append(sep), e.getKey(), readable).append(' ');
            append(sb, e.getValue(), readable);
            sep = " ";
        }
        return sb.append('}');
    }

    private static StringBuilder appendFunction(StringBuilder sb,
            LispFunction f) {
        String name = f.getName();
        return name == null ? sb.append("#<function>")
                : sb.append("#<function ").append(name).append('>');
    }

    private static StringBuilder appendEscaped(StringBuilder sb,
            String s) {
        sb.append('"');
        for (int i = 0; i < s.length(); i++) {
            char c = s.charAt(i);
            switch (c) {
                case '"' -> sb.append("\\\"");
                case '\\' -> sb.append("\\\\");
                case '\n' -> sb.append("\\n");
                default -> sb.append(c);
            }
        }
        return sb.append('"');
    }
}
