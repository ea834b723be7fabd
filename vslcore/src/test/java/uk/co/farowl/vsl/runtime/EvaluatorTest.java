// Copyright (c)2025 Jython Developers.
// Licensed to PSF under a contributor agreement.
package uk.co.farowl.vsl.runtime;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.stream.Stream;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.Arguments;
import org.junit.jupiter.params.provider.MethodSource;

/**
 * Test the {@link Evaluator}: the special forms, application of
 * functions, closures and the elimination of tail calls.
 */
class EvaluatorTest extends UnitTestSupport {

    @Nested
    @DisplayName("Evaluation without application")
    class EvalAst {

        @Test
        @DisplayName("constants evaluate to themselves")
        void constants() {
            assertEquals("42", rep("42"));
            assertEquals("\"hi\"", rep("\"hi\""));
            assertEquals(":k", rep(":k"));
            assertEquals("nil", rep("nil"));
            assertEquals("true", rep("true"));
            assertEquals("()", rep("()"));
        }

        @Test
        @DisplayName("a symbol evaluates to its binding")
        void symbol() {
            interp.getEnvironment().set("x", Lisp.val(7));
            assertEquals(Lisp.val(7), eval("x"));
        }

        @Test
        @DisplayName("vector elements and map values are evaluated")
        void collections() {
            assertEquals("[3 \"a\" 2]", rep("[(+ 1 2) \"a\" (* 1 2)]"));
            assertEquals("{:a 3 \"b\" [1]}",
                    rep("{:a (+ 1 2) \"b\" [(- 2 1)]}"));
        }

        @Test
        @DisplayName("an unbound symbol raises UnboundSymbolError")
        void unbound() {
            assertThrows(UnboundSymbolError.class, () -> eval("nope"));
        }
    }

    @Nested
    @DisplayName("Special forms")
    class SpecialForms {

        @Test
        @DisplayName("def! binds and returns the value")
        void def() {
            assertEquals("3", rep("(def! x (+ 1 2))"));
            assertEquals("3", rep("x"));
            assertSame(interp.getEnvironment(), interp.getEnvironment()
                    .find(new LispSymbol("x")));
        }

        @Test
        @DisplayName("let* binds sequentially in a new frame")
        void let() {
            assertEquals("3", rep("(let* (a 1 b (+ a 1)) (+ a b))"));
            assertEquals("6", rep("(let* [a 2 b 3] (* a b))"));
            assertThrows(UnboundSymbolError.class, () -> eval("a"));
        }

        @Test
        @DisplayName("let* shadows an outer binding without changing it")
        void letShadowing() {
            assertEquals("2", rep("(let* (x 1) (let* (x 2) x))"));
            eval("(def! y 10)");
            assertEquals("20", rep("(let* (y 20) y)"));
            assertEquals("10", rep("y"));
        }

        @Test
        @DisplayName("do evaluates in order and returns the last value")
        void doForm() {
            assertEquals("3", rep("(do (def! a 1) (def! b 2) (+ a b))"));
            assertEquals("nil", rep("(do)"));
        }

        @Test
        @DisplayName("if treats only nil and false as false")
        void ifForm() {
            assertEquals("1", rep("(if true 1 2)"));
            assertEquals("2", rep("(if false 1 2)"));
            assertEquals("2", rep("(if nil 1 2)"));
            assertEquals("1", rep("(if 0 1 2)"));
            assertEquals("1", rep("(if () 1 2)"));
            assertEquals("1", rep("(if \"\" 1 2)"));
            assertEquals("nil", rep("(if false 1)"));
        }

        @Test
        @DisplayName("fn* creates a closure")
        void fn() {
            LispObject f = eval("(fn* (a b) (+ a b))");
            Closure c = assertInstanceOf(Closure.class, f);
            assertEquals(2, c.getParameterCount());
            assertEquals("#<function>", rep("(fn* [] 1)"));
            assertEquals("5", rep("((fn* [a b] (+ a b)) 2 3)"));
        }
    }

    static Stream<Arguments> badForms() {
        return Stream.of( //
                Arguments.of("(def! x)", "badly formed 'def!' (2 forms)"),
                Arguments.of("(def! 1 2)",
                        "'def!' expects symbol, not integer"),
                Arguments.of("(let* (a) a)",
                        "'let*' bindings must be pairs (1 forms)"),
                Arguments.of("(let* (1 2) 3)",
                        "'let*' expects symbol, not integer"),
                Arguments.of("(let* 1 2)",
                        "'let*' expects list or vector, not integer"),
                Arguments.of("(if)", "badly formed 'if' (1 forms)"),
                Arguments.of("(if 1 2 3 4)", "badly formed 'if' (5 forms)"),
                Arguments.of("(fn* (1) 2)",
                        "'fn*' expects symbol, not integer"),
                Arguments.of("(fn* (a))", "badly formed 'fn*' (2 forms)"),
                Arguments.of("(1 2)", "1 is not a function"),
                Arguments.of("(\"f\")", "\"f\" is not a function"));
    }

    @DisplayName("A malformed form raises TypeMismatchError")
    @ParameterizedTest(name = "{0}")
    @MethodSource("badForms")
    void malformed(String source, String message) {
        TypeMismatchError e =
                assertThrows(TypeMismatchError.class, () -> eval(source));
        assertEquals(message, e.getMessage());
    }

    @Nested
    @DisplayName("Closures")
    class Closures {

        @Test
        @DisplayName("capture their defining environment")
        void capture() {
            assertEquals("8", rep("(((fn* (x) (fn* (y) (+ x y))) 5) 3)"));
            eval("(def! make-adder (fn* (n) (fn* (m) (+ n m))))");
            eval("(def! add5 (make-adder 5))");
            assertEquals("12", rep("(add5 7)"));
        }

        @Test
        @DisplayName("see later definitions in the enclosing frame")
        void lateBinding() {
            eval("(def! f (fn* () g))");
            eval("(def! g 99)");
            assertEquals("99", rep("(f)"));
        }

        @Test
        @DisplayName("may be recursive")
        void recursion() {
            eval("(def! fib (fn* (n) (if (< n 2) n "
                    + "(+ (fib (- n 1)) (fib (- n 2))))))");
            assertEquals("55", rep("(fib 10)"));
        }

        @Test
        @DisplayName("reject the wrong number of arguments")
        void arity() {
            eval("(def! f (fn* (a b) a))");
            TypeMismatchError e = assertThrows(TypeMismatchError.class,
                    () -> eval("(f 1)"));
            assertEquals("'fn*' takes 2 arguments (1 given)",
                    e.getMessage());
            assertThrows(TypeMismatchError.class, () -> eval("(f 1 2 3)"));
        }

        @Test
        @DisplayName("may be called from Java")
        void callFromJava() {
            LispFunction f = (LispFunction)eval("(fn* (a) (* a a))");
            assertEquals(Lisp.val(49), f.call(Lisp.val(7)));
        }
    }

    @Nested
    @DisplayName("Tail calls")
    class TailCalls {

        static final int N = 100_000;

        @Test
        @DisplayName("in if do not grow the stack")
        void throughIf() {
            eval("(def! sum (fn* (n acc) "
                    + "(if (= n 0) acc (sum (- n 1) (+ n acc)))))");
            long expected = (long)N * (N + 1) / 2;
            assertEquals(Lisp.val(expected), eval("(sum " + N + " 0)"));
        }

        @Test
        @DisplayName("in do and let* do not grow the stack")
        void throughDoAndLet() {
            eval("(def! last (atom nil))");
            eval("(def! count-down (fn* (n) (do (reset! last n) "
                    + "(if (> n 0) (let* (m (- n 1)) (count-down m)) "
                    + ":done))))");
            assertEquals("{:r :done :last 0}", rep(
                    "{:r (count-down " + N + ") :last (deref last)}"));
        }
    }

    @Test
    @DisplayName("A tracing evaluator gives the same results")
    void tracing() {
        Evaluator evaluator = new Evaluator(true);
        assertTrue(evaluator.isTracing());
        assertFalse(interp.getEvaluator().isTracing());
        Environment env = new Environment(interp.getEnvironment());
        assertEquals(Lisp.val(6),
                evaluator.eval(read("(let* (f (fn* (x) (* 2 x))) (f 3))"),
                        env));
    }
}
