// Copyright (c)2025 Jython Developers.
// Licensed to PSF under a contributor agreement.
package uk.co.farowl.vsl.runtime;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.lang.invoke.MethodHandles;
import java.util.Map;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import uk.co.farowl.vsl.runtime.Exposed.Primitive;
import uk.co.farowl.vsl.support.InterpreterError;

/**
 * Test that the {@link ModuleExposer} creates functions from the
 * annotated methods of a {@link JavaModule}, and rejects methods it
 * cannot support.
 */
class ModuleExposerTest {

    /** A module with a variety of acceptable signatures. */
    static class ExampleModule extends JavaModule {

        private long calls = 0;

        ExampleModule() { super("example", MethodHandles.lookup()); }

        @Primitive("k")
        static LispObject k(LispObject a, LispObject b) { return a; }

        @Primitive("zero")
        static LispInteger zero() { return LispInteger.valueOf(0); }

        @Primitive("count-rest")
        LispObject countRest(LispObject a, LispObject[] rest) {
            calls++;
            return LispInteger.valueOf(rest.length);
        }

        @Primitive("calls")
        private LispObject calls() { return LispInteger.valueOf(calls); }

        @Primitive("fail")
        static LispObject fail() throws Exception {
            throw new Exception("checked");
        }

        /** Not annotated, so not exposed. */
        static LispObject hidden() { return LispNil.INSTANCE; }
    }

    @Nested
    @DisplayName("An acceptable module")
    class Acceptable {

        final ExampleModule module = new ExampleModule();
        final Map<String, NativeFunction> functions =
                module.getFunctions();

        @Test
        @DisplayName("exposes exactly the annotated methods")
        void names() {
            assertEquals("[calls, count-rest, fail, k, zero]",
                    functions.keySet().toString());
            assertEquals("<module 'example'>", module.toString());
        }

        @Test
        @DisplayName("calls static methods with fixed arity")
        void fixed() {
            LispObject a = Lisp.str("a");
            assertEquals(a, functions.get("k").call(a, Lisp.NIL));
            assertEquals(Lisp.val(0), functions.get("zero").call());
            TypeMismatchError e = assertThrows(TypeMismatchError.class,
                    () -> functions.get("k").call(a));
            assertEquals("'k' takes 2 arguments (1 given)", e.getMessage());
        }

        @Test
        @DisplayName("collects excess arguments in a trailing array")
        void collector() {
            NativeFunction f = functions.get("count-rest");
            assertEquals(Lisp.val(0), f.call(Lisp.NIL));
            assertEquals(Lisp.val(3),
                    f.call(Lisp.NIL, Lisp.NIL, Lisp.TRUE, Lisp.FALSE));
            assertThrows(TypeMismatchError.class, () -> f.call());
        }

        @Test
        @DisplayName("binds instance methods to the module")
        void instance() {
            functions.get("count-rest").call(Lisp.NIL);
            functions.get("count-rest").call(Lisp.NIL, Lisp.NIL);
            assertEquals(Lisp.val(2), functions.get("calls").call());
        }

        @Test
        @DisplayName("installs the functions by name")
        void install() {
            Environment env = new Environment(null);
            module.install(env);
            assertEquals(functions.get("zero"), env.get("zero"));
            assertEquals("zero", ((LispFunction)env.get("zero")).getName());
        }

        @Test
        @DisplayName("reports a checked exception as InterpreterError")
        void checked() {
            InterpreterError e = assertThrows(InterpreterError.class,
                    () -> functions.get("fail").call());
            assertInstanceOf(Exception.class, e.getCause());
        }
    }

    static class DuplicateModule extends JavaModule {

        DuplicateModule() { super("duplicate", MethodHandles.lookup()); }

        @Primitive("f")
        static LispObject f1() { return LispNil.INSTANCE; }

        @Primitive("f")
        static LispObject f2() { return LispNil.INSTANCE; }
    }

    static class BadReturnModule extends JavaModule {

        BadReturnModule() { super("bad-return", MethodHandles.lookup()); }

        @Primitive("f")
        static String f() { return ""; }
    }

    static class BadParameterModule extends JavaModule {

        BadParameterModule() { super("bad-param", MethodHandles.lookup()); }

        @Primitive("f")
        static LispObject f(LispObject a, long n) { return a; }
    }

    static class MisplacedArrayModule extends JavaModule {

        MisplacedArrayModule() { super("misplaced", MethodHandles.lookup()); }

        @Primitive("f")
        static LispObject f(LispObject[] rest, LispObject a) { return a; }
    }

    @Test
    @DisplayName("A duplicate name is rejected")
    void duplicate() {
        assertThrows(InterpreterError.class, () -> new DuplicateModule());
    }

    @Test
    @DisplayName("A return type that is not a Lisp value is rejected")
    void badReturn() {
        assertThrows(InterpreterError.class, () -> new BadReturnModule());
    }

    @Test
    @DisplayName("A parameter that is not a Lisp value is rejected")
    void badParameter() {
        assertThrows(InterpreterError.class,
                () -> new BadParameterModule());
    }

    @Test
    @DisplayName("An array parameter is only allowed last")
    void misplacedArray() {
        assertThrows(InterpreterError.class,
                () -> new MisplacedArrayModule());
    }
}
