// Copyright (c)2025 Jython Developers.
// Licensed to PSF under a contributor agreement.
package uk.co.farowl.vsl.runtime;

import java.io.IOException;
import java.io.PrintStream;
import java.lang.invoke.MethodHandles;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

import uk.co.farowl.vsl.parser.Reader;

/**
 * The primitive functions installed in the root environment before any
 * Lisp code runs. Each function checks the kinds of its arguments and
 * raises {@link TypeMismatchError} if they are not what it needs.
 */
public class CoreModule extends JavaModule {

    /** Where {@code prn} and {@code println} write. */
    private final PrintStream out;

    /**
     * Create the module.
     *
     * @param out where {@code prn} and {@code println} write
     */
    public CoreModule(PrintStream out) {
        super("core", MethodHandles.lookup());
        this.out = out;
    }

    // Arithmetic and comparison --------------------------------------

    @Exposed.Primitive("+")
    static LispObject add(LispObject a, LispObject b) {
        try {
            return LispInteger.valueOf(Math.addExact(
                    Abstract.asLong(a, "+"), Abstract.asLong(b, "+")));
        } catch (ArithmeticException e) {
            throw overflow("+");
        }
    }

    @Exposed.Primitive("-")
    static LispObject subtract(LispObject a, LispObject b) {
        try {
            return LispInteger.valueOf(Math.subtractExact(
                    Abstract.asLong(a, "-"), Abstract.asLong(b, "-")));
        } catch (ArithmeticException e) {
            throw overflow("-");
        }
    }

    @Exposed.Primitive("*")
    static LispObject multiply(LispObject a, LispObject b) {
        try {
            return LispInteger.valueOf(Math.multiplyExact(
                    Abstract.asLong(a, "*"), Abstract.asLong(b, "*")));
        } catch (ArithmeticException e) {
            throw overflow("*");
        }
    }

    /** Division rounds towards negative infinity. */
    @Exposed.Primitive("/")
    static LispObject divide(LispObject a, LispObject b) {
        long v = Abstract.asLong(a, "/"), w = Abstract.asLong(b, "/");
        if (w == 0L) {
            throw new ArithmeticError("integer division by zero");
        } else if (v == Long.MIN_VALUE && w == -1L) {
            throw overflow("/");
        }
        return LispInteger.valueOf(Math.floorDiv(v, w));
    }

    private static ArithmeticError overflow(String op) {
        return new ArithmeticError("integer overflow in '%s'", op);
    }

    @Exposed.Primitive("<")
    static LispObject lt(LispObject a, LispObject b) {
        return Comparison.LT.apply(a, b);
    }

    @Exposed.Primitive("<=")
    static LispObject le(LispObject a, LispObject b) {
        return Comparison.LE.apply(a, b);
    }

    @Exposed.Primitive(">")
    static LispObject gt(LispObject a, LispObject b) {
        return Comparison.GT.apply(a, b);
    }

    @Exposed.Primitive(">=")
    static LispObject ge(LispObject a, LispObject b) {
        return Comparison.GE.apply(a, b);
    }

    @Exposed.Primitive("=")
    static LispObject eq(LispObject a, LispObject b) {
        return Comparison.EQ.apply(a, b);
    }

    // Sequences -------------------------------------------------------

    @Exposed.Primitive("list")
    static LispObject list(LispObject[] args) {
        return LispList.wrap(args);
    }

    @Exposed.Primitive("list?")
    static LispObject isList(LispObject v) {
        return LispBool.valueOf(v.getType() == LispType.LIST);
    }

    @Exposed.Primitive("sequential?")
    static LispObject isSequential(LispObject v) {
        return LispBool.valueOf(v instanceof LispSequence);
    }

    @Exposed.Primitive("empty?")
    static LispObject isEmpty(LispObject v) {
        return LispBool.valueOf(Abstract.asSequence(v, "empty?").isEmpty());
    }

    /** Anything that is not a sequence counts as empty. */
    @Exposed.Primitive("count")
    static LispObject count(LispObject v) {
        return LispInteger.valueOf(
                v instanceof LispSequence s ? s.size() : 0);
    }

    @Exposed.Primitive("cons")
    static LispObject cons(LispObject v, LispObject seq) {
        LispSequence s = Abstract.asSequence(seq, "cons");
        LispObject[] a = new LispObject[s.size() + 1];
        a[0] = v;
        System.arraycopy(s.value, 0, a, 1, s.size());
        return LispList.wrap(a);
    }

    @Exposed.Primitive("concat")
    static LispObject concat(LispObject[] seqs) {
        List<LispObject> result = new ArrayList<>();
        for (LispObject seq : seqs) {
            result.addAll(Abstract.asSequence(seq, "concat").asList());
        }
        return LispList.from(result);
    }

    @Exposed.Primitive("nth")
    static LispObject nth(LispObject seq, LispObject index) {
        LispSequence s = Abstract.asSequence(seq, "nth");
        long i = Abstract.asLong(index, "nth");
        if (i < 0 || i >= s.size()) {
            throw new IndexOutOfRangeError(
                    "nth: index %d out of range for %s of size %d", i,
                    s.getType(), s.size());
        }
        return s.get((int)i);
    }

    @Exposed.Primitive("first")
    static LispObject first(LispObject seq) {
        if (seq == LispNil.INSTANCE) { return seq; }
        LispSequence s = Abstract.asSequence(seq, "first");
        return s.isEmpty() ? LispNil.INSTANCE : s.get(0);
    }

    @Exposed.Primitive("rest")
    static LispObject rest(LispObject seq) {
        if (seq == LispNil.INSTANCE) { return LispList.EMPTY; }
        LispSequence s = Abstract.asSequence(seq, "rest");
        return s.isEmpty() ? LispList.EMPTY : LispList.wrap(s.from(1));
    }

    @Exposed.Primitive("vector")
    static LispObject vector(LispObject[] args) {
        return LispVector.wrap(args);
    }

    @Exposed.Primitive("vector?")
    static LispObject isVector(LispObject v) {
        return LispBool.valueOf(v.getType() == LispType.VECTOR);
    }

    @Exposed.Primitive("vec")
    static LispObject vec(LispObject v) {
        if (v instanceof LispVector) { return v; }
        return LispVector.wrap(Abstract.asList(v, "vec").from(0));
    }

    // Functions -------------------------------------------------------

    /** The last argument is a sequence of further arguments. */
    @Exposed.Primitive("apply")
    static LispObject apply(LispObject f, LispObject[] args) {
        LispFunction function = Abstract.asFunction(f, "apply");
        int n = args.length;
        if (n == 0) {
            throw TypeMismatchError.argumentCount("apply", 2, true, 1);
        }
        LispSequence tail = Abstract.asSequence(args[n - 1], "apply");
        LispObject[] a = new LispObject[n - 1 + tail.size()];
        System.arraycopy(args, 0, a, 0, n - 1);
        System.arraycopy(tail.value, 0, a, n - 1, tail.size());
        return function.call(a);
    }

    @Exposed.Primitive("map")
    static LispObject map(LispObject f, LispObject seq) {
        LispFunction function = Abstract.asFunction(f, "map");
        LispSequence s = Abstract.asSequence(seq, "map");
        LispObject[] result = new LispObject[s.size()];
        for (int i = 0; i < result.length; i++) {
            result[i] = function.call(s.get(i));
        }
        return LispList.wrap(result);
    }

    // Maps ------------------------------------------------------------

    @Exposed.Primitive("map?")
    static LispObject isMap(LispObject v) {
        return LispBool.valueOf(v.getType() == LispType.MAP);
    }

    @Exposed.Primitive("hash-map")
    static LispObject hashMap(LispObject[] kvs) {
        return LispMap.fromPairs(kvs);
    }

    @Exposed.Primitive("assoc")
    static LispObject assoc(LispObject map, LispObject[] kvs) {
        return Abstract.asMap(map, "assoc").assoc(kvs);
    }

    @Exposed.Primitive("dissoc")
    static LispObject dissoc(LispObject map, LispObject[] keys) {
        return Abstract.asMap(map, "dissoc").dissoc(keys);
    }

    @Exposed.Primitive("get")
    static LispObject get(LispObject map, LispObject key) {
        if (map == LispNil.INSTANCE) { return map; }
        LispObject v = Abstract.asMap(map, "get").get(key);
        return v == null ? LispNil.INSTANCE : v;
    }

    @Exposed.Primitive("contains?")
    static LispObject contains(LispObject map, LispObject key) {
        return LispBool
                .valueOf(Abstract.asMap(map, "contains?").containsKey(key));
    }

    @Exposed.Primitive("keys")
    static LispObject keys(LispObject map) {
        return Abstract.asMap(map, "keys").keys();
    }

    @Exposed.Primitive("vals")
    static LispObject vals(LispObject map) {
        return Abstract.asMap(map, "vals").vals();
    }

    // Type predicates and conversions ---------------------------------

    @Exposed.Primitive("nil?")
    static LispObject isNil(LispObject v) {
        return LispBool.valueOf(v == LispNil.INSTANCE);
    }

    @Exposed.Primitive("true?")
    static LispObject isTrue(LispObject v) {
        return LispBool.valueOf(v == LispBool.TRUE);
    }

    @Exposed.Primitive("false?")
    static LispObject isFalse(LispObject v) {
        return LispBool.valueOf(v == LispBool.FALSE);
    }

    @Exposed.Primitive("symbol?")
    static LispObject isSymbol(LispObject v) {
        return LispBool.valueOf(v.getType() == LispType.SYMBOL);
    }

    @Exposed.Primitive("keyword?")
    static LispObject isKeyword(LispObject v) {
        return LispBool.valueOf(v.getType() == LispType.KEYWORD);
    }

    @Exposed.Primitive("symbol")
    static LispObject symbol(LispObject name) {
        return new LispSymbol(Abstract.asString(name, "symbol"));
    }

    @Exposed.Primitive("keyword")
    static LispObject keyword(LispObject name) {
        if (name instanceof LispKeyword) { return name; }
        return new LispKeyword(Abstract.asString(name, "keyword"));
    }

    // Text and I/O ----------------------------------------------------

    @Exposed.Primitive("pr-str")
    static LispObject prStr(LispObject[] args) {
        return new LispString(Printer.print(args, true, " "));
    }

    @Exposed.Primitive("str")
    static LispObject str(LispObject[] args) {
        return new LispString(Printer.print(args, false, ""));
    }

    @Exposed.Primitive("prn")
    LispObject prn(LispObject[] args) {
        out.println(Printer.print(args, true, " "));
        return LispNil.INSTANCE;
    }

    @Exposed.Primitive("println")
    LispObject println(LispObject[] args) {
        out.println(Printer.print(args, false, " "));
        return LispNil.INSTANCE;
    }

    @Exposed.Primitive("read-string")
    static LispObject readString(LispObject text) {
        String s = Abstract.asString(text, "read-string");
        LispObject v = Reader.readString(s);
        return v == null ? LispNil.INSTANCE : v;
    }

    @Exposed.Primitive("slurp")
    static LispObject slurp(LispObject filename) {
        String name = Abstract.asString(filename, "slurp");
        try {
            return new LispString(
                    Files.readString(Path.of(name), StandardCharsets.UTF_8));
        } catch (IOException | InvalidPathException e) {
            throw new IOFailureError(e, "slurp: cannot read '%s'", name);
        }
    }

    // Atoms -----------------------------------------------------------

    @Exposed.Primitive("atom")
    static LispObject atom(LispObject v) {
        return new LispAtom(v);
    }

    @Exposed.Primitive("atom?")
    static LispObject isAtom(LispObject v) {
        return LispBool.valueOf(v.getType() == LispType.ATOM);
    }

    @Exposed.Primitive("deref")
    static LispObject deref(LispObject atom) {
        return Abstract.asAtom(atom, "deref").deref();
    }

    @Exposed.Primitive("reset!")
    static LispObject reset(LispObject atom, LispObject v) {
        return Abstract.asAtom(atom, "reset!").reset(v);
    }

    /**
     * Replace the content of an atom with the result of calling a
     * function on the current content and any further arguments.
     */
    @Exposed.Primitive("swap!")
    static LispObject swap(LispObject atom, LispObject f,
            LispObject[] args) {
        LispAtom a = Abstract.asAtom(atom, "swap!");
        LispFunction function = Abstract.asFunction(f, "swap!");
        LispObject[] a2 = new LispObject[args.length + 1];
        a2[0] = a.deref();
        System.arraycopy(args, 0, a2, 1, args.length);
        return a.reset(function.call(a2));
    }

    // Errors ----------------------------------------------------------

    @Exposed.Primitive("throw")
    static LispObject throwValue(LispObject v) {
        throw new UserRaised(v);
    }
}
