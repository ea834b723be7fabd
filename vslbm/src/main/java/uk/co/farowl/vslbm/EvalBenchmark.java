// Copyright (c)2025 Jython Developers.
// Licensed to PSF under a contributor agreement.
package uk.co.farowl.vslbm;

import java.util.concurrent.TimeUnit;

import org.openjdk.jmh.annotations.Benchmark;
import org.openjdk.jmh.annotations.BenchmarkMode;
import org.openjdk.jmh.annotations.Fork;
import org.openjdk.jmh.annotations.Measurement;
import org.openjdk.jmh.annotations.Mode;
import org.openjdk.jmh.annotations.OutputTimeUnit;
import org.openjdk.jmh.annotations.Scope;
import org.openjdk.jmh.annotations.Setup;
import org.openjdk.jmh.annotations.State;
import org.openjdk.jmh.annotations.Warmup;

import uk.co.farowl.vsl.parser.Reader;
import uk.co.farowl.vsl.runtime.Interpreter;
import uk.co.farowl.vsl.runtime.Lisp;
import uk.co.farowl.vsl.runtime.LispObject;

/**
 * This is a JMH benchmark for evaluation of small Lisp expressions by
 * the interpreter. Each expression is read once during set-up, so that
 * only evaluation is measured, except in {@link #read()}. Where it makes
 * sense, comparison is with the same calculation in-line in Java.
 */
@BenchmarkMode(Mode.AverageTime)
@OutputTimeUnit(TimeUnit.NANOSECONDS)

@Fork(2)
@Warmup(iterations = 20, time = 1, timeUnit = TimeUnit.SECONDS)
@Measurement(iterations = 10, time = 1, timeUnit = TimeUnit.SECONDS)

@State(Scope.Thread)
public class EvalBenchmark {

    static final String SUM_SOURCE = "(def! sum (fn* (n acc) "
            + "(if (= n 0) acc (sum (- n 1) (+ n acc)))))";

    static final String FIB_SOURCE = "(def! fib (fn* (n) "
            + "(if (< n 2) n (+ (fib (- n 1)) (fib (- n 2))))))";

    static final String MAP_SOURCE =
            "(get (assoc {\"a\" 1} :b 2 \"c\" 3) :b)";

    Interpreter interp;

    long v = 6, w = 7;

    LispObject add, sum, fib, map;

    @Setup
    public void setup() {
        interp = new Interpreter();
        interp.evalString(SUM_SOURCE);
        interp.evalString(FIB_SOURCE);
        interp.getEnvironment().set("v", Lisp.val(v));
        interp.getEnvironment().set("w", Lisp.val(w));
        add = Reader.readString("(+ v w)");
        sum = Reader.readString("(sum 1000 0)");
        fib = Reader.readString("(fib 15)");
        map = Reader.readString(MAP_SOURCE);
    }

    @Benchmark
    public long add_java() { return v + w; }

    @Benchmark
    public LispObject add() { return interp.eval(add); }

    @Benchmark
    public long sum_java() {
        long acc = 0;
        for (long n = 1000; n > 0; n--) { acc += n; }
        return acc;
    }

    @Benchmark
    @OutputTimeUnit(TimeUnit.MICROSECONDS)
    public LispObject sum() { return interp.eval(sum); }

    @Benchmark
    @OutputTimeUnit(TimeUnit.MICROSECONDS)
    public LispObject fib() { return interp.eval(fib); }

    @Benchmark
    public LispObject map() { return interp.eval(map); }

    @Benchmark
    public LispObject read() { return Reader.readString(FIB_SOURCE); }
}
