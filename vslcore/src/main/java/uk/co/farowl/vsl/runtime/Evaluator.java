// Copyright (c)2025 Jython Developers.
// Licensed to PSF under a contributor agreement.
package uk.co.farowl.vsl.runtime;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * The Lisp evaluator. {@link #eval(LispObject, Environment)} reduces a
 * value (usually a list) to its result in a given environment,
 * implementing the special forms {@code def!}, {@code let*}, {@code do},
 * {@code if} and {@code fn*}, and the application of functions.
 * <p>
 * Evaluation is a loop over the pair of the expression and the
 * environment. Where the result of a form is the result of one of its
 * sub-expressions (the body of {@code let*}, the last expression of
 * {@code do}, the chosen branch of {@code if}, and the body of a closure
 * being applied) the loop replaces the pair and goes round again,
 * instead of calling itself. Recursion in tail position in Lisp code
 * therefore runs in constant Java stack depth.
 */
public class Evaluator {

    /** Logger for tracing evaluation. */
    static final Logger logger = LoggerFactory.getLogger(Evaluator.class);

    /** Whether {@link #eval(LispObject, Environment)} traces. */
    private final boolean trace;

    /**
     * Create an evaluator.
     *
     * @param trace whether to log each step of evaluation (at
     *     {@code DEBUG} level)
     */
    public Evaluator(boolean trace) { this.trace = trace; }

    /** Create an evaluator that does not trace. */
    public Evaluator() { this(false); }

    /** @return whether this evaluator traces by default */
    public boolean isTracing() { return trace; }

    /**
     * Evaluate an expression in an environment, tracing if this
     * evaluator was created to trace.
     *
     * @param ast expression to evaluate
     * @param env environment in which to evaluate it
     * @return the result
     * @throws LispError on any failure of evaluation
     */
    public LispObject eval(LispObject ast, Environment env)
            throws LispError {
        return eval(ast, env, trace);
    }

    /**
     * Evaluate an expression in an environment, specifying explicitly
     * whether to trace. Evaluation of sub-expressions inherits the
     * choice.
     *
     * @param ast expression to evaluate
     * @param env environment in which to evaluate it
     * @param trace whether to log each step
     * @return the result
     * @throws LispError on any failure of evaluation
     */
    public LispObject eval(LispObject ast, Environment env, boolean trace)
            throws LispError {
        for (;;) {
            if (trace) {
                logger.atDebug().setMessage("eval {}").addArgument(ast)
                        .log();
            }

            if (!(ast instanceof LispList list)) {
                return evalAst(ast, env, trace);
            }
            if (list.isEmpty()) { return list; }

            String form = list.get(0) instanceof LispSymbol s ? s.name : "";

            switch (form) {
                case "def!": {
                    checkLength(list, 3, 3);
                    LispSymbol sym = Abstract.asSymbol(list.get(1), form);
                    return env.set(sym, eval(list.get(2), env, trace));
                }

                case "let*": {
                    checkLength(list, 3, 3);
                    LispSequence bindings =
                            Abstract.asSequence(list.get(1), form);
                    int n = bindings.size();
                    if (n % 2 != 0) {
                        throw new TypeMismatchError(
                                "'let*' bindings must be pairs (%d forms)",
                                n);
                    }
                    Environment letEnv = new Environment(env);
                    for (int i = 0; i < n; i += 2) {
                        LispSymbol sym =
                                Abstract.asSymbol(bindings.get(i), form);
                        letEnv.set(sym,
                                eval(bindings.get(i + 1), letEnv, trace));
                    }
                    // Tail call on the body
                    ast = list.get(2);
                    env = letEnv;
                    continue;
                }

                case "do": {
                    int last = list.size() - 1;
                    if (last == 0) { return LispNil.INSTANCE; }
                    for (int i = 1; i < last; i++) {
                        eval(list.get(i), env, trace);
                    }
                    // Tail call on the last expression
                    ast = list.get(last);
                    continue;
                }

                case "if": {
                    checkLength(list, 3, 4);
                    if (Abstract.isTrue(eval(list.get(1), env, trace))) {
                        ast = list.get(2);
                    } else if (list.size() == 4) {
                        ast = list.get(3);
                    } else {
                        return LispNil.INSTANCE;
                    }
                    // Tail call on the chosen branch
                    continue;
                }

                case "fn*": {
                    checkLength(list, 3, 3);
                    LispSequence p = Abstract.asSequence(list.get(1), form);
                    LispSymbol[] params = new LispSymbol[p.size()];
                    for (int i = 0; i < params.length; i++) {
                        params[i] = Abstract.asSymbol(p.get(i), form);
                    }
                    return new Closure(env, params, list.get(2), this);
                }

                default: {
                    LispSequence evaluated = evalSequence(list, env, trace);
                    LispObject f = evaluated.get(0);
                    LispObject[] args = evaluated.from(1);
                    if (f instanceof Closure closure) {
                        if (trace) {
                            logger.atDebug().setMessage("apply {} to {}")
                                    .addArgument(f)
                                    .addArgument(() -> LispList.wrap(args))
                                    .log();
                        }
                        // Tail call on the body of the closure
                        env = closure.bind(args);
                        ast = closure.body;
                        continue;
                    } else if (f instanceof LispFunction function) {
                        return function.call(args);
                    } else {
                        throw new TypeMismatchError(
                                "%s is not a function",
                                Printer.print(f, true));
                    }
                }
            }
        }
    }

    /**
     * Evaluate a value in the way that does not involve application: a
     * symbol is looked up in the environment, the elements of a list or
     * vector and the values of a map are evaluated, and every other kind
     * of value evaluates to itself.
     *
     * @param ast expression to evaluate
     * @param env environment in which to evaluate it
     * @param trace whether to log each step
     * @return the result
     * @throws LispError on any failure of evaluation
     */
    LispObject evalAst(LispObject ast, Environment env, boolean trace)
            throws LispError {
        return switch (ast.getType()) {
            case SYMBOL -> env.get((LispSymbol)ast);
            case LIST, VECTOR -> evalSequence((LispSequence)ast, env,
                    trace);
            case MAP -> ((LispMap)ast).mapValues(v -> eval(v, env, trace));
            case NIL, BOOLEAN, INTEGER, STRING, KEYWORD, ATOM, FUNCTION -> ast;
        };
    }

    /**
     * Evaluate the elements of a sequence from left to right, giving a
     * new sequence of the same kind.
     */
    private LispSequence evalSequence(LispSequence seq, Environment env,
            boolean trace) {
        int n = seq.size();
        LispObject[] result = new LispObject[n];
        for (int i = 0; i < n; i++) {
            result[i] = eval(seq.get(i), env, trace);
        }
        return seq instanceof LispVector ? LispVector.wrap(result)
                : LispList.wrap(result);
    }

    /**
     * Check that a special form has an acceptable number of elements
     * (counting the name of the form).
     */
    private static void checkLength(LispList form, int min, int max)
            throws TypeMismatchError {
        int n = form.size();
        if (n < min || n > max) {
            throw new TypeMismatchError("badly formed '%s' (%d forms)",
                    form.get(0), n);
        }
    }
}
