// Copyright (c)2025 Jython Developers.
// Licensed to PSF under a contributor agreement.
package uk.co.farowl.vsl.runtime;

/**
 * A function created by evaluating {@code (fn* (p1 p2 ...) body)}. It
 * holds the environment in which it was defined (not a copy), the
 * parameter symbols and the unevaluated body. A call binds the
 * parameters to the arguments in a new frame whose parent is the
 * captured environment, and evaluates the body there.
 * <p>
 * The {@link Evaluator} does not use {@link #call(LispObject...)} when
 * the closure is applied in Lisp code: it uses {@link #bind(LispObject[])}
 * and continues its own loop with {@link #body}, so that a call in tail
 * position does not deepen the Java stack.
 */
public final class Closure extends LispFunction {

    /** The environment in which the closure was defined. */
    final Environment env;

    /** The parameters in order. */
    final LispSymbol[] params;

    /** The unevaluated body. */
    final LispObject body;

    /** The evaluator that created this closure. */
    private final Evaluator evaluator;

    Closure(Environment env, LispSymbol[] params, LispObject body,
            Evaluator evaluator) {
        this.env = env;
        this.params = params;
        this.body = body;
        this.evaluator = evaluator;
    }

    @Override
    public String getName() { return null; }

    /** @return the number of parameters */
    public int getParameterCount() { return params.length; }

    /**
     * Create the frame in which the body is to be evaluated, binding
     * each parameter to the corresponding argument.
     *
     * @param args the arguments
     * @return the new frame
     * @throws TypeMismatchError if the number of arguments is wrong
     */
    Environment bind(LispObject[] args) throws TypeMismatchError {
        if (args.length != params.length) {
            throw TypeMismatchError.argumentCount("fn*", params.length,
                    false, args.length);
        }
        return new Environment(env, params, args);
    }

    @Override
    public LispObject call(LispObject... args) throws LispError {
        return evaluator.eval(body, bind(args));
    }
}
