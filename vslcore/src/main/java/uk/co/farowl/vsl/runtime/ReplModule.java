// Copyright (c)2025 Jython Developers.
// Licensed to PSF under a contributor agreement.
package uk.co.farowl.vsl.runtime;

import java.lang.invoke.MethodHandles;

/**
 * Primitives that need access to the evaluator and to the environment
 * in which a driver evaluates its input, installed in that environment
 * by the {@link Interpreter}.
 */
class ReplModule extends JavaModule {

    /** The evaluator to use. */
    private final Evaluator evaluator;

    /** The environment in which {@code eval} evaluates. */
    private final Environment env;

    /**
     * Create the module.
     *
     * @param evaluator to use
     * @param env in which {@code eval} evaluates
     */
    ReplModule(Evaluator evaluator, Environment env) {
        super("repl", MethodHandles.lookup());
        this.evaluator = evaluator;
        this.env = env;
    }

    /** Evaluate in the top-level (not the calling) environment. */
    @Exposed.Primitive("eval")
    LispObject eval(LispObject ast) {
        return evaluator.eval(ast, env);
    }
}
