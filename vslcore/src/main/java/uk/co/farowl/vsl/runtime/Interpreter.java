// Copyright (c)2025 Jython Developers.
// Licensed to PSF under a contributor agreement.
package uk.co.farowl.vsl.runtime;

import java.io.PrintStream;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import uk.co.farowl.vsl.parser.Reader;
import uk.co.farowl.vsl.support.InterpreterError;

/**
 * The object through which an application embeds the Lisp run-time. It
 * builds two environments:
 * <ol>
 * <li>the core environment, a root frame holding every primitive of
 * {@link CoreModule} and the function {@code not}, defined in Lisp;
 * and</li>
 * <li>the top-level environment, enclosed by the core, holding
 * {@code eval}, {@code load-file} and {@code *ARGV*}, in which a driver
 * evaluates what it reads.</li>
 * </ol>
 * Lisp code evaluated while building these environments is never
 * traced, whatever the evaluator was created to do.
 */
public class Interpreter {

    /** Logger for the interpreter life-cycle. */
    static final Logger logger = LoggerFactory.getLogger(Interpreter.class);

    /** Lisp definitions evaluated into the core environment. */
    private static final String[] CORE_DEFINITIONS = {
            "(def! not (fn* (a) (if a false true)))"};

    /** Lisp definitions evaluated into the top-level environment. */
    private static final String[] TOP_DEFINITIONS = {
            "(def! load-file (fn* (f) (eval (read-string "
                    + "(str \"(do \" (slurp f) \"\\nnil)\")))))"};

    /** Name bound to the program arguments. */
    static final String ARGV = "*ARGV*";

    private final Evaluator evaluator;
    private final Environment core;
    private final Environment top;

    /**
     * Create an interpreter.
     *
     * @param out where {@code prn} and {@code println} write
     * @param trace whether the evaluator logs each step
     * @param argv program arguments to bind as {@code *ARGV*}
     */
    public Interpreter(PrintStream out, boolean trace, List<String> argv) {
        long start = System.nanoTime();
        this.evaluator = new Evaluator(trace);
        this.core = createCoreEnvironment(evaluator, new CoreModule(out));
        this.top = createTopEnvironment(evaluator, core, argv);
        logger.atInfo().setMessage("Interpreter ready in {}us")
                .addArgument(() -> (System.nanoTime() - start) / 1000)
                .log();
    }

    /** Create an interpreter writing to {@code System.out}. */
    public Interpreter() { this(System.out, false, List.of()); }

    /**
     * Create the core environment: a root frame holding the primitives of
     * the given module and the core definitions made in Lisp.
     *
     * @param evaluator to evaluate the definitions
     * @param module providing the primitives
     * @return the new root frame
     */
    static Environment createCoreEnvironment(Evaluator evaluator,
            JavaModule module) {
        Environment env = new Environment(null);
        module.install(env);
        define(evaluator, env, CORE_DEFINITIONS);
        return env;
    }

    /**
     * Create the top-level environment enclosed by the core.
     *
     * @param evaluator to evaluate the definitions
     * @param core enclosing environment
     * @param argv program arguments to bind as {@code *ARGV*}
     * @return the new frame
     */
    static Environment createTopEnvironment(Evaluator evaluator,
            Environment core, List<String> argv) {
        Environment env = new Environment(core);
        new ReplModule(evaluator, env).install(env);
        define(evaluator, env, TOP_DEFINITIONS);
        LispObject[] args = new LispObject[argv.size()];
        for (int i = 0; i < args.length; i++) {
            args[i] = new LispString(argv.get(i));
        }
        env.set(ARGV, LispList.wrap(args));
        return env;
    }

    /**
     * Evaluate definitions written in Lisp, without tracing.
     *
     * @param evaluator to use
     * @param env in which to evaluate
     * @param definitions source text of the definitions
     * @throws InterpreterError if any definition fails
     */
    private static void define(Evaluator evaluator, Environment env,
            String[] definitions) throws InterpreterError {
        for (String source : definitions) {
            try {
                evaluator.eval(Reader.readString(source), env, false);
            } catch (LispError e) {
                throw new InterpreterError(e, "bootstrap failed at: %s",
                        source);
            }
        }
    }

    /** @return the evaluator */
    public Evaluator getEvaluator() { return evaluator; }

    /** @return the core (root) environment */
    public Environment getCoreEnvironment() { return core; }

    /** @return the top-level environment */
    public Environment getEnvironment() { return top; }

    /**
     * Evaluate an expression in the top-level environment.
     *
     * @param ast expression to evaluate
     * @return the result
     * @throws LispError on any failure of evaluation
     */
    public LispObject eval(LispObject ast) throws LispError {
        return evaluator.eval(ast, top);
    }

    /**
     * Read one expression from text and evaluate it in the top-level
     * environment.
     *
     * @param source text of the expression
     * @return the result or {@code null} if the text holds no expression
     * @throws LispError on any failure of reading or evaluation
     */
    public LispObject evalString(String source) throws LispError {
        LispObject ast = Reader.readString(source);
        return ast == null ? null : eval(ast);
    }

    /**
     * Read, evaluate and print one line of input: the step of a
     * read-evaluate-print loop.
     *
     * @param line of input
     * @return the result in readable form or {@code null} if the line
     *     holds no expression
     * @throws LispError on any failure of reading or evaluation
     */
    public String rep(String line) throws LispError {
        LispObject result = evalString(line);
        return result == null ? null : Printer.print(result, true);
    }

    /**
     * Evaluate every expression in a file, through the Lisp function
     * {@code load-file}.
     *
     * @param filename of the file
     * @return the result ({@code nil})
     * @throws LispError on any failure of reading or evaluation
     */
    public LispObject loadFile(String filename) throws LispError {
        return eval(LispList.of(new LispSymbol("load-file"),
                new LispString(filename)));
    }
}
