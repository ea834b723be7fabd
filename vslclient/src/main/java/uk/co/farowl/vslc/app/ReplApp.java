// Copyright (c)2025 Jython Developers.
// Licensed to PSF under a contributor agreement.
package uk.co.farowl.vslc.app;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import uk.co.farowl.vsl.runtime.Interpreter;
import uk.co.farowl.vsl.runtime.LispError;
import uk.co.farowl.vsl.runtime.Printer;

/**
 * Command-line driver for the interpreter. With no arguments it runs an
 * interactive read-evaluate-print loop on standard input. Otherwise the
 * first argument names a file to load and the rest are bound as
 * {@code *ARGV*}. Setting the system property {@value #TRACE_PROPERTY}
 * to {@code true} makes the evaluator log each step.
 */
public class ReplApp {

    static final Logger logger = LoggerFactory.getLogger(ReplApp.class);

    /** System property that turns on evaluation tracing. */
    public static final String TRACE_PROPERTY = "vsl.trace";

    /** Prompt for each line of interactive input. */
    static final String PROMPT = "user> ";

    private final Interpreter interp;
    private final PrintStream out;
    private final PrintStream err;

    /**
     * Create the application around an interpreter.
     *
     * @param out where results and {@code prn} output go
     * @param err where error reports go
     * @param trace whether the evaluator logs each step
     * @param argv arguments bound as {@code *ARGV*}
     */
    ReplApp(PrintStream out, PrintStream err, boolean trace,
            List<String> argv) {
        this.out = out;
        this.err = err;
        this.interp = new Interpreter(out, trace, argv);
    }

    public static void main(String[] args) {
        boolean trace = Boolean.getBoolean(TRACE_PROPERTY);
        if (args.length == 0) {
            ReplApp app = new ReplApp(System.out, System.err, trace,
                    List.of());
            BufferedReader in = new BufferedReader(new InputStreamReader(
                    System.in, StandardCharsets.UTF_8));
            try {
                app.repl(in);
            } catch (IOException ioe) {
                logger.error("Reading standard input", ioe);
                System.exit(1);
            }
        } else {
            List<String> argv =
                    Arrays.asList(args).subList(1, args.length);
            ReplApp app = new ReplApp(System.out, System.err, trace, argv);
            System.exit(app.runFile(args[0]));
        }
    }

    /**
     * Prompt for, evaluate and print each line of input until the input
     * ends. An error is reported and the loop continues.
     *
     * @param in source of lines
     * @throws IOException if reading the input fails
     */
    void repl(BufferedReader in) throws IOException {
        for (;;) {
            out.print(PROMPT);
            out.flush();
            String line = in.readLine();
            if (line == null) {
                out.println();
                return;
            }
            try {
                String result = interp.rep(line);
                if (result != null) { out.println(result); }
            } catch (LispError e) {
                report(e);
            } catch (StackOverflowError e) {
                report(e);
            }
        }
    }

    /**
     * Load a file of Lisp source.
     *
     * @param filename to load
     * @return exit status: 0 on success, 1 if evaluation failed
     */
    int runFile(String filename) {
        try {
            interp.loadFile(filename);
            return 0;
        } catch (LispError e) {
            report(e);
        } catch (StackOverflowError e) {
            report(e);
        }
        return 1;
    }

    private void report(LispError e) {
        logger.debug("Evaluation failed", e);
        err.println("Error: " + Printer.print(e.getPayload(), false));
    }

    /** Report recursion too deep for the Java stack. */
    private void report(StackOverflowError e) {
        logger.debug("Evaluation overflowed the stack", e);
        err.println("Error: stack overflow");
    }
}
