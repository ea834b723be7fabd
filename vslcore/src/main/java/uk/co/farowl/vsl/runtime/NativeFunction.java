// Copyright (c)2025 Jython Developers.
// Licensed to PSF under a contributor agreement.
package uk.co.farowl.vsl.runtime;

import java.lang.invoke.MethodHandle;
import java.util.Arrays;

import uk.co.farowl.vsl.support.InterpreterError;

/**
 * A function implemented by a Java method of a {@link JavaModule}. The
 * {@link ModuleExposer} creates these from the annotated methods it
 * finds. The method handle has been adapted so that it accepts an
 * {@code Object[]} holding exactly the Java parameters of the method:
 * when the method ends in a {@code LispObject[]} parameter, the last
 * element of that array is the array of the excess arguments.
 */
public final class NativeFunction extends LispFunction {

    /** Name to which the function is bound in the environment. */
    private final String name;

    /** Handle of type {@code (Object[])LispObject}. */
    private final MethodHandle handle;

    /** Number of arguments that must be given. */
    private final int required;

    /** Whether arguments beyond {@link #required} are collected. */
    private final boolean collector;

    /**
     * Construct from a suitably adapted method handle.
     *
     * @param name of the function
     * @param handle of type {@code (Object[])LispObject}
     * @param required number of arguments that must be given
     * @param collector whether further arguments are collected
     */
    NativeFunction(String name, MethodHandle handle, int required,
            boolean collector) {
        this.name = name;
        this.handle = handle;
        this.required = required;
        this.collector = collector;
    }

    @Override
    public String getName() { return name; }

    @Override
    public LispObject call(LispObject... args) throws LispError {
        int n = args.length;
        if (collector ? n < required : n != required) {
            throw TypeMismatchError.argumentCount(name, required,
                    collector, n);
        }

        Object[] frame;
        if (collector) {
            frame = Arrays.copyOf(args, required + 1, Object[].class);
            frame[required] = Arrays.copyOfRange(args, required, n);
        } else {
            frame = args;
        }

        try {
            return (LispObject)handle.invokeExact(frame);
        } catch (RuntimeException | Error e) {
            // Includes LispError and StackOverflowError
            throw e;
        } catch (Throwable t) {
            throw new InterpreterError(t, "primitive '%s' failed", name);
        }
    }
}
