// Copyright (c)2025 Jython Developers.
// Licensed to PSF under a contributor agreement.
package uk.co.farowl.vsl.runtime;

import java.lang.invoke.MethodHandle;
import java.lang.invoke.MethodHandles.Lookup;
import java.lang.invoke.MethodType;
import java.lang.reflect.Method;
import java.lang.reflect.Modifier;
import java.util.Map;
import java.util.TreeMap;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import uk.co.farowl.vsl.runtime.Exposed.Primitive;
import uk.co.farowl.vsl.support.InterpreterError;

/**
 * A {@code ModuleExposer} finds the methods of a {@link JavaModule}
 * annotated as {@link Primitive} and creates a {@link NativeFunction}
 * for each. It is normally invoked through
 * {@link JavaModule#getFunctions()}.
 */
class ModuleExposer {

    /** Logger for the exposer. */
    static final Logger logger =
            LoggerFactory.getLogger(ModuleExposer.class);

    /** The type to which every primitive handle is adapted. */
    static final MethodType GENERIC =
            MethodType.methodType(LispObject.class, Object[].class);

    private ModuleExposer() {} // no instances

    /**
     * Scan the class of a module for annotated methods and create a
     * function for each, bound to the module instance if the method is
     * not static. A lookup object must be provided with the necessary
     * access to the defining class.
     *
     * @param module to expose
     * @param lookup authorisation to access methods
     * @return the functions by name
     * @throws InterpreterError on duplicates or unsupported signatures
     */
    static Map<String, NativeFunction> expose(JavaModule module,
            Lookup lookup) throws InterpreterError {
        Class<?> definingClass = module.getClass();
        Map<String, NativeFunction> functions = new TreeMap<>();

        for (Method m : definingClass.getDeclaredMethods()) {
            Primitive a = m.getDeclaredAnnotation(Primitive.class);
            if (a != null) {
                String name = a.value();
                NativeFunction f = createFunction(name, m, module, lookup);
                if (functions.put(name, f) != null) {
                    throw new InterpreterError(
                            "duplicate primitive '%s' in %s", name,
                            definingClass.getSimpleName());
                }
            }
        }

        logger.atDebug().setMessage("module {} exposes {} functions")
                .addArgument(module.getName())
                .addArgument(functions::size).log();
        return functions;
    }

    /**
     * Create a function from one annotated method.
     *
     * @param name of the function
     * @param m the method
     * @param module instance to bind (if the method is not static)
     * @param lookup authorisation to access the method
     * @return the function
     * @throws InterpreterError on an unsupported signature
     */
    private static NativeFunction createFunction(String name, Method m,
            JavaModule module, Lookup lookup) throws InterpreterError {

        if (!LispObject.class.isAssignableFrom(m.getReturnType())) {
            throw new InterpreterError("primitive '%s' must return %s",
                    name, LispObject.class.getSimpleName());
        }

        Class<?>[] paramTypes = m.getParameterTypes();
        int n = paramTypes.length;
        boolean collector = n > 0 && paramTypes[n - 1] == LispObject[].class;
        int required = collector ? n - 1 : n;
        for (int i = 0; i < required; i++) {
            if (paramTypes[i] != LispObject.class) {
                throw new InterpreterError(
                        "parameter %d of primitive '%s' must be %s", i,
                        name, LispObject.class.getSimpleName());
            }
        }

        try {
            MethodHandle mh = lookup.unreflect(m);
            if (!Modifier.isStatic(m.getModifiers())) {
                mh = mh.bindTo(module);
            }
            mh = mh.asSpreader(Object[].class, n).asType(GENERIC);
            return new NativeFunction(name, mh, required, collector);
        } catch (IllegalAccessException e) {
            throw new InterpreterError(e,
                    "cannot get method handle for primitive '%s'", name);
        }
    }
}
