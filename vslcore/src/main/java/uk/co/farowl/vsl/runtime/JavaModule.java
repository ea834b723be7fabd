// Copyright (c)2025 Jython Developers.
// Licensed to PSF under a contributor agreement.
package uk.co.farowl.vsl.runtime;

import java.lang.invoke.MethodHandles.Lookup;
import java.util.Collections;
import java.util.Map;

/**
 * Base of classes that define a set of Lisp primitives as annotated
 * Java methods (see {@link Exposed.Primitive}). A subclass passes a
 * lookup with access to its own methods to the constructor, and the
 * functions are created from the annotated methods at that point.
 */
public abstract class JavaModule {

    /** Name of the module, for messages. */
    private final String name;

    /** The primitives of this module by name. */
    private final Map<String, NativeFunction> functions;

    /**
     * Create the module and its functions.
     *
     * @param name of the module
     * @param lookup authorisation to access the methods of the subclass
     */
    protected JavaModule(String name, Lookup lookup) {
        this.name = name;
        this.functions = Collections
                .unmodifiableMap(ModuleExposer.expose(this, lookup));
    }

    /** @return the name of the module */
    public String getName() { return name; }

    /** @return the primitives of this module by name */
    public Map<String, NativeFunction> getFunctions() { return functions; }

    /**
     * Bind each primitive of this module in the given frame.
     *
     * @param env frame in which to bind the functions
     */
    public void install(Environment env) {
        for (Map.Entry<String, NativeFunction> e : functions.entrySet()) {
            env.set(e.getKey(), e.getValue());
        }
    }

    @Override
    public String toString() {
        return String.format("<module '%s'>", name);
    }
}
