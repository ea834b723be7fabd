// Copyright (c)2025 Jython Developers.
// Licensed to PSF under a contributor agreement.
package uk.co.farowl.vsl.runtime;

import static java.lang.annotation.ElementType.METHOD;
import static java.lang.annotation.RetentionPolicy.RUNTIME;

import java.lang.annotation.Documented;
import java.lang.annotation.Retention;
import java.lang.annotation.Target;

/**
 * Annotations that may be placed on elements of a Java class intended
 * as the implementation of a {@link JavaModule}, and that the
 * {@link ModuleExposer} will look for when creating the functions of
 * the module.
 */
public interface Exposed {

    /**
     * Identify a method of a {@link JavaModule} as a primitive function
     * to be bound in the environment. The method may be static or an
     * instance method. Its return type must be {@link LispObject} or a
     * sub-type, and each parameter must be {@code LispObject}, except
     * that the last may be {@code LispObject[]}, in which case it
     * receives the arguments beyond the others (possibly none).
     */
    @Documented
    @Retention(RUNTIME)
    @Target(METHOD)
    @interface Primitive {

        /**
         * Name of the function as it is bound in the environment. This
         * is often not a legal Java identifier (for example
         * {@code "list?"} or {@code "+"}).
         *
         * @return name of the function
         */
        String value();
    }
}
