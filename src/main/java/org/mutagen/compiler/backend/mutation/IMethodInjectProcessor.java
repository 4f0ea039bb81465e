package org.mutagen.compiler.backend.mutation;

import org.mutagen.compiler.api.CompilationException;
import org.mutagen.compiler.ir.IrMethod;

/**
 * A pass that rewrites the body of a method injected from the runtime library.
 */
public interface IMethodInjectProcessor {

    /**
     * Rewrites the method body in place.
     *
     * @param method The method to process.
     * @throws CompilationException if the body cannot be rewritten.
     */
    void process(IrMethod method) throws CompilationException;
}
