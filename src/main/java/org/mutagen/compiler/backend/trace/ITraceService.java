package org.mutagen.compiler.backend.trace;

import org.mutagen.compiler.ir.IrMethod;

/**
 * Builds provenance traces for method bodies.
 */
public interface ITraceService {

    /**
     * Traces the current body of a method. The returned trace is a snapshot: once the
     * body is mutated, a new trace must be requested.
     *
     * @param method The method to trace.
     * @return The trace of the method body.
     */
    IMethodTrace trace(IrMethod method);
}
