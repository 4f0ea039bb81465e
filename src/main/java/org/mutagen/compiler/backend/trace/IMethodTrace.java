package org.mutagen.compiler.backend.trace;

import org.mutagen.compiler.ir.IrInstruction;

import java.util.Optional;

/**
 * Provenance information for one snapshot of a method body.
 */
public interface IMethodTrace {

    /**
     * Finds, for every stack value the instruction consumes, the index of the first
     * instruction of the contiguous span that produces it.
     *
     * @param consumer The consuming instruction.
     * @return The start indices in argument order (an empty array for consumers without
     *         arguments), or empty if the arguments cannot be traced.
     */
    Optional<int[]> traceArguments(IrInstruction consumer);
}
