package org.mutagen.compiler.backend.mutation;

import org.mutagen.compiler.api.CompilationException;
import org.mutagen.compiler.api.CompilerErrorCode;
import org.mutagen.compiler.ir.IrInstruction;
import org.mutagen.compiler.ir.IrMethod;

import java.util.List;

/**
 * Where a replacement was inserted into a body.
 *
 * @param start Index of the first inserted instruction.
 * @param insertedCount Number of inserted instructions.
 */
record Splice(int start, int insertedCount) {

    /**
     * @return The index of the first instruction after the replacement.
     */
    int nextIndex() {
        return start + insertedCount;
    }

    /**
     * Inserts a replacement at {@code start} and moves branches that targeted the removed
     * instructions onto the instruction now at {@code start}: the first replacement
     * instruction, or the one following an empty replacement.
     *
     * @param method The method whose body was cut at {@code start}.
     * @param start The index the removed instructions started at.
     * @param removed The removed instructions.
     * @param replacement The instructions to insert.
     * @param failure Error code used when a branch would be left without a target.
     * @return The resulting splice.
     * @throws CompilationException if a removed instruction was a branch target and nothing follows it.
     */
    static Splice insert(IrMethod method, int start, List<IrInstruction> removed,
                         List<IrInstruction> replacement, CompilerErrorCode failure) throws CompilationException {
        List<IrInstruction> body = method.instructions();
        body.addAll(start, replacement);
        if (start < body.size()) {
            method.retargetBranches(removed, body.get(start));
        } else {
            for (IrInstruction ins : removed) {
                if (method.isBranchTarget(ins)) {
                    throw new CompilationException(failure,
                            "Branch to removed instruction " + ins + " has no instruction left to land on", method.name());
                }
            }
        }
        return new Splice(start, replacement.size());
    }
}
