package org.mutagen.compiler.backend.mutation;

import org.mutagen.compiler.ir.IrInstruction;

import java.util.List;

/**
 * Produces the code that replaces {@code Mutation.Placeholder(x)}.
 */
@FunctionalInterface
public interface PlaceholderProcessor {

    /**
     * @param arguments The instructions that compute the placeholder argument, in order.
     * @return The replacement instructions, in order.
     */
    List<IrInstruction> process(List<IrInstruction> arguments);
}
