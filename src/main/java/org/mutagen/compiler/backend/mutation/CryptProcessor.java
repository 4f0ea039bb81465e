package org.mutagen.compiler.backend.mutation;

import org.mutagen.compiler.ir.IrInstruction;
import org.mutagen.compiler.ir.IrLocal;
import org.mutagen.compiler.ir.IrMethod;

import java.util.List;

/**
 * Produces the code that replaces {@code Mutation.Crypt(block, key)}.
 */
@FunctionalInterface
public interface CryptProcessor {

    /**
     * @param method The method being rewritten. Processors may declare additional locals on it.
     * @param block The local holding the data block.
     * @param key The local holding the key.
     * @return The replacement instructions, in order.
     */
    List<IrInstruction> process(IrMethod method, IrLocal block, IrLocal key);
}
