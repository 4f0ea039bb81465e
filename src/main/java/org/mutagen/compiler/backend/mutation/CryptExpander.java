package org.mutagen.compiler.backend.mutation;

import org.mutagen.compiler.api.CompilationException;
import org.mutagen.compiler.api.CompilerErrorCode;
import org.mutagen.compiler.diagnostics.CompilerLogger;
import org.mutagen.compiler.ir.IrInstruction;
import org.mutagen.compiler.ir.IrLocal;
import org.mutagen.compiler.ir.IrMethod;
import org.mutagen.compiler.ir.IrOpcode;

import java.util.List;
import java.util.Objects;

/**
 * Replaces "LDLOC block; LDLOC key; call Crypt" with the code produced by the
 * configured {@link CryptProcessor}. The operands must be the two instructions
 * directly preceding the call.
 */
final class CryptExpander {

    private final CryptProcessor processor;

    CryptExpander(CryptProcessor processor) {
        this.processor = processor;
    }

    Splice expand(IrMethod method, IrInstruction call) throws CompilationException {
        if (processor == null) {
            throw new CompilationException(CompilerErrorCode.MISSING_PROCESSOR,
                    "Found mutation crypt, but there is no processor defined", method.name());
        }

        List<IrInstruction> body = method.instructions();
        int callIndex = method.indexOf(call);
        if (callIndex < 2) {
            throw new CompilationException(CompilerErrorCode.INVALID_CRYPT_OPERANDS,
                    "Mutation crypt at " + callIndex + " is not preceded by two local loads", method.name());
        }
        IrInstruction ldBlock = body.get(callIndex - 2);
        IrInstruction ldKey = body.get(callIndex - 1);
        IrLocal block = loadedLocal(ldBlock);
        IrLocal key = loadedLocal(ldKey);
        if (block == null || key == null) {
            throw new CompilationException(CompilerErrorCode.INVALID_CRYPT_OPERANDS,
                    "Mutation crypt expects LDLOC block; LDLOC key but found " + ldBlock + "; " + ldKey, method.name());
        }

        // only the block load may be a branch target
        if (method.isBranchTarget(ldKey) || method.isBranchTarget(call)) {
            throw new CompilationException(CompilerErrorCode.INVALID_CRYPT_OPERANDS,
                    "Mutation crypt operands are entered by a branch between " + ldBlock + " and the call", method.name());
        }

        int start = callIndex - 2;
        List<IrInstruction> removed = List.copyOf(body.subList(start, callIndex + 1));
        body.subList(start, callIndex + 1).clear();

        List<IrInstruction> replacement = Objects.requireNonNull(processor.process(method, block, key),
                "Crypt processor returned null");
        Splice splice = Splice.insert(method, start, removed, replacement, CompilerErrorCode.INVALID_CRYPT_OPERANDS);

        CompilerLogger.debug("Expanded crypt in " + method.name() + " at " + start + " (block=" + block
                + ", key=" + key + ") -> " + replacement.size() + " instruction(s)");
        return splice;
    }

    private static IrLocal loadedLocal(IrInstruction instruction) {
        if (instruction.opcode() == IrOpcode.LDLOC && instruction.operand() instanceof IrLocal local) {
            return local;
        }
        return null;
    }
}
