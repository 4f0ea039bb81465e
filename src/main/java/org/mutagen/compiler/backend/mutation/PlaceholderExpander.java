package org.mutagen.compiler.backend.mutation;

import org.mutagen.compiler.api.CompilationException;
import org.mutagen.compiler.api.CompilerErrorCode;
import org.mutagen.compiler.backend.trace.ITraceService;
import org.mutagen.compiler.diagnostics.CompilerLogger;
import org.mutagen.compiler.ir.IrInstruction;
import org.mutagen.compiler.ir.IrMethod;

import java.util.List;
import java.util.Objects;

/**
 * Replaces "push argument; call Placeholder" with the code produced by the
 * configured {@link PlaceholderProcessor}. The argument span is found by tracing.
 */
final class PlaceholderExpander {

    private final ITraceService traceService;
    private final PlaceholderProcessor processor;

    PlaceholderExpander(ITraceService traceService, PlaceholderProcessor processor) {
        this.traceService = traceService;
        this.processor = processor;
    }

    Splice expand(IrMethod method, IrInstruction call) throws CompilationException {
        if (processor == null) {
            throw new CompilationException(CompilerErrorCode.MISSING_PROCESSOR,
                    "Found mutation placeholder, but there is no processor defined", method.name());
        }

        int[] argIndexes = traceService.trace(method).traceArguments(call)
                .orElseThrow(() -> new CompilationException(CompilerErrorCode.TRACE_FAILURE,
                        "Failed to trace placeholder argument", method.name()));
        if (argIndexes.length != 1) {
            throw new CompilationException(CompilerErrorCode.TRACE_FAILURE,
                    "Expected one traced placeholder argument but got " + argIndexes.length, method.name());
        }

        List<IrInstruction> body = method.instructions();
        int callIndex = method.indexOf(call);
        int start = argIndexes[0];
        if (callIndex < 0 || start < 0 || start >= callIndex) {
            throw new CompilationException(CompilerErrorCode.TRACE_FAILURE,
                    "Traced placeholder argument starts at " + start + " which does not precede the call at " + callIndex, method.name());
        }

        List<IrInstruction> argument = List.copyOf(body.subList(start, callIndex));
        List<IrInstruction> removed = List.copyOf(body.subList(start, callIndex + 1));
        body.subList(start, callIndex + 1).clear();

        List<IrInstruction> replacement = Objects.requireNonNull(processor.process(argument),
                "Placeholder processor returned null");
        Splice splice = Splice.insert(method, start, removed, replacement, CompilerErrorCode.TRACE_FAILURE);

        CompilerLogger.debug("Expanded placeholder in " + method.name() + " at " + start + ": "
                + argument.size() + " argument instruction(s) -> " + replacement.size() + " instruction(s)");
        return splice;
    }
}
