package org.mutagen.compiler.backend.mutation;

import org.mutagen.compiler.api.CompilationException;
import org.mutagen.compiler.diagnostics.CompilerLogger;
import org.mutagen.compiler.ir.IrMethod;

/**
 * Runs a processor on the method itself and rolls the body back if the processor fails.
 * On failure the body order, every instruction's opcode and operand, and the locals are
 * restored; the instruction objects are the caller's own throughout.
 */
public final class TransactionalMethodProcessor implements IMethodInjectProcessor {

    private final IMethodInjectProcessor delegate;

    public TransactionalMethodProcessor(IMethodInjectProcessor delegate) {
        this.delegate = delegate;
    }

    @Override
    public void process(IrMethod method) throws CompilationException {
        IrMethod.Snapshot snapshot = method.snapshot();
        try {
            delegate.process(method);
        } catch (CompilationException | RuntimeException e) {
            method.restore(snapshot);
            CompilerLogger.debug("Rolled back " + method.name() + " after failed pass: " + e.getMessage());
            throw e;
        }
    }
}
