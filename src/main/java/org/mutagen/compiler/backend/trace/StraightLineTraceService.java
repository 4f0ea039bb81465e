package org.mutagen.compiler.backend.trace;

import org.mutagen.compiler.diagnostics.CompilerLogger;
import org.mutagen.compiler.ir.IrBranchTarget;
import org.mutagen.compiler.ir.IrInstruction;
import org.mutagen.compiler.ir.IrMethod;

import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Traces stack arguments through straight-line code by walking backwards from the
 * consumer and accumulating stack effects. Spans that contain control transfers or
 * are entered from a branch anywhere but at their first instruction are rejected.
 */
public final class StraightLineTraceService implements ITraceService {

    @Override
    public IMethodTrace trace(IrMethod method) {
        List<IrInstruction> body = List.copyOf(method.instructions());
        Set<IrInstruction> branchTargets = Collections.newSetFromMap(new IdentityHashMap<>());
        for (IrInstruction ins : body) {
            if (ins.operand() instanceof IrBranchTarget bt) {
                branchTargets.add(bt.target());
            }
        }
        return new Trace(method.name(), body, branchTargets);
    }

    private record Trace(String methodName, List<IrInstruction> body, Set<IrInstruction> branchTargets) implements IMethodTrace {

        @Override
        public Optional<int[]> traceArguments(IrInstruction consumer) {
            int index = indexOf(consumer);
            if (index < 0) {
                CompilerLogger.debug("Trace: " + consumer + " is not part of method " + methodName);
                return Optional.empty();
            }
            int argc = consumer.popCount();
            int[] starts = new int[argc];
            int end = index;
            for (int arg = argc - 1; arg >= 0; arg--) {
                int start = findProducerStart(end);
                if (start < 0) {
                    CompilerLogger.debug("Trace: argument " + arg + " of " + consumer + " in " + methodName + " is not traceable");
                    return Optional.empty();
                }
                starts[arg] = start;
                end = start;
            }
            return Optional.of(starts);
        }

        /**
         * Finds the start of the shortest span ending at {@code end} (exclusive) that
         * produces exactly one value.
         */
        private int findProducerStart(int end) {
            // a join point at the consumer lets the value arrive on another path
            if (branchTargets.contains(body.get(end))) return -1;
            int net = 0;
            for (int j = end - 1; j >= 0; j--) {
                IrInstruction ins = body.get(j);
                if (ins.opcode().isControlTransfer()) return -1;
                net += ins.pushCount() - ins.popCount();
                if (net == 1) {
                    return isSelfContained(j, end) ? j : -1;
                }
                if (net > 1) return -1;
                // the span continues above j, so j must not be entered by a branch
                if (branchTargets.contains(ins)) return -1;
            }
            return -1;
        }

        private boolean isSelfContained(int start, int end) {
            int depth = 0;
            for (int k = start; k < end; k++) {
                IrInstruction ins = body.get(k);
                if (depth < ins.popCount()) return false;
                depth += ins.pushCount() - ins.popCount();
            }
            return depth == 1;
        }

        private int indexOf(IrInstruction instruction) {
            for (int i = 0; i < body.size(); i++) {
                if (body.get(i) == instruction) return i;
            }
            return -1;
        }
    }
}
