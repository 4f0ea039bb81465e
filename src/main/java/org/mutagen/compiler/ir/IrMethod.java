package org.mutagen.compiler.ir;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Set;

/**
 * A procedure with an owned, mutable instruction body. Passes mutate the
 * instruction list directly; the list is index-addressable and growable.
 */
public final class IrMethod {
    private final String name;
    private final List<IrInstruction> instructions;
    private final List<IrLocal> locals;

    public IrMethod(String name) {
        this(name, new ArrayList<>(), new ArrayList<>());
    }

    public IrMethod(String name, List<IrInstruction> instructions, List<IrLocal> locals) {
        this.name = name;
        this.instructions = new ArrayList<>(instructions);
        this.locals = new ArrayList<>(locals);
    }

    public String name() {
        return name;
    }

    /**
     * @return The live instruction list of this method.
     */
    public List<IrInstruction> instructions() {
        return instructions;
    }

    /**
     * @return The live list of locals of this method.
     */
    public List<IrLocal> locals() {
        return locals;
    }

    /**
     * Declares a new local variable at the next free index.
     * @param localName Informational name, may be null.
     * @return The new local.
     */
    public IrLocal addLocal(String localName) {
        IrLocal local = new IrLocal(locals.size(), localName);
        locals.add(local);
        return local;
    }

    /**
     * @param instruction The instruction to find.
     * @return The index of the instruction by identity, or -1 if it is not part of this body.
     */
    public int indexOf(IrInstruction instruction) {
        for (int i = 0; i < instructions.size(); i++) {
            if (instructions.get(i) == instruction) return i;
        }
        return -1;
    }

    /**
     * @param instruction The instruction to check.
     * @return {@code true} if any branch in the body targets the instruction.
     */
    public boolean isBranchTarget(IrInstruction instruction) {
        for (IrInstruction ins : instructions) {
            if (ins.operand() instanceof IrBranchTarget bt && bt.target() == instruction) return true;
        }
        return false;
    }

    /**
     * Points every branch aimed at one of {@code removed} to {@code newTarget}.
     * @param removed Instructions that are no longer part of the body.
     * @param newTarget The instruction that took their place.
     * @return The number of branches that were retargeted.
     */
    public int retargetBranches(Collection<IrInstruction> removed, IrInstruction newTarget) {
        Set<IrInstruction> gone = Collections.newSetFromMap(new IdentityHashMap<>());
        gone.addAll(removed);
        int count = 0;
        for (IrInstruction ins : instructions) {
            if (ins.operand() instanceof IrBranchTarget bt && gone.contains(bt.target())) {
                ins.set(ins.opcode(), new IrBranchTarget(newTarget));
                count++;
            }
        }
        return count;
    }

    /**
     * Captures the body order, each instruction's opcode and operand, and the locals.
     * @return A snapshot that {@link #restore(Snapshot)} can roll back to.
     */
    public Snapshot snapshot() {
        List<IrOpcode> opcodes = new ArrayList<>(instructions.size());
        List<IrOperand> operands = new ArrayList<>(instructions.size());
        for (IrInstruction ins : instructions) {
            opcodes.add(ins.opcode());
            operands.add(ins.operand());
        }
        return new Snapshot(List.copyOf(instructions), opcodes, operands, List.copyOf(locals));
    }

    /**
     * Rolls the method back to a snapshot. The original instruction objects are put back
     * in their original order and overwritten with their captured state.
     * @param snapshot A snapshot previously taken from this method.
     */
    public void restore(Snapshot snapshot) {
        instructions.clear();
        instructions.addAll(snapshot.instructions);
        for (int i = 0; i < instructions.size(); i++) {
            instructions.get(i).set(snapshot.opcodes.get(i), snapshot.operands.get(i));
        }
        locals.clear();
        locals.addAll(snapshot.locals);
    }

    /**
     * Saved state of a method body.
     */
    public static final class Snapshot {
        private final List<IrInstruction> instructions;
        private final List<IrOpcode> opcodes;
        private final List<IrOperand> operands;
        private final List<IrLocal> locals;

        private Snapshot(List<IrInstruction> instructions, List<IrOpcode> opcodes,
                         List<IrOperand> operands, List<IrLocal> locals) {
            this.instructions = instructions;
            this.opcodes = opcodes;
            this.operands = operands;
            this.locals = locals;
        }
    }

    @Override
    public String toString() {
        return "IrMethod{" + name + ", " + instructions.size() + " instructions}";
    }
}
