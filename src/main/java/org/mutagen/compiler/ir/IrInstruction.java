package org.mutagen.compiler.ir;

/**
 * A single stack-machine instruction. Instructions are mutable so that a pass can
 * overwrite them in place, and they use identity equality: two instructions with
 * the same opcode and operand are still different positions in a body.
 */
public final class IrInstruction {
    private IrOpcode opcode;
    private IrOperand operand;

    /**
     * @param opcode  The instruction opcode.
     * @param operand The operand, or {@code null} for operand-less opcodes.
     */
    public IrInstruction(IrOpcode opcode, IrOperand operand) {
        this.opcode = opcode;
        this.operand = operand;
    }

    public static IrInstruction of(IrOpcode opcode) {
        return new IrInstruction(opcode, null);
    }

    public static IrInstruction of(IrOpcode opcode, IrOperand operand) {
        return new IrInstruction(opcode, operand);
    }

    public static IrInstruction ldcI4(int value) {
        return new IrInstruction(IrOpcode.LDC_I4, new IrImm(value));
    }

    public static IrInstruction ldloc(IrLocal local) {
        return new IrInstruction(IrOpcode.LDLOC, local);
    }

    public static IrInstruction stloc(IrLocal local) {
        return new IrInstruction(IrOpcode.STLOC, local);
    }

    public static IrInstruction call(IrMethodRef method) {
        return new IrInstruction(IrOpcode.CALL, method);
    }

    public IrOpcode opcode() {
        return opcode;
    }

    public IrOperand operand() {
        return operand;
    }

    /**
     * Overwrites this instruction in place.
     * @param opcode The new opcode.
     * @param operand The new operand.
     */
    public void set(IrOpcode opcode, IrOperand operand) {
        this.opcode = opcode;
        this.operand = operand;
    }

    /**
     * @return The number of stack values this instruction consumes.
     */
    public int popCount() {
        if (opcode == IrOpcode.CALL) {
            return operand instanceof IrMethodRef m ? m.parameterCount() : 0;
        }
        return opcode.pops();
    }

    /**
     * @return The number of stack values this instruction produces.
     */
    public int pushCount() {
        if (opcode == IrOpcode.CALL) {
            return operand instanceof IrMethodRef m && m.returnsValue() ? 1 : 0;
        }
        return opcode.pushes();
    }

    @Override
    public String toString() {
        return operand == null ? opcode.name() : opcode.name() + " " + operand;
    }
}
