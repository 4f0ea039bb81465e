package org.mutagen.compiler.ir;

/**
 * Operation codes of the stack machine. Each opcode has a fixed stack effect,
 * except {@link #CALL} whose effect depends on the called method.
 */
public enum IrOpcode {
    NOP(0, 0, FlowControl.NEXT),
    LDC_I4(0, 1, FlowControl.NEXT),
    LDLOC(0, 1, FlowControl.NEXT),
    STLOC(1, 0, FlowControl.NEXT),
    LDARG(0, 1, FlowControl.NEXT),
    LDSFLD(0, 1, FlowControl.NEXT),
    STSFLD(1, 0, FlowControl.NEXT),
    LDELEM(2, 1, FlowControl.NEXT),
    STELEM(3, 0, FlowControl.NEXT),
    ADD(2, 1, FlowControl.NEXT),
    SUB(2, 1, FlowControl.NEXT),
    MUL(2, 1, FlowControl.NEXT),
    DIV(2, 1, FlowControl.NEXT),
    REM(2, 1, FlowControl.NEXT),
    AND(2, 1, FlowControl.NEXT),
    OR(2, 1, FlowControl.NEXT),
    XOR(2, 1, FlowControl.NEXT),
    SHL(2, 1, FlowControl.NEXT),
    SHR(2, 1, FlowControl.NEXT),
    NEG(1, 1, FlowControl.NEXT),
    NOT(1, 1, FlowControl.NEXT),
    CONV(1, 1, FlowControl.NEXT),
    DUP(1, 2, FlowControl.NEXT),
    POP(1, 0, FlowControl.NEXT),
    CALL(-1, -1, FlowControl.CALL),
    BR(0, 0, FlowControl.BRANCH),
    BRTRUE(1, 0, FlowControl.COND_BRANCH),
    BRFALSE(1, 0, FlowControl.COND_BRANCH),
    RET(0, 0, FlowControl.RETURN);

    /**
     * How control leaves an instruction.
     */
    public enum FlowControl {
        /** Falls through to the next instruction. */
        NEXT,
        /** Calls a method and falls through afterwards. */
        CALL,
        /** Always transfers control to the branch target. */
        BRANCH,
        /** Transfers control to the branch target or falls through. */
        COND_BRANCH,
        /** Leaves the method. */
        RETURN
    }

    private final int pops;
    private final int pushes;
    private final FlowControl flowControl;

    IrOpcode(int pops, int pushes, FlowControl flowControl) {
        this.pops = pops;
        this.pushes = pushes;
        this.flowControl = flowControl;
    }

    /**
     * @return The number of values popped, or -1 if it depends on the operand.
     */
    public int pops() {
        return pops;
    }

    /**
     * @return The number of values pushed, or -1 if it depends on the operand.
     */
    public int pushes() {
        return pushes;
    }

    public FlowControl flowControl() {
        return flowControl;
    }

    /**
     * @return {@code true} if this opcode can transfer control anywhere but the next instruction.
     */
    public boolean isControlTransfer() {
        return flowControl == FlowControl.BRANCH
                || flowControl == FlowControl.COND_BRANCH
                || flowControl == FlowControl.RETURN;
    }
}
