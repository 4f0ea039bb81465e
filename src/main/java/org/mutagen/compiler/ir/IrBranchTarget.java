package org.mutagen.compiler.ir;

/**
 * Branch operand pointing at another instruction of the same method body.
 */
public record IrBranchTarget(IrInstruction target) implements IrOperand {
    @Override
    public String toString() {
        return "-> " + target.opcode();
    }
}
