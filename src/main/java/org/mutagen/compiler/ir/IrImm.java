package org.mutagen.compiler.ir;

/**
 * 32-bit integer constant operand.
 */
public record IrImm(int value) implements IrOperand {
    @Override
    public String toString() {
        return Integer.toString(value);
    }
}
