package org.mutagen.compiler.ir;

/**
 * A local variable slot scoped to one method. Locals are compared by identity,
 * two locals with the same index in different methods are different variables.
 */
public final class IrLocal implements IrOperand {
    private final int index;
    private final String name;

    public IrLocal(int index, String name) {
        this.index = index;
        this.name = name;
    }

    public int index() {
        return index;
    }

    public String name() {
        return name;
    }

    @Override
    public String toString() {
        return name != null ? name + "#" + index : "V_" + index;
    }
}
