package org.mutagen.compiler.ir;

/**
 * Opaque handle of a symbolic type. Handles are compared by identity only:
 * the name is informational and never used to decide whether two handles match.
 */
public final class IrTypeHandle {
    private final String name;

    public IrTypeHandle(String name) {
        this.name = name;
    }

    public String name() {
        return name;
    }

    @Override
    public String toString() {
        return name;
    }
}
