package org.mutagen.compiler.ir;

/**
 * Reference to a static field of a symbolic type.
 *
 * @param declaringType The type that declares the field.
 * @param name The field name.
 */
public record IrFieldRef(IrTypeHandle declaringType, String name) implements IrOperand {
    @Override
    public String toString() {
        return declaringType + "::" + name;
    }
}
