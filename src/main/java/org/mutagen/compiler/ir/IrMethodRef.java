package org.mutagen.compiler.ir;

/**
 * Reference to a static method of a symbolic type. The parameter count and the
 * return flag define the stack effect of a CALL to this method.
 *
 * @param declaringType The type that declares the method.
 * @param name The method name.
 * @param parameterCount Number of values the call pops.
 * @param returnsValue Whether the call pushes a result.
 */
public record IrMethodRef(IrTypeHandle declaringType, String name, int parameterCount, boolean returnsValue) implements IrOperand {
    @Override
    public String toString() {
        return declaringType + "::" + name + "/" + parameterCount;
    }
}
