package org.mutagen.compiler.backend.mutation;

import org.mutagen.compiler.ir.IrFieldRef;
import org.mutagen.compiler.ir.IrInstruction;
import org.mutagen.compiler.ir.IrMethodRef;
import org.mutagen.compiler.ir.IrOpcode;
import org.mutagen.compiler.ir.IrTypeHandle;

/**
 * Classifies instructions that reference the marker type. The declaring type of a
 * member is compared by identity against the handle resolved at construction, so
 * same-named types from elsewhere never match.
 */
public final class MarkerCatalog {

    /** Name of the placeholder method of the marker type. */
    public static final String PLACEHOLDER_METHOD = "Placeholder";
    /** Name of the crypt method of the marker type. */
    public static final String CRYPT_METHOD = "Crypt";

    private final IrTypeHandle markerType;

    public MarkerCatalog(IrTypeHandle markerType) {
        this.markerType = markerType;
    }

    public IrTypeHandle markerType() {
        return markerType;
    }

    /**
     * Classifies an instruction. Never throws.
     * @param instruction The instruction to classify.
     * @return The classification.
     */
    public MarkerUse classify(IrInstruction instruction) {
        if (instruction.operand() instanceof IrFieldRef field && field.declaringType() == markerType) {
            if (instruction.opcode() == IrOpcode.LDSFLD) {
                return new MarkerUse.KeyField(field);
            }
            return new MarkerUse.Unexpected(instruction.opcode() + " " + field);
        }
        if (instruction.operand() instanceof IrMethodRef method && method.declaringType() == markerType) {
            if (instruction.opcode() == IrOpcode.CALL) {
                if (PLACEHOLDER_METHOD.equals(method.name()) && method.parameterCount() == 1) {
                    return new MarkerUse.PlaceholderCall(method);
                }
                if (CRYPT_METHOD.equals(method.name()) && method.parameterCount() == 2) {
                    return new MarkerUse.CryptCall(method);
                }
            }
            return new MarkerUse.Unexpected(instruction.opcode() + " " + method);
        }
        return MarkerUse.NotAMarker.INSTANCE;
    }
}
