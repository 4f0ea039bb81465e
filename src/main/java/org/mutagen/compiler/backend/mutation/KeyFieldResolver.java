package org.mutagen.compiler.backend.mutation;

import org.mutagen.compiler.api.CompilationException;
import org.mutagen.compiler.api.CompilerErrorCode;
import org.mutagen.compiler.ir.IrFieldRef;
import org.mutagen.compiler.ir.IrImm;
import org.mutagen.compiler.ir.IrInstruction;
import org.mutagen.compiler.ir.IrOpcode;

import java.util.Map;
import java.util.Optional;

/**
 * Replaces loads of {@code Mutation.KeyI<n>} fields with constant loads of the
 * configured key value. The instruction is overwritten in place.
 */
final class KeyFieldResolver {

    private final Map<MutationField, Integer> keyFieldValues;

    KeyFieldResolver(Map<MutationField, Integer> keyFieldValues) {
        this.keyFieldValues = keyFieldValues;
    }

    /**
     * @param instruction The field load to rewrite.
     * @param field The loaded marker field.
     * @param methodName The method being processed, for error messages.
     * @return {@code false} if the field is not a key field at all.
     * @throws CompilationException if the field looks like a key field but is out of range,
     *                              or if no value is configured for the key slot.
     */
    boolean resolve(IrInstruction instruction, IrFieldRef field, String methodName) throws CompilationException {
        Optional<MutationField> slot = MutationField.fromFieldName(field.name());
        if (slot.isEmpty()) {
            if (field.name() != null && field.name().startsWith(MutationField.KEY_FIELD_PREFIX)) {
                throw new CompilationException(CompilerErrorCode.UNRECOGNIZED_KEY_FIELD,
                        "Field " + field + " is not a key field (expected KeyI0..KeyI15)", methodName);
            }
            return false;
        }

        Integer value = keyFieldValues.get(slot.get());
        if (value == null) {
            throw new CompilationException(CompilerErrorCode.MISSING_KEY_VALUE,
                    "Code contains request to mutation key " + field.name() + ", but the value for this field is not set", methodName);
        }
        instruction.set(IrOpcode.LDC_I4, new IrImm(value));
        return true;
    }
}
