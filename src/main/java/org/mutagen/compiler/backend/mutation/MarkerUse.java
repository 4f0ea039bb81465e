package org.mutagen.compiler.backend.mutation;

import org.mutagen.compiler.ir.IrFieldRef;
import org.mutagen.compiler.ir.IrMethodRef;

/**
 * Classification of a single instruction with respect to the marker type.
 */
public sealed interface MarkerUse permits MarkerUse.KeyField, MarkerUse.PlaceholderCall, MarkerUse.CryptCall, MarkerUse.Unexpected, MarkerUse.NotAMarker {

    /**
     * A static field load from the marker type.
     * @param field The loaded field.
     */
    record KeyField(IrFieldRef field) implements MarkerUse {}

    /**
     * A single-argument call to {@code Mutation.Placeholder}.
     * @param method The called method.
     */
    record PlaceholderCall(IrMethodRef method) implements MarkerUse {}

    /**
     * A two-argument call to {@code Mutation.Crypt}.
     * @param method The called method.
     */
    record CryptCall(IrMethodRef method) implements MarkerUse {}

    /**
     * Any other reference to the marker type.
     * @param member The referenced member, for error reporting.
     */
    record Unexpected(String member) implements MarkerUse {}

    /**
     * An instruction that does not reference the marker type.
     */
    record NotAMarker() implements MarkerUse {
        static final NotAMarker INSTANCE = new NotAMarker();
    }
}
