package org.mutagen.compiler.backend.mutation;

import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * The sixteen key slots that generated code reads through {@code Mutation.KeyI<n>} fields.
 */
public enum MutationField {
    KeyI0, KeyI1, KeyI2, KeyI3, KeyI4, KeyI5, KeyI6, KeyI7,
    KeyI8, KeyI9, KeyI10, KeyI11, KeyI12, KeyI13, KeyI14, KeyI15;

    /** Prefix shared by all key field names. */
    public static final String KEY_FIELD_PREFIX = "KeyI";

    private static final Pattern KEY_FIELD_NAME = Pattern.compile("KeyI(0|[1-9][0-9]?)");

    /**
     * @return The slot number, 0..15.
     */
    public int slot() {
        return ordinal();
    }

    /**
     * Resolves a field name of the exact form {@code KeyI0} .. {@code KeyI15}.
     * @param fieldName The field name.
     * @return The key slot, or empty if the name is not a key field name.
     */
    public static Optional<MutationField> fromFieldName(String fieldName) {
        if (fieldName == null) return Optional.empty();
        Matcher m = KEY_FIELD_NAME.matcher(fieldName);
        if (!m.matches()) return Optional.empty();
        int slot = Integer.parseInt(m.group(1));
        if (slot >= values().length) return Optional.empty();
        return Optional.of(values()[slot]);
    }
}
