package org.mutagen.compiler.api;

/**
 * Defines unique, testable error codes for all errors that can abort a pass.
 * This decouples the test logic from the error messages.
 */
public enum CompilerErrorCode {
    // region Marker Resolution Errors
    /** A field load or call to the marker type that no resolver accepts. */
    UNEXPECTED_MARKER_USE(Category.MARKER),
    /** A key field name that starts like a key field but is outside KeyI0..KeyI15. */
    UNRECOGNIZED_KEY_FIELD(Category.MARKER),
    /** A recognized key slot without a value in the key mapping. */
    MISSING_KEY_VALUE(Category.MARKER),
    /** The argument span of a placeholder could not be traced. */
    TRACE_FAILURE(Category.MARKER),
    /** A crypt call is not preceded by the two local loads it requires. */
    INVALID_CRYPT_OPERANDS(Category.MARKER),
    // endregion

    // region Configuration Errors
    /** A placeholder or crypt marker was found but no transform is configured. */
    MISSING_PROCESSOR(Category.CONFIGURATION);
    // endregion

    /**
     * Distinguishes errors in the processed code from errors in the pass setup.
     */
    public enum Category {
        /** The processed method uses markers in a way the pass cannot resolve. */
        MARKER,
        /** The pass itself is not configured for the markers it found. */
        CONFIGURATION
    }

    private final Category category;

    CompilerErrorCode(Category category) {
        this.category = category;
    }

    public Category category() {
        return category;
    }
}
