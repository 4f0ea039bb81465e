package org.mutagen.compiler.api;

/**
 * An exception that is thrown when a backend pass cannot complete.
 * <p>
 * Every instance carries a {@link CompilerErrorCode} so callers and tests can react
 * to the kind of failure without parsing the message.
 */
public class CompilationException extends Exception {

    private final CompilerErrorCode code;

    /**
     * Constructs a new compilation exception.
     * @param code The error code.
     * @param message The detail message.
     */
    public CompilationException(CompilerErrorCode code, String message) {
        super(message, null);
        this.code = code;
    }

    /**
     * Constructs a new compilation exception with the method it occurred in.
     * @param code The error code.
     * @param message The detail message.
     * @param methodName The name of the method being processed.
     */
    public CompilationException(CompilerErrorCode code, String message, String methodName) {
        super(String.format("%s in method '%s'", message, methodName), null);
        this.code = code;
    }

    /**
     * @return The error code.
     */
    public CompilerErrorCode code() {
        return code;
    }

    /**
     * @return {@code true} if the pass was misconfigured rather than fed unresolvable code.
     */
    public boolean isConfigurationError() {
        return code.category() == CompilerErrorCode.Category.CONFIGURATION;
    }
}
