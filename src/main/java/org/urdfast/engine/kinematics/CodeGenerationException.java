package org.urdfast.engine.kinematics;

/**
 * Exception thrown when generating one function of a batch fails.
 * Carries the name of the function; the cause is the parse or configuration
 * error that aborted it.
 */
public class CodeGenerationException extends RuntimeException {

    private final String functionName;

    public CodeGenerationException(String functionName, Throwable cause) {
        super("Failed to generate function '" + functionName + "': " + cause.getMessage(), cause);
        this.functionName = functionName;
    }

    public String getFunctionName() {
        return functionName;
    }
}
