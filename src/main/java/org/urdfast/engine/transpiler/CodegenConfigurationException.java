package org.urdfast.engine.transpiler;

/**
 * Exception thrown when a generation run is misconfigured: an unknown profile
 * name, a profile missing the syntax of an operator, or a construct the
 * selected profile cannot express.
 *
 * Raised before any output is produced.
 */
public class CodegenConfigurationException extends RuntimeException {

    public CodegenConfigurationException(String message) {
        super(message);
    }

    public CodegenConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
