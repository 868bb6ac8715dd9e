package org.urdfast.engine.codegen;

/**
 * Switches of one generation run.
 *
 * @param inputAsVector Collapse function parameters into one vector
 * @param includeLists  Let the optimizer extract repeated list literals
 * @param docstrings    Emit documentation blocks
 */
public record GenerationOptions(boolean inputAsVector, boolean includeLists, boolean docstrings) {

    public static final GenerationOptions DEFAULT = new GenerationOptions(false, false, true);

    public GenerationOptions withInputAsVector(boolean inputAsVector) {
        return new GenerationOptions(inputAsVector, includeLists, docstrings);
    }

    public GenerationOptions withDocstrings(boolean docstrings) {
        return new GenerationOptions(inputAsVector, includeLists, docstrings);
    }
}
