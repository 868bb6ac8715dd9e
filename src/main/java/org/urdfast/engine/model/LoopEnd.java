package org.urdfast.engine.model;

/**
 * Closes the innermost open {@link LoopStart}.
 */
public record LoopEnd() implements Statement {
}
