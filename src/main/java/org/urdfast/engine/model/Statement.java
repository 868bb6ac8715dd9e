package org.urdfast.engine.model;

/**
 * Sealed interface representing one line of a generated function body.
 *
 * Bodies are ordered lists of statements:
 * - Variable definitions
 * - Loop openings and closings, which adjust the indentation of the
 * definitions between them
 */
public sealed interface Statement permits NamedVariable, LoopStart, LoopEnd {
}
