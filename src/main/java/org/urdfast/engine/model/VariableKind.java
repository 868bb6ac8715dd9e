package org.urdfast.engine.model;

/**
 * Shape of a {@link NamedVariable}'s value; typed targets declare it with
 * the matching type annotation.
 */
public enum VariableKind {
    SCALAR,
    VECTOR,
    MATRIX,
    /** Assignment without declaration (reassigning an existing name). */
    NONE
}
