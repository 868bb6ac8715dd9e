package org.urdfast.engine.model;

import java.util.Objects;

/**
 * Opens a counted loop over {@code i} in {@code [start, stop)}, in 0-based
 * source convention. Statements up to the matching {@link LoopEnd} form its
 * body.
 */
public record LoopStart(String start, String stop) implements Statement {

    public LoopStart {
        Objects.requireNonNull(start, "Loop start cannot be null");
        Objects.requireNonNull(stop, "Loop stop cannot be null");
    }
}
