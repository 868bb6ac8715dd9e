package org.urdfast.engine.kinematics;

import org.urdfast.engine.model.ExpressionGrid;

/**
 * Capability of a symbolic-computation backend that derives transition
 * matrices between reference frames of a robot.
 *
 * Implementations return flat grids of algebraic expressions (normally 4x4
 * homogeneous transforms) over degree-of-freedom symbols named after the
 * joints ({@code theta_<joint>}, {@code d_<joint>}, ...). Their mathematical
 * correctness is never checked by the code generator.
 */
public interface SymbolicKinematics {

    /**
     * @return The matrix mapping coordinates of frame {@code to} into frame
     *         {@code from}
     */
    ExpressionGrid transform(String from, String to);

    /**
     * @return The algebraic inverse of {@link #transform(String, String)}
     */
    ExpressionGrid inverseTransform(String from, String to);
}
