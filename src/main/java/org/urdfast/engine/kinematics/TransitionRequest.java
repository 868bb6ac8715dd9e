package org.urdfast.engine.kinematics;

import java.util.Objects;

/**
 * One joint whose transition matrix should be generated.
 *
 * @param joint      Joint name, used in the function name {@code T_<joint>}
 * @param parentLink Frame the joint is attached to
 * @param childLink  Frame the joint moves
 * @param jointType  Joint type for the docstring (revolute, prismatic, ...)
 */
public record TransitionRequest(String joint, String parentLink, String childLink, String jointType) {

    public TransitionRequest {
        Objects.requireNonNull(joint, "Joint name cannot be null");
        Objects.requireNonNull(parentLink, "Parent link cannot be null");
        Objects.requireNonNull(childLink, "Child link cannot be null");
        Objects.requireNonNull(jointType, "Joint type cannot be null");
    }

    public String forwardFunctionName() {
        return "T_" + joint;
    }

    public String inverseFunctionName() {
        return "T_" + joint + "_inv";
    }
}
