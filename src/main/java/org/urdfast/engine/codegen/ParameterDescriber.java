package org.urdfast.engine.codegen;

import org.urdfast.engine.expression.ExpressionForest;
import org.urdfast.engine.expression.OperationKind;
import org.urdfast.engine.expression.OperationRecord;
import org.urdfast.engine.model.VariableKind;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;
import java.util.regex.Pattern;

/**
 * Derives function parameters from the degrees of freedom an expression uses.
 *
 * Descriptions follow the symbol naming convention of the kinematics
 * collaborator: a category prefix followed by the joint name.
 *
 * <pre>
 * theta_J  rotation around the axis of revolute joint J
 * d_J      translation along the axis of prismatic joint J
 * dx_J     translation along X (dy_, dz_: Y, Z) of floating joint J
 * roll_J   rotation around X (pitch_, yaw_: Y, Z) of floating joint J
 * </pre>
 */
public final class ParameterDescriber {

    /**
     * Identifiers that are constants of the target languages, never
     * parameters.
     */
    private static final Set<String> CONSTANTS = Set.of("pi", "E", "I");

    private static final Pattern IDENTIFIER = Pattern.compile("[A-Za-z_][A-Za-z0-9_]*");

    private ParameterDescriber() {
    }

    /**
     * @return Free symbols of the expressions, subscripted objects included,
     *         sorted by name; numeric literals and known constants excluded
     */
    public static List<String> freeSymbols(Collection<String> expressions) {
        return new ArrayList<>(symbolKinds(expressions).keySet());
    }

    /**
     * Derives the parameters of a function computing the expressions, sorted
     * by name. Subscripted objects ({@code p} in {@code p[0]}) are vectors,
     * every other free symbol is a scalar.
     */
    public static List<FunctionParameter> parameters(Collection<String> expressions) {
        List<FunctionParameter> parameters = new ArrayList<>();
        symbolKinds(expressions).forEach((symbol, kind) ->
                parameters.add(new FunctionParameter(symbol, kind, describe(symbol))));
        return parameters;
    }

    private static Map<String, VariableKind> symbolKinds(Collection<String> expressions) {
        ExpressionForest forest = ExpressionForest.parse(new ArrayList<>(expressions));
        Map<String, VariableKind> kinds = new TreeMap<>();
        for (int s = 0; s < forest.sourceCount(); s++) {
            for (String leaf : forest.leaves(s)) {
                if (isSymbol(leaf) && !CONSTANTS.contains(leaf)) {
                    kinds.putIfAbsent(leaf, VariableKind.SCALAR);
                }
            }
        }
        for (int index : forest.reachableRecords()) {
            OperationRecord record = forest.record(index);
            if (record.kind() == OperationKind.SUBSCRIPT && IDENTIFIER.matcher(record.name()).matches()
                    && !CONSTANTS.contains(record.name())) {
                kinds.put(record.name(), VariableKind.VECTOR);
            }
        }
        return kinds;
    }

    /**
     * Describes each symbol as a scalar parameter, sorted by name.
     */
    public static List<FunctionParameter> describe(Collection<String> symbols) {
        List<FunctionParameter> parameters = new ArrayList<>();
        for (String symbol : new TreeSet<>(symbols)) {
            parameters.add(new FunctionParameter(symbol, VariableKind.SCALAR, describe(symbol)));
        }
        return parameters;
    }

    /**
     * @return The description of one symbol, empty if its prefix is unknown
     */
    public static String describe(String symbol) {
        int underscore = symbol.indexOf('_');
        if (underscore < 0) {
            return "";
        }
        String category = symbol.substring(0, underscore);
        String joint = symbol.substring(underscore + 1);
        return switch (category) {
            case "d" -> "Translation value (in meters) along the " + joint + " prismatic joint axis.";
            case "dx" -> "Translation value (in meters) along the X axis of the " + joint + " joint.";
            case "dy" -> "Translation value (in meters) along the Y axis of the " + joint + " joint.";
            case "dz" -> "Translation value (in meters) along the Z axis of the " + joint + " joint.";
            case "theta" -> "Rotation value (in radians) around the " + joint + " joint axis.";
            case "roll" -> "Rotation value (in radians) around the X axis of the " + joint + " joint.";
            case "pitch" -> "Rotation value (in radians) around the Y axis of the " + joint + " joint.";
            case "yaw" -> "Rotation value (in radians) around the Z axis of the " + joint + " joint.";
            default -> "";
        };
    }

    private static boolean isSymbol(String leaf) {
        return !leaf.isEmpty() && (Character.isLetter(leaf.charAt(0)) || leaf.charAt(0) == '_');
    }
}
