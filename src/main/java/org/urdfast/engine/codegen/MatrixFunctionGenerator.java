package org.urdfast.engine.codegen;

import org.urdfast.engine.model.ExpressionGrid;
import org.urdfast.engine.model.Statement;
import org.urdfast.engine.optimizer.CommonSubexpressionOptimizer;
import org.urdfast.engine.optimizer.OptimizationResult;
import org.urdfast.engine.transpiler.SyntaxProfile;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * The full pipeline for one function: optimize an expression grid, then emit
 * it in a profile's syntax.
 *
 * Example:
 *
 * <pre>
 * MatrixFunctionGenerator gen = new MatrixFunctionGenerator(SyntaxProfiles.JULIA, GenerationOptions.DEFAULT);
 * String code = gen.generate("T_joint_1", grid, "Transition matrix of joint_1.");
 * </pre>
 *
 * Instances hold no mutable state and may be shared between threads.
 */
public final class MatrixFunctionGenerator {

    private final FunctionEmitter emitter;
    private final CommonSubexpressionOptimizer optimizer;
    private final GenerationOptions options;

    public MatrixFunctionGenerator(SyntaxProfile profile, GenerationOptions options) {
        this.options = Objects.requireNonNull(options, "Options cannot be null");
        this.emitter = new FunctionEmitter(profile);
        this.optimizer = new CommonSubexpressionOptimizer(options.includeLists());
    }

    public SyntaxProfile profile() {
        return emitter.profile();
    }

    /**
     * Generates a function whose parameters are the free symbols and
     * subscripted objects of the grid, described by {@link ParameterDescriber}.
     */
    public String generate(String name, ExpressionGrid grid, String description) {
        return generate(name, ParameterDescriber.parameters(grid.cells()), grid, description);
    }

    /**
     * Generates a function with explicit parameters.
     *
     * @throws org.urdfast.engine.expression.ExpressionParseException if a cell
     *         is malformed
     * @throws org.urdfast.engine.transpiler.CodegenConfigurationException if
     *         the profile cannot express a cell
     */
    public String generate(String name, List<FunctionParameter> parameters, ExpressionGrid grid,
            String description) {
        Set<String> reserved = new HashSet<>();
        for (FunctionParameter parameter : parameters) {
            reserved.add(parameter.name());
        }
        reserved.add(FunctionEmitter.VECTOR_PARAMETER);

        OptimizationResult optimized = optimizer.optimize(List.of(), grid.cells(), reserved);
        List<Statement> body = new ArrayList<>(optimized.variables());
        FunctionSpec spec = new FunctionSpec(name, parameters, body, grid.withCells(optimized.expressions()),
                options.docstrings() ? description : null, options.inputAsVector());
        return emitter.emit(spec);
    }
}
