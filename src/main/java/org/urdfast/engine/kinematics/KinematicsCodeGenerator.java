package org.urdfast.engine.kinematics;

import org.urdfast.engine.codegen.CodeFileBuilder;
import org.urdfast.engine.codegen.GeneratedFile;
import org.urdfast.engine.codegen.GenerationOptions;
import org.urdfast.engine.codegen.MatrixFunctionGenerator;
import org.urdfast.engine.model.ExpressionGrid;
import org.urdfast.engine.transpiler.SyntaxProfile;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.function.Consumer;

/**
 * Generates the transition-matrix functions of a robot.
 *
 * For every requested joint, the forward matrix ({@code T_<joint>}) and/or the
 * inverse matrix ({@code T_<joint>_inv}) is obtained from the
 * {@link SymbolicKinematics} collaborator, optimized and emitted. Functions are
 * generated concurrently; each one has its own optimizer namespace, so no
 * coordination is needed. The file lists them in request order.
 *
 * Progress lines ({@code Generating Forward Transition Matrix 2/6: T_joint_2})
 * go to the progress sink, which may be called from several threads.
 */
public final class KinematicsCodeGenerator {

    private final SymbolicKinematics kinematics;
    private final MatrixFunctionGenerator generator;
    private final Consumer<String> progress;
    private final int parallelism;

    /**
     * Creates a generator reporting progress on standard output, using one
     * thread per available processor.
     */
    public KinematicsCodeGenerator(SymbolicKinematics kinematics, SyntaxProfile profile, GenerationOptions options) {
        this(kinematics, profile, options, System.out::println, Runtime.getRuntime().availableProcessors());
    }

    public KinematicsCodeGenerator(SymbolicKinematics kinematics, SyntaxProfile profile, GenerationOptions options,
            Consumer<String> progress, int parallelism) {
        this.kinematics = Objects.requireNonNull(kinematics, "Kinematics cannot be null");
        this.generator = new MatrixFunctionGenerator(profile, options);
        this.progress = Objects.requireNonNull(progress, "Progress sink cannot be null");
        if (parallelism < 1) {
            throw new IllegalArgumentException("Parallelism must be positive: " + parallelism);
        }
        this.parallelism = parallelism;
    }

    /**
     * Generates a complete file with forward and inverse matrices.
     *
     * @param baseName File name without extension
     * @param forward  Joints whose forward matrix is generated
     * @param inverse  Joints whose inverse matrix is generated
     * @throws CodeGenerationException if any function fails; no file is
     *                                 produced then
     */
    public GeneratedFile generateFile(String baseName, List<TransitionRequest> forward,
            List<TransitionRequest> inverse) {
        List<Task> tasks = new ArrayList<>();
        for (int i = 0; i < forward.size(); i++) {
            TransitionRequest request = forward.get(i);
            tasks.add(new Task(request.forwardFunctionName(),
                    "Generating Forward Transition Matrix " + (i + 1) + "/" + forward.size(),
                    () -> kinematics.transform(request.parentLink(), request.childLink()),
                    description(request.parentLink(), request.childLink(), request.jointType())));
        }
        for (int i = 0; i < inverse.size(); i++) {
            TransitionRequest request = inverse.get(i);
            tasks.add(new Task(request.inverseFunctionName(),
                    "Generating Backward Transition Matrix " + (i + 1) + "/" + inverse.size(),
                    () -> kinematics.inverseTransform(request.parentLink(), request.childLink()),
                    description(request.childLink(), request.parentLink(), request.jointType())));
        }

        List<String> functions = run(tasks);

        CodeFileBuilder file = new CodeFileBuilder(generator.profile(), baseName);
        if (!forward.isEmpty()) {
            file.section("Forward Transition Matrices");
            for (int i = 0; i < forward.size(); i++) {
                file.subsection("Joint " + forward.get(i).joint()).function(functions.get(i));
            }
        }
        if (!inverse.isEmpty()) {
            file.section("Backward Transition Matrices");
            for (int i = 0; i < inverse.size(); i++) {
                file.subsection("Joint " + inverse.get(i).joint() + " Inverse")
                        .function(functions.get(forward.size() + i));
            }
        }
        return file.build();
    }

    /**
     * Generates one function per task, concurrently, returning the code in
     * task order.
     */
    private List<String> run(List<Task> tasks) {
        if (tasks.isEmpty()) {
            return List.of();
        }
        ExecutorService executor = Executors.newFixedThreadPool(Math.min(parallelism, tasks.size()));
        try {
            List<Future<String>> futures = new ArrayList<>(tasks.size());
            for (Task task : tasks) {
                futures.add(executor.submit(() -> {
                    progress.accept(task.progressLine() + ": " + task.functionName());
                    return generator.generate(task.functionName(), task.grid().get(), task.description());
                }));
            }
            List<String> functions = new ArrayList<>(tasks.size());
            for (int i = 0; i < futures.size(); i++) {
                functions.add(await(futures.get(i), tasks.get(i).functionName()));
            }
            return functions;
        } finally {
            executor.shutdownNow();
        }
    }

    private static String await(Future<String> future, String functionName) {
        try {
            return future.get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new CodeGenerationException(functionName, e);
        } catch (ExecutionException e) {
            throw new CodeGenerationException(functionName, e.getCause());
        }
    }

    private static String description(String from, String to, String jointType) {
        return "Transition Matrix to go from link " + from + " to link " + to + ".\nThis joint is " + jointType
                + ".";
    }

    /**
     * One function to generate; the grid is fetched on the worker thread.
     */
    private record Task(String functionName, String progressLine, GridSupplier grid, String description) {
    }

    @FunctionalInterface
    private interface GridSupplier {
        ExpressionGrid get();
    }
}
