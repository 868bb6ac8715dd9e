package org.urdfast.engine.cli;

import org.urdfast.engine.codegen.CodeFileBuilder;
import org.urdfast.engine.codegen.GeneratedFile;
import org.urdfast.engine.codegen.GenerationOptions;
import org.urdfast.engine.codegen.MatrixFunctionGenerator;
import org.urdfast.engine.expression.ExpressionParseException;
import org.urdfast.engine.model.ExpressionGrid;
import org.urdfast.engine.transpiler.CodegenConfigurationException;
import org.urdfast.engine.transpiler.SyntaxProfile;
import org.urdfast.engine.transpiler.SyntaxProfileRegistry;

import java.io.IOException;
import java.io.PrintStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.TreeSet;

/**
 * Command-line entry point: generates one function from a grid file.
 *
 * <pre>
 * codegen [--vector] [--no-docstrings] [--lists] &lt;profile&gt; &lt;function-name&gt; &lt;grid-file&gt; [output-dir]
 * </pre>
 *
 * The grid file holds one matrix row per line, cells separated by {@code ;}.
 * A single cell yields a scalar function. Without an output directory the
 * file is printed.
 */
public final class CodegenCli {

    private static final String USAGE = "Usage: codegen [--vector] [--no-docstrings] [--lists] "
            + "<profile> <function-name> <grid-file> [output-dir]";

    private CodegenCli() {
    }

    public static void main(String[] args) {
        int status = run(args, System.out, System.err);
        if (status != 0) {
            System.exit(status);
        }
    }

    /**
     * Runs the command.
     *
     * @return The exit status: 0 on success, 1 on error, 2 on bad usage
     */
    static int run(String[] args, PrintStream out, PrintStream err) {
        boolean inputAsVector = false;
        boolean docstrings = true;
        boolean includeLists = false;
        List<String> positional = new ArrayList<>();
        for (String arg : args) {
            switch (arg) {
                case "--vector" -> inputAsVector = true;
                case "--no-docstrings" -> docstrings = false;
                case "--lists" -> includeLists = true;
                default -> {
                    if (arg.startsWith("--")) {
                        err.println("Unknown option: " + arg);
                        err.println(USAGE);
                        return 2;
                    }
                    positional.add(arg);
                }
            }
        }
        if (positional.size() < 3 || positional.size() > 4) {
            err.println(USAGE);
            err.println("Profiles: " + new TreeSet<>(SyntaxProfileRegistry.availableProfiles()));
            return 2;
        }

        String functionName = positional.get(1);
        try {
            SyntaxProfile profile = SyntaxProfileRegistry.get(positional.get(0));
            Path gridFile = Path.of(positional.get(2));
            ExpressionGrid grid = readGrid(gridFile);
            GenerationOptions options = new GenerationOptions(inputAsVector, includeLists, docstrings);

            String code = new MatrixFunctionGenerator(profile, options).generate(functionName, grid,
                    "Generated from " + gridFile.getFileName() + ".");
            GeneratedFile file = new CodeFileBuilder(profile, functionName).function(code).build();

            if (positional.size() == 4) {
                Path written = file.writeTo(Path.of(positional.get(3)));
                out.println("Generated " + written);
            } else {
                out.print(file.content());
            }
            return 0;
        } catch (ExpressionParseException e) {
            err.println("Parse error: " + e.getMessage());
            return 1;
        } catch (CodegenConfigurationException | IllegalArgumentException e) {
            err.println("Error: " + e.getMessage());
            return 1;
        } catch (IOException e) {
            err.println("I/O error: " + e.getMessage());
            return 1;
        }
    }

    /**
     * Reads a grid: one row per non-blank line, cells separated by {@code ;}.
     *
     * @throws IllegalArgumentException if the file has no rows or the rows
     *                                  differ in length
     */
    static ExpressionGrid readGrid(Path path) throws IOException {
        List<List<String>> rows = new ArrayList<>();
        for (String line : Files.readAllLines(path)) {
            if (line.isBlank()) {
                continue;
            }
            List<String> cells = new ArrayList<>();
            for (String cell : line.split(";", -1)) {
                cells.add(cell.strip());
            }
            rows.add(cells);
        }
        if (rows.isEmpty()) {
            throw new IllegalArgumentException("Grid file is empty: " + path);
        }
        return new ExpressionGrid(rows);
    }
}
