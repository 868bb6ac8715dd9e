package org.urdfast.engine.codegen;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Objects;

/**
 * Represents a generated source file.
 */
public record GeneratedFile(String fileName, String content) {

    public GeneratedFile {
        Objects.requireNonNull(fileName, "File name cannot be null");
        Objects.requireNonNull(content, "Content cannot be null");
    }

    /**
     * Writes the file into a directory, creating the directory if needed.
     *
     * @return The path written
     */
    public Path writeTo(Path outputDir) throws IOException {
        Files.createDirectories(outputDir);
        Path target = outputDir.resolve(fileName);
        Files.writeString(target, content);
        return target;
    }
}
