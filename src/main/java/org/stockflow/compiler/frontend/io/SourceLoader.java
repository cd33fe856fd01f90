package org.stockflow.compiler.frontend.io;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.stream.Collectors;

/**
 * Loads spec text from the filesystem or the classpath.
 */
public final class SourceLoader {

    /** Classpath folder holding the bundled example specs. */
    public static final String EXAMPLES_ROOT = "examples/";

    /**
     * Result of loading a spec.
     *
     * @param content     The spec text, with line endings normalized to {@code \n}.
     * @param logicalName The path or resource name, for diagnostics.
     */
    public record LoadResult(String content, String logicalName) {}

    private SourceLoader() {}

    /**
     * Loads a spec from a local file.
     *
     * @param path The file to read.
     * @throws IOException If the file cannot be read.
     */
    public static LoadResult loadFile(Path path) throws IOException {
        String logicalName = path.toString().replace('\\', '/');
        String content = normalizeLineEndings(Files.readString(path, StandardCharsets.UTF_8));
        return new LoadResult(content, logicalName);
    }

    /**
     * Loads a spec from a classpath resource.
     *
     * @param resourcePath The resource path.
     * @throws IOException If the resource is not found or cannot be read.
     */
    public static LoadResult loadClasspath(String resourcePath) throws IOException {
        try (InputStream is = Thread.currentThread().getContextClassLoader().getResourceAsStream(resourcePath)) {
            if (is == null) {
                throw new IOException("Resource not found in classpath: " + resourcePath);
            }
            try (BufferedReader br = new BufferedReader(new InputStreamReader(is, StandardCharsets.UTF_8))) {
                String content = br.lines().collect(Collectors.joining("\n")) + "\n";
                return new LoadResult(content, resourcePath);
            }
        }
    }

    /**
     * Loads one of the bundled example specs by name, e.g. {@code hiring}.
     */
    public static LoadResult loadExample(String name) throws IOException {
        return loadClasspath(EXAMPLES_ROOT + name + ".txt");
    }

    private static String normalizeLineEndings(String text) {
        return text.replace("\r\n", "\n").replace("\r", "\n");
    }
}
