package org.stockflow.cli.commands;

import java.io.IOException;
import java.nio.file.Path;

import org.stockflow.compiler.frontend.io.SourceLoader;

import picocli.CommandLine.Option;

/**
 * Where a command reads its model from: a file or one of the bundled examples.
 */
public class ModelInput {

    @Option(
        names = {"-f", "--file"},
        required = true,
        description = "Path to the model file"
    )
    Path file;

    @Option(
        names = {"-e", "--example"},
        required = true,
        description = "Name of a bundled example model: hiring, projects, maximums, links"
    )
    String example;

    SourceLoader.LoadResult load() throws IOException {
        if (file != null) {
            return SourceLoader.loadFile(file);
        }
        return SourceLoader.loadExample(example);
    }
}
