package org.stockflow.cli.commands;

import org.stockflow.cli.CommandLineInterface;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import picocli.CommandLine;

import java.io.PrintWriter;
import java.io.StringWriter;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;

@Tag("integration")
public class CheckCommandTest {

    @TempDir
    Path tempDir;

    @Test
    void testSummarizesValidModel() throws Exception {
        Path modelFile = tempDir.resolve("model.txt");
        Files.writeString(modelFile, "[Pool] > a(b + 1) @ 2\nb(3) > c(0, 10) @ Leak(0.5)\n");

        CommandLine cmdLine = CommandLineInterface.createCommandLine();
        StringWriter out = new StringWriter();
        cmdLine.setOut(new PrintWriter(out));

        int exitCode = cmdLine.execute("check", "-f", modelFile.toString());

        assertThat(exitCode).isEqualTo(0);
        assertThat(out.toString())
                .contains(": OK")
                .contains("Stocks (4):")
                .contains("Pool initial=inf maximum=inf hidden")
                .contains("a initial=b + 1 maximum=inf")
                .contains("c initial=0 maximum=10")
                .contains("Flows (2):")
                .contains("Pool > a @ Rate(2)")
                .contains("b > c @ Leak(0.5)")
                .contains("Initialization order: [a]");
    }

    @Test
    void testReportsParseErrors() throws Exception {
        Path modelFile = tempDir.resolve("model.txt");
        Files.writeString(modelFile, "a > b @ 1\na > b @ Invalid(2)\n");

        CommandLine cmdLine = CommandLineInterface.createCommandLine();
        StringWriter err = new StringWriter();
        cmdLine.setErr(new PrintWriter(err));

        int exitCode = cmdLine.execute("check", "-f", modelFile.toString());

        assertThat(exitCode).isEqualTo(1);
        assertThat(err.toString()).contains("line 2").contains("Invalid");
    }

    @Test
    void testChecksBundledExample() {
        CommandLine cmdLine = CommandLineInterface.createCommandLine();
        StringWriter out = new StringWriter();
        cmdLine.setOut(new PrintWriter(out));

        int exitCode = cmdLine.execute("check", "--example", "hiring");

        assertThat(exitCode).isEqualTo(0);
        assertThat(out.toString()).contains("examples/hiring.txt: OK").contains("Flows (7):");
    }

    @Test
    void testUnknownExampleReturnsError() {
        CommandLine cmdLine = CommandLineInterface.createCommandLine();
        StringWriter err = new StringWriter();
        cmdLine.setErr(new PrintWriter(err));

        int exitCode = cmdLine.execute("check", "-e", "nope");

        assertThat(exitCode).isEqualTo(1);
        assertThat(err.toString()).contains("examples/nope.txt");
    }
}
