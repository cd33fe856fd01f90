package org.stockflow.cli.commands;

import java.io.IOException;
import java.io.PrintWriter;
import java.util.concurrent.Callable;

import org.stockflow.cli.CommandLineInterface;
import org.stockflow.compiler.api.ModelCompiler;
import org.stockflow.compiler.diagnostics.StockflowException;
import org.stockflow.compiler.frontend.io.SourceLoader;
import org.stockflow.compiler.frontend.lexer.Line;
import org.stockflow.compiler.frontend.lexer.SourceLines;
import org.stockflow.compiler.frontend.lexer.TokenPrinter;

import com.typesafe.config.ConfigException;

import picocli.CommandLine.ArgGroup;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.ParentCommand;
import picocli.CommandLine.Spec;

@Command(
    name = "tokens",
    mixinStandardHelpOptions = true,
    description = "Print the scanned tokens of a model, one numbered line per source line"
)
public class TokensCommand implements Callable<Integer> {

    @ArgGroup(exclusive = true, multiplicity = "1")
    private ModelInput input;

    @ParentCommand
    private CommandLineInterface parent;

    @Spec
    private CommandSpec spec;

    @Override
    public Integer call() {
        PrintWriter out = spec.commandLine().getOut();
        try {
            parent.getConfig();
            SourceLoader.LoadResult source = input.load();
            SourceLines lines = new ModelCompiler().tokens(source.content());
            for (Line line : lines.lines()) {
                out.println(line.number() + ": " + TokenPrinter.readable(line));
            }
            out.flush();
            return 0;
        } catch (StockflowException | IOException | IllegalArgumentException | ConfigException e) {
            spec.commandLine().getErr().println("Error: " + e.getMessage());
            return 1;
        }
    }
}
