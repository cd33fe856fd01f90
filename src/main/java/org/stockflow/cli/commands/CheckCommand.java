package org.stockflow.cli.commands;

import java.io.IOException;
import java.io.PrintWriter;
import java.util.concurrent.Callable;

import org.stockflow.cli.CommandLineInterface;
import org.stockflow.compiler.api.ModelCompiler;
import org.stockflow.compiler.diagnostics.StockflowException;
import org.stockflow.compiler.frontend.io.SourceLoader;
import org.stockflow.runtime.model.Flow;
import org.stockflow.runtime.model.Model;
import org.stockflow.runtime.model.Stock;

import com.typesafe.config.ConfigException;

import picocli.CommandLine.ArgGroup;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.ParentCommand;
import picocli.CommandLine.Spec;

@Command(
    name = "check",
    mixinStandardHelpOptions = true,
    description = "Parse and validate a model without running it"
)
public class CheckCommand implements Callable<Integer> {

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
            Model model = new ModelCompiler().compile(source.content(), source.logicalName());

            out.println(source.logicalName() + ": OK");
            out.println("Stocks (" + model.stocks().size() + "):");
            for (Stock stock : model.stocks()) {
                out.println("  " + stock.getName()
                        + " initial=" + stock.getInitial().expression()
                        + " maximum=" + stock.getMaximum().expression()
                        + (stock.isShown() ? "" : " hidden"));
            }
            out.println("Flows (" + model.flows().size() + "):");
            for (Flow flow : model.flows()) {
                out.println("  " + flow.getSource().getName() + " > " + flow.getDestination().getName()
                        + " @ " + flow.getRule().kind().label() + "(" + flow.getRule().formula().expression() + ")");
            }
            out.println("Initialization order: " + model.initializationOrder());
            out.flush();
            return 0;
        } catch (StockflowException | IOException | IllegalArgumentException | ConfigException e) {
            spec.commandLine().getErr().println("Error: " + e.getMessage());
            return 1;
        }
    }
}
