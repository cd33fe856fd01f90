package org.stockflow.cli.commands;

import java.io.IOException;
import java.util.List;
import java.util.Locale;
import java.util.concurrent.Callable;

import org.stockflow.cli.CommandLineInterface;
import org.stockflow.cli.rendering.JsonRenderer;
import org.stockflow.cli.rendering.ResultRenderer;
import org.stockflow.cli.rendering.TableRenderer;
import org.stockflow.compiler.api.ModelCompiler;
import org.stockflow.compiler.diagnostics.StockflowException;
import org.stockflow.compiler.frontend.io.SourceLoader;
import org.stockflow.runtime.model.Model;
import org.stockflow.runtime.model.Snapshot;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigException;

import picocli.CommandLine.ArgGroup;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.ParentCommand;
import picocli.CommandLine.Spec;

@Command(
    name = "run",
    mixinStandardHelpOptions = true,
    description = "Simulate a model and print the value of every stock per round"
)
public class RunCommand implements Callable<Integer> {

    private static final Logger LOG = LoggerFactory.getLogger(RunCommand.class);

    /**
     * Output formats of the run command.
     */
    public enum OutputFormat {
        TABLE,
        JSON
    }

    @ArgGroup(exclusive = true, multiplicity = "1")
    private ModelInput input;

    @Option(
        names = {"-r", "--rounds"},
        description = "Number of rounds to simulate (default: stockflow.simulation.rounds)"
    )
    private Integer rounds;

    @Option(
        names = {"-s", "--separator"},
        description = "Column separator; \\t is read as a tab (default: stockflow.rendering.separator)"
    )
    private String separator;

    @Option(
        names = "--no-pad",
        description = "Do not pad values to the width of their column header"
    )
    private boolean noPad;

    @Option(
        names = "--format",
        description = "Output format: ${COMPLETION-CANDIDATES} (default: stockflow.rendering.format)"
    )
    private OutputFormat format;

    @ParentCommand
    private CommandLineInterface parent;

    @Spec
    private CommandSpec spec;

    @Override
    public Integer call() {
        try {
            Config config = parent.getConfig();
            int roundCount = rounds != null ? rounds : config.getInt("stockflow.simulation.rounds");
            if (roundCount < 0) {
                spec.commandLine().getErr().println("Error: rounds must not be negative: " + roundCount);
                return 2;
            }

            SourceLoader.LoadResult source = input.load();
            Model model = new ModelCompiler().compile(source.content(), source.logicalName());
            List<Snapshot> snapshots = model.run(roundCount);
            LOG.info("Simulated '{}' for {} round(s)", source.logicalName(), roundCount);

            spec.commandLine().getOut().println(renderer(config).render(model, snapshots));
            spec.commandLine().getOut().flush();
            return 0;
        } catch (StockflowException | IOException | IllegalArgumentException | ConfigException e) {
            spec.commandLine().getErr().println("Error: " + e.getMessage());
            return 1;
        }
    }

    private ResultRenderer renderer(Config config) {
        OutputFormat selected = format != null
                ? format
                : OutputFormat.valueOf(config.getString("stockflow.rendering.format").toUpperCase(Locale.ROOT));
        if (selected == OutputFormat.JSON) {
            return new JsonRenderer();
        }
        String sep = separator != null ? unescape(separator) : config.getString("stockflow.rendering.separator");
        boolean pad = !noPad && config.getBoolean("stockflow.rendering.pad");
        return new TableRenderer(sep, pad);
    }

    static String unescape(String separator) {
        return separator.replace("\\t", "\t");
    }
}
