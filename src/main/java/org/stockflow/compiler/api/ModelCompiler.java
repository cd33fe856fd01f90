package org.stockflow.compiler.api;

import org.stockflow.compiler.frontend.io.SourceLoader;
import org.stockflow.compiler.frontend.lexer.Lexer;
import org.stockflow.compiler.frontend.lexer.SourceLines;
import org.stockflow.compiler.frontend.parser.ModelParser;
import org.stockflow.runtime.model.Model;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;

/**
 * Entry point for turning spec text into a validated {@link Model}.
 */
public class ModelCompiler {

    private static final Logger LOG = LoggerFactory.getLogger(ModelCompiler.class);

    /**
     * Scans, parses and validates a spec.
     *
     * @param text       The model text.
     * @param sourceName Name of the spec, for logging.
     * @return A validated model.
     * @throws org.stockflow.compiler.diagnostics.StockflowException if the spec is invalid.
     */
    public Model compile(String text, String sourceName) {
        SourceLines lines = Lexer.lex(text);
        Model model = ModelParser.parse(lines);
        model.validate();
        LOG.debug("Compiled '{}': {} stock(s), {} flow(s)", sourceName, model.stocks().size(), model.flows().size());
        return model;
    }

    public Model compile(String text) {
        return compile(text, "<text>");
    }

    /**
     * Loads and compiles a spec file.
     *
     * @throws IOException if the file cannot be read.
     */
    public Model compileFile(Path path) throws IOException {
        SourceLoader.LoadResult source = SourceLoader.loadFile(path);
        return compile(source.content(), source.logicalName());
    }

    /**
     * Scans a model without building a model.
     */
    public SourceLines tokens(String text) {
        return Lexer.lex(text);
    }
}
