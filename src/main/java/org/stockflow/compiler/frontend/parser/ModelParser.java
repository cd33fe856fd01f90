package org.stockflow.compiler.frontend.parser;

import org.stockflow.compiler.diagnostics.InvalidParametersException;
import org.stockflow.compiler.diagnostics.LineAwareException;
import org.stockflow.compiler.diagnostics.LineParseException;
import org.stockflow.compiler.diagnostics.StockflowException;
import org.stockflow.compiler.diagnostics.UnknownFlowTypeException;
import org.stockflow.compiler.frontend.lexer.FlowToken;
import org.stockflow.compiler.frontend.lexer.Lexer;
import org.stockflow.compiler.frontend.lexer.Line;
import org.stockflow.compiler.frontend.lexer.LineToken;
import org.stockflow.compiler.frontend.lexer.Parameters;
import org.stockflow.compiler.frontend.lexer.SourceLines;
import org.stockflow.compiler.frontend.lexer.StockToken;
import org.stockflow.compiler.frontend.lexer.TokenPrinter;
import org.stockflow.runtime.model.FlowKind;
import org.stockflow.runtime.model.Formula;
import org.stockflow.runtime.model.Model;
import org.stockflow.runtime.model.RateRule;
import org.stockflow.runtime.model.Stock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Builds a {@link Model} from scanned source lines.
 *
 * <p>On each line the first stock is the source, the second stock is the destination and a
 * flow token connects the two. A line holding a single stock only declares it. Declaring
 * a stock that already exists reuses it; see {@link Model.Builder#declareStock}.</p>
 *
 * <p>The parser does not validate the model. Errors raised while handling a line carry that
 * line's number and text.</p>
 */
public final class ModelParser {

    private static final Logger LOG = LoggerFactory.getLogger(ModelParser.class);

    private ModelParser() {
    }

    /**
     * Scans and parses a complete model.
     *
     * @param text The model text.
     * @return The unvalidated model.
     * @throws org.stockflow.compiler.diagnostics.ParseException if a line cannot be scanned
     *                                                           or parsed.
     */
    public static Model parse(String text) {
        return parse(Lexer.lex(text));
    }

    /**
     * Parses already scanned lines.
     */
    public static Model parse(SourceLines source) {
        Model.Builder builder = Model.builder();
        for (Line line : source.lines()) {
            try {
                parseLine(builder, line);
            } catch (LineAwareException e) {
                throw e.attachLine(TokenPrinter.readable(line), line.number());
            } catch (StockflowException e) {
                throw new LineParseException(TokenPrinter.readable(line), line.number(), e);
            }
        }
        Model model = builder.build();
        LOG.debug("Parsed {} line(s) into {} stock(s) and {} flow(s)",
                source.lines().size(), model.stocks().size(), model.flows().size());
        return model;
    }

    private static void parseLine(Model.Builder builder, Line line) {
        Stock source = null;
        Stock destination = null;
        for (LineToken token : line.tokens()) {
            if (token instanceof StockToken stock) {
                if (source == null) {
                    source = buildStock(builder, stock);
                } else if (destination == null) {
                    destination = buildStock(builder, stock);
                }
            } else if (token instanceof FlowToken flow && source != null && destination != null) {
                buildFlow(builder, source, destination, flow);
            }
        }
    }

    /**
     * Declares the stock described by a token.
     *
     * @throws org.stockflow.compiler.diagnostics.ConflictingValuesException
     *         if the token redeclares a stock with a different value.
     */
    public static Stock buildStock(Model.Builder builder, StockToken token) {
        if (token.infinite()) {
            return builder.declareInfiniteStock(token.name());
        }
        Parameters parameters = token.parameters();
        Formula initial = parameters.size() > 0 ? new Formula(parameters.get(0)) : null;
        Formula maximum = parameters.size() > 1 ? new Formula(parameters.get(1)) : null;
        return builder.declareStock(token.name(), initial, maximum);
    }

    /**
     * Adds the flow described by a token. Unlabeled flows whose only parameter is a decimal
     * literal are conversions; other unlabeled flows are rates.
     *
     * @throws UnknownFlowTypeException   if the label is not a known flow kind.
     * @throws InvalidParametersException if the flow has no parameter.
     */
    public static void buildFlow(Model.Builder builder, Stock source, Stock destination, FlowToken token) {
        Parameters parameters = token.parameters();
        FlowKind kind;
        if (token.isLabeled()) {
            kind = FlowKind.fromLabel(token.label())
                    .orElseThrow(() -> new UnknownFlowTypeException(token.label()));
        } else if (!parameters.isEmpty() && parameters.get(0).isSingleDecimal()) {
            kind = FlowKind.CONVERSION;
        } else {
            kind = FlowKind.RATE;
        }

        if (parameters.isEmpty()) {
            throw new InvalidParametersException(TokenPrinter.readable(token));
        }
        builder.flow(source, destination, new RateRule(kind, new Formula(parameters.get(0))));
    }

    /**
     * Lexes and declares a single stock, e.g. {@code Hires(5, 10)}.
     */
    public static Stock parseStock(Model.Builder builder, String text) {
        return buildStock(builder, Lexer.lexStock(text));
    }

    /**
     * Lexes and adds a single flow, e.g. {@code Leak(0.1)}.
     */
    public static void parseFlow(Model.Builder builder, Stock source, Stock destination, String text) {
        buildFlow(builder, source, destination, Lexer.lexFlow(text));
    }
}
