package org.stockflow.compiler.frontend.lexer;

import java.util.stream.Collectors;

/**
 * Renders tokens back into human-readable spec text. Whitespace is normalized, so the
 * output is equivalent to, but not necessarily identical with, the scanned source.
 */
public final class TokenPrinter {

    private TokenPrinter() {}

    public static String readable(SourceLines source) {
        return source.lines().stream()
                .map(TokenPrinter::readable)
                .collect(Collectors.joining("\n"));
    }

    public static String readable(Line line) {
        return line.tokens().stream()
                .map(TokenPrinter::readable)
                .collect(Collectors.joining(" "));
    }

    public static String readable(LineToken token) {
        if (token instanceof StockToken stock) {
            if (stock.infinite()) {
                return Lexer.START_INFINITE_STOCK + stock.name() + Lexer.END_INFINITE_STOCK;
            }
            return stock.name() + readable(stock.parameters(), true);
        } else if (token instanceof FlowToken flow) {
            return flow.label() + readable(flow.parameters(), flow.isLabeled());
        } else if (token instanceof FlowDirectionToken) {
            return String.valueOf(Lexer.FLOW_DIRECTION);
        } else if (token instanceof FlowDelimiterToken) {
            return String.valueOf(Lexer.FLOW_DELIMITER);
        } else if (token instanceof CommentToken comment) {
            return Lexer.COMMENT + comment.text();
        }
        throw new IllegalArgumentException("Unexpected token: " + token);
    }

    /**
     * Renders a parameter list.
     *
     * @param parameters    The parameters.
     * @param parenthesized Whether to wrap a non-empty list in parentheses.
     */
    public static String readable(Parameters parameters, boolean parenthesized) {
        if (parameters.isEmpty()) {
            return "";
        }
        String joined = parameters.formulas().stream()
                .map(TokenPrinter::readable)
                .collect(Collectors.joining(", "));
        return parenthesized ? FormulaLexer.START_PAREN + joined + FormulaLexer.END_PAREN : joined;
    }

    public static String readable(FormulaToken formula) {
        return formula.terms().stream()
                .map(TokenPrinter::readable)
                .collect(Collectors.joining(" "));
    }

    public static String readable(FormulaTerm term) {
        if (term instanceof ValueTerm value) {
            return value.text();
        } else if (term instanceof OperatorTerm op) {
            return String.valueOf(op.operator().symbol());
        } else if (term instanceof FormulaToken group) {
            return FormulaLexer.START_PAREN + readable(group) + FormulaLexer.END_PAREN;
        }
        throw new IllegalArgumentException("Unexpected formula term: " + term);
    }
}
