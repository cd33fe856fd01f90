package org.stockflow.compiler.frontend.lexer;

/**
 * A stock reference or declaration, e.g. {@code Employees(5, 20)} or {@code [Candidates]}.
 *
 * @param name       The stock name.
 * @param parameters Initial and maximum formulas, empty for a bare name.
 * @param infinite   Whether the stock was written in square brackets.
 */
public record StockToken(String name, Parameters parameters, boolean infinite) implements LineToken {
}
