package org.stockflow.compiler.frontend.lexer;

/**
 * The {@code >} between source and destination stock.
 */
public record FlowDirectionToken() implements LineToken {
}
