package org.stockflow.compiler.frontend.lexer;

/**
 * The {@code @} separating the stocks of a flow from its rate.
 */
public record FlowDelimiterToken() implements LineToken {
}
