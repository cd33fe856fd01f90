package org.stockflow.compiler.frontend.lexer;

/**
 * A token that can appear directly on a {@link Line}.
 */
public sealed interface LineToken
        permits StockToken, FlowToken, FlowDirectionToken, FlowDelimiterToken, CommentToken {
}
