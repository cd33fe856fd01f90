package org.stockflow.compiler.frontend.lexer;

/**
 * A comment, either a whole line or the trailing part of one.
 *
 * @param text The comment text without the leading {@code #}.
 */
public record CommentToken(String text) implements LineToken {
}
