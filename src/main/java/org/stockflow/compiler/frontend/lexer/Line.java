package org.stockflow.compiler.frontend.lexer;

import java.util.List;

/**
 * A single scanned line.
 *
 * @param number The 1-based line number in the source text.
 * @param tokens The tokens found on the line, in order.
 */
public record Line(int number, List<LineToken> tokens) {

    public Line {
        tokens = List.copyOf(tokens);
    }
}
