package org.stockflow.compiler.frontend.lexer;

import java.util.List;

/**
 * Root of the token tree: every non-empty line of a spec, in source order.
 *
 * @param lines The scanned lines.
 */
public record SourceLines(List<Line> lines) {

    public SourceLines {
        lines = List.copyOf(lines);
    }
}
