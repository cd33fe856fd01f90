package org.stockflow.compiler.frontend.lexer;

/**
 * The rate part of a flow declaration, after the {@code @}.
 *
 * @param label      The flow kind as written ({@code Rate}, {@code Conversion}, ...), or
 *                   the empty string for an unlabeled flow.
 * @param parameters The flow's parameters.
 */
public record FlowToken(String label, Parameters parameters) implements LineToken {

    public boolean isLabeled() {
        return !label.isEmpty();
    }
}
