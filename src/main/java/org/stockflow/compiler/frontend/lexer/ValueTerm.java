package org.stockflow.compiler.frontend.lexer;

/**
 * A literal or a stock reference inside a formula.
 *
 * @param kind The operand kind.
 * @param text The operand as written.
 */
public record ValueTerm(ValueKind kind, String text) implements FormulaTerm {

    public boolean isReference() {
        return kind == ValueKind.REFERENCE;
    }
}
