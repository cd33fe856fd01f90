package org.stockflow.compiler.frontend.lexer;

import java.util.List;

/**
 * A lexed formula: a flat sequence alternating operands and operators. Parenthesized groups
 * appear as nested {@code FormulaToken}s.
 *
 * @param terms The terms in source order.
 */
public record FormulaToken(List<FormulaTerm> terms) implements FormulaTerm {

    public FormulaToken {
        terms = List.copyOf(terms);
    }

    public boolean isEmpty() {
        return terms.isEmpty();
    }

    /**
     * @return true if this formula is exactly one decimal literal, e.g. {@code 0.5}.
     */
    public boolean isSingleDecimal() {
        return terms.size() == 1
                && terms.get(0) instanceof ValueTerm value
                && value.kind() == ValueKind.DECIMAL;
    }
}
