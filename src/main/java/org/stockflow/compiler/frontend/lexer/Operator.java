package org.stockflow.compiler.frontend.lexer;

import java.util.Optional;

/**
 * The four binary operators of the formula language. There is no precedence between them.
 */
public enum Operator {
    ADD('+'),
    SUBTRACT('-'),
    MULTIPLY('*'),
    DIVIDE('/');

    private final char symbol;

    Operator(char symbol) {
        this.symbol = symbol;
    }

    public char symbol() {
        return symbol;
    }

    /**
     * Applies this operator with IEEE-754 double semantics.
     */
    public double apply(double left, double right) {
        return switch (this) {
            case ADD -> left + right;
            case SUBTRACT -> left - right;
            case MULTIPLY -> left * right;
            case DIVIDE -> left / right;
        };
    }

    public static Optional<Operator> fromSymbol(char c) {
        for (Operator op : values()) {
            if (op.symbol == c) {
                return Optional.of(op);
            }
        }
        return Optional.empty();
    }
}
