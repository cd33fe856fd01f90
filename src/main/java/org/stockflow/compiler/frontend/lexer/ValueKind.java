package org.stockflow.compiler.frontend.lexer;

/**
 * Classification of a single formula operand.
 */
public enum ValueKind {
    /** An integer literal, optionally negative. */
    WHOLE,
    /** A literal of the form {@code digits.digits}. */
    DECIMAL,
    /** The {@code inf} keyword. */
    INFINITY,
    /** Anything else: the name of a stock. */
    REFERENCE
}
