package org.stockflow.compiler.frontend.lexer;

/**
 * An operator inside a formula.
 *
 * @param operator The operator.
 */
public record OperatorTerm(Operator operator) implements FormulaTerm {
}
