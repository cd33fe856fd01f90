package org.stockflow.compiler.frontend.lexer;

/**
 * One element of a formula: a value, an operator, or a parenthesized group.
 */
public sealed interface FormulaTerm permits ValueTerm, OperatorTerm, FormulaToken {

    /**
     * @return true if this term is an operator.
     */
    default boolean isOperator() {
        return this instanceof OperatorTerm;
    }
}
