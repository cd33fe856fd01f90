package org.stockflow.compiler.diagnostics;

/**
 * Thrown when a formula is empty, starts or ends with an operator, has two adjacent
 * operators, or is missing an operator between two operands.
 */
public class InvalidFormulaException extends IllegalModelException {

    private final String formula;
    private final String reason;

    /**
     * @param formula The offending formula, rendered for display.
     * @param reason  What is wrong with it.
     */
    public InvalidFormulaException(Object formula, String reason) {
        super("illegal formula '" + formula + "' due to '" + reason + "'");
        this.formula = String.valueOf(formula);
        this.reason = reason;
    }

    public String getFormula() {
        return formula;
    }

    public String getReason() {
        return reason;
    }
}
