package org.stockflow.compiler.diagnostics;

/**
 * Thrown during model validation when a formula references a stock the model does not
 * contain.
 */
public class UnresolvedReferenceException extends InvalidFormulaException {

    private final String reference;

    public UnresolvedReferenceException(Object formula, String reference) {
        super(formula, "reference to non-existent stock '" + reference + "'");
        this.reference = reference;
    }

    public String getReference() {
        return reference;
    }
}
