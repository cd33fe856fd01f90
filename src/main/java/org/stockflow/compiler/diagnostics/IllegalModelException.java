package org.stockflow.compiler.diagnostics;

/**
 * Thrown when stocks, flows or formulas are individually well-formed but do not add up
 * to a model that can be simulated.
 */
public class IllegalModelException extends StockflowException {

    public IllegalModelException(String message) {
        super(message);
    }
}
