package org.stockflow.compiler.diagnostics;

/**
 * Thrown when a percentage-based flow (Conversion or Leak) would drain an infinite stock.
 */
public class IllegalSourceStockException extends IllegalModelException {

    public IllegalSourceStockException(Object rate, Object source) {
        super("stock '" + source + "' cannot be used as source for rate '" + rate + "'");
    }
}
