package org.stockflow.compiler.diagnostics;

/**
 * Thrown when source text cannot be scanned or turned into stocks and flows.
 */
public class ParseException extends StockflowException {

    public ParseException(String message) {
        super(message);
    }

    public ParseException(String message, Throwable cause) {
        super(message, cause);
    }
}
