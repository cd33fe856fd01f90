package org.stockflow.compiler.diagnostics;

/**
 * Root of all errors raised while compiling or running a stock-and-flow model.
 * <p>
 * This is a RuntimeException because every failure is fatal for the current build or
 * run: there is no partial-success mode, and a model that fails validation produces no
 * snapshots.
 */
public class StockflowException extends RuntimeException {

    /**
     * Creates a StockflowException with the specified message.
     *
     * @param message Description of the failure
     */
    public StockflowException(String message) {
        super(message);
    }

    /**
     * Creates a StockflowException with the specified message and cause.
     *
     * @param message Description of the failure
     * @param cause The underlying exception that caused the failure
     */
    public StockflowException(String message, Throwable cause) {
        super(message, cause);
    }
}
