package org.stockflow.compiler.diagnostics;

/**
 * Thrown when a stock is declared again with an initial or maximum value that differs
 * from a non-default value it already has.
 */
public class ConflictingValuesException extends LineAwareException {

    private final String stockName;
    private final String first;
    private final String second;

    /**
     * @param stockName The redeclared stock.
     * @param first     The value the stock already has.
     * @param second    The conflicting value of the new declaration.
     */
    public ConflictingValuesException(String stockName, Object first, Object second) {
        super("'" + stockName + "' initialized with conflicting value " + second + " (was " + first + ")");
        this.stockName = stockName;
        this.first = String.valueOf(first);
        this.second = String.valueOf(second);
    }

    public String getStockName() {
        return stockName;
    }

    @Override
    protected String describe() {
        return "'" + stockName + "' initialized with conflicting value " + second + " (was " + first + ")";
    }

    @Override
    protected String describe(String line, int lineNumber) {
        return "line " + lineNumber + " initializes " + stockName + " with conflicting value " + second
                + " (was " + first + "): \"" + line + "\"";
    }
}
