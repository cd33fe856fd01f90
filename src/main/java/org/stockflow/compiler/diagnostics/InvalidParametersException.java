package org.stockflow.compiler.diagnostics;

/**
 * Thrown when a parameter list or a parenthesized formula group is not properly
 * parenthesized.
 */
public class InvalidParametersException extends LineAwareException {

    private final String text;

    public InvalidParametersException(String text) {
        super("invalid parameters '" + text + "'");
        this.text = text;
    }

    public String getText() {
        return text;
    }

    @Override
    protected String describe() {
        return "invalid parameters '" + text + "'";
    }

    @Override
    protected String describe(String line, int lineNumber) {
        return "line " + lineNumber + " specifies invalid parameters '" + text + "': \"" + line + "\"";
    }
}
