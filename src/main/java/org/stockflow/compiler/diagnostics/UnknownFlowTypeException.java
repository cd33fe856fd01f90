package org.stockflow.compiler.diagnostics;

/**
 * Thrown when a labeled flow names something other than {@code Rate}, {@code Conversion}
 * or {@code Leak}.
 */
public class UnknownFlowTypeException extends LineAwareException {

    private final String flowType;

    public UnknownFlowTypeException(String flowType) {
        super("invalid flow type \"" + flowType + "\"");
        this.flowType = flowType;
    }

    public String getFlowType() {
        return flowType;
    }

    @Override
    protected String describe() {
        return "invalid flow type \"" + flowType + "\"";
    }

    @Override
    protected String describe(String line, int lineNumber) {
        return "line " + lineNumber + " has invalid flow type \"" + flowType + "\": \"" + line + "\"";
    }
}
