package org.stockflow.compiler.diagnostics;

/**
 * Wraps any other failure that occurred while processing a single line, together with
 * that line's text and number.
 */
public class LineParseException extends ParseException {

    private final String line;
    private final int lineNumber;

    public LineParseException(String line, int lineNumber, Throwable cause) {
        super(buildMessage(line, lineNumber, cause), cause);
        this.line = line;
        this.lineNumber = lineNumber;
    }

    private static String buildMessage(String line, int lineNumber, Throwable cause) {
        String message = "line " + lineNumber + " could not be parsed: \"" + line + "\"";
        if (cause != null) {
            message += "\n" + cause.getMessage();
        }
        return message;
    }

    public String getLine() {
        return line;
    }

    public int getLineNumber() {
        return lineNumber;
    }
}
