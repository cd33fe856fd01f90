package org.stockflow.compiler.diagnostics;

/**
 * Base class for parse errors that are raised before the enclosing line is known.
 * <p>
 * The scanner and the model parser catch these at the line boundary and annotate them in
 * place with {@link #attachLine(String, int)} instead of wrapping them, so the message a
 * user sees names the offending line. The line context is filled in at most once.
 */
public abstract class LineAwareException extends ParseException {

    private String line = "";
    private int lineNumber;

    protected LineAwareException(String message) {
        super(message);
    }

    /**
     * Records the line this error belongs to. Has no effect if a line is already attached.
     *
     * @param line       The text of the line.
     * @param lineNumber The 1-based line number.
     * @return this exception, for rethrowing.
     */
    public LineAwareException attachLine(String line, int lineNumber) {
        if (!hasLine()) {
            this.line = line == null ? "" : line;
            this.lineNumber = lineNumber;
        }
        return this;
    }

    public boolean hasLine() {
        return lineNumber > 0;
    }

    public String getLine() {
        return line;
    }

    public int getLineNumber() {
        return lineNumber;
    }

    /**
     * Describes the error without line context.
     */
    protected abstract String describe();

    /**
     * Describes the error for the given line.
     */
    protected abstract String describe(String line, int lineNumber);

    @Override
    public String getMessage() {
        return hasLine() ? describe(line, lineNumber) : describe();
    }
}
