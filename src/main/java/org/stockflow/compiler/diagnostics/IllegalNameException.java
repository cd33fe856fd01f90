package org.stockflow.compiler.diagnostics;

/**
 * Thrown when a stock or flow label does not match the identifier grammar.
 */
public class IllegalNameException extends ParseException {

    private final String name;
    private final String allowedPattern;

    /**
     * @param name           The offending text.
     * @param allowedPattern The regular expression legal names must match.
     */
    public IllegalNameException(String name, String allowedPattern) {
        super("name '" + name + "' is not a legal stock name, must be of format " + allowedPattern);
        this.name = name;
        this.allowedPattern = allowedPattern;
    }

    public String getName() {
        return name;
    }

    public String getAllowedPattern() {
        return allowedPattern;
    }
}
