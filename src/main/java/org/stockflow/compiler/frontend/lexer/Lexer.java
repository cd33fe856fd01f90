package org.stockflow.compiler.frontend.lexer;

import org.stockflow.compiler.diagnostics.IllegalNameException;
import org.stockflow.compiler.diagnostics.LineAwareException;
import org.stockflow.compiler.diagnostics.LineParseException;
import org.stockflow.compiler.diagnostics.ParseException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Scans a stock-and-flow spec into a {@link SourceLines} token tree, one line at a time.
 *
 * <p>Each line starts out expecting a stock. {@code >} closes the buffered text as a stock
 * and keeps expecting a stock (the destination); {@code @} closes it as a stock and switches
 * to expecting a flow for the rest of the line. A {@code #} turns the remainder of the line
 * into a comment, flushing any buffered content first. Whitespace and {@code >} never enter
 * the buffer.</p>
 *
 * <p>An error on one line carries that line's number and text. A buffer left over at the
 * end of a line is an internal inconsistency and aborts the whole scan.</p>
 */
public final class Lexer {

    private static final Logger LOG = LoggerFactory.getLogger(Lexer.class);

    /** Legal stock and flow names: a letter followed by letters, digits or underscores. */
    public static final Pattern LEGAL_NAME = Pattern.compile("^[a-zA-Z][a-zA-Z0-9_]*");

    static final char NEWLINE = '\n';
    static final char WHITESPACE = ' ';
    static final char START_INFINITE_STOCK = '[';
    static final char END_INFINITE_STOCK = ']';
    static final char FLOW_DIRECTION = '>';
    static final char FLOW_DELIMITER = '@';
    static final char COMMENT = '#';

    private enum Mode {
        STOCK,
        FLOW,
        COMMENT
    }

    private final String text;
    private final String[] rawLines;

    private final List<Line> lines = new ArrayList<>();
    private List<LineToken> current = new ArrayList<>();
    private final StringBuilder buffer = new StringBuilder();
    private Mode mode = Mode.STOCK;
    private int lineNumber;

    /**
     * @param text The spec to scan.
     */
    public Lexer(String text) {
        this.text = text;
        this.rawLines = text.split("\n", -1);
    }

    /**
     * Convenience for {@code new Lexer(text).scan()}.
     */
    public static SourceLines lex(String text) {
        return new Lexer(text).scan();
    }

    /**
     * Scans the whole text.
     *
     * @return The non-empty lines with their tokens.
     * @throws ParseException        if a line contains an illegal stock, flow or parameter list.
     * @throws IllegalStateException if unconsumed characters remain at a line boundary.
     */
    public SourceLines scan() {
        // Leading space and trailing newline remove the start and end of input edge cases.
        String input = WHITESPACE + text + NEWLINE;
        resetBuffer();

        for (int i = 1; i < input.length(); i++) {
            char c = input.charAt(i);

            if (c == COMMENT && current.isEmpty() && !hasContent() && mode != Mode.COMMENT) {
                mode = Mode.COMMENT;
                continue;
            } else if (mode == Mode.COMMENT) {
                if (c == NEWLINE) {
                    current.add(new CommentToken(buffer.substring(1)));
                    resetBuffer();
                }
            } else if (mode == Mode.STOCK) {
                if (c == COMMENT) {
                    flushIfContent();
                    mode = Mode.COMMENT;
                    continue;
                }
                if (c == FLOW_DIRECTION) {
                    current.add(classify(Mode.STOCK));
                    current.add(new FlowDirectionToken());
                    resetBuffer();
                    continue;
                }
                if (c == FLOW_DELIMITER) {
                    current.add(classify(Mode.STOCK));
                    current.add(new FlowDelimiterToken());
                    resetBuffer();
                    mode = Mode.FLOW;
                    continue;
                }
                if (c == NEWLINE) {
                    flushIfContent();
                }
            } else if (mode == Mode.FLOW) {
                if (c == COMMENT) {
                    flushIfContent();
                    mode = Mode.COMMENT;
                    continue;
                }
                if (c == NEWLINE) {
                    flushIfContent();
                }
            }

            if (c == NEWLINE) {
                endLine();
            } else if ((isWhitespace(c) || c == FLOW_DIRECTION) && mode != Mode.COMMENT) {
                continue;
            } else {
                buffer.append(c);
            }
        }

        LOG.debug("Scanned {} non-empty line(s)", lines.size());
        return new SourceLines(lines);
    }

    /**
     * Lexes a stock: either {@code [Name]} for an infinite stock, or a name with an optional
     * parameter list of initial and maximum value.
     *
     * @param text The stock text.
     * @return The stock token.
     * @throws IllegalNameException if the name or the text after it is malformed.
     */
    public static StockToken lexStock(String text) {
        String stock = text.trim();
        if (stock.length() >= 2
                && stock.charAt(0) == START_INFINITE_STOCK
                && stock.charAt(stock.length() - 1) == END_INFINITE_STOCK) {
            String name = stock.substring(1, stock.length() - 1);
            if (!LEGAL_NAME.matcher(name).matches()) {
                throw new IllegalNameException(name, LEGAL_NAME.pattern());
            }
            return new StockToken(name, Parameters.NONE, true);
        }
        Matcher matcher = LEGAL_NAME.matcher(stock);
        if (!matcher.lookingAt()) {
            throw new IllegalNameException(stock, LEGAL_NAME.pattern());
        }
        String name = matcher.group();
        return new StockToken(name, lexCallerParameters(stock, name), false);
    }

    /**
     * Lexes the rate part of a flow. Text that starts with a name directly followed by a
     * parameter list is a labeled flow such as {@code Leak(0.1)}; any other text is the
     * single parameter of an unlabeled flow.
     *
     * @param text The text after the {@code @}.
     * @return The flow token.
     */
    public static FlowToken lexFlow(String text) {
        String flow = text.trim();
        Matcher matcher = LEGAL_NAME.matcher(flow);
        if (matcher.lookingAt()
                && flow.startsWith(String.valueOf(FormulaLexer.START_PAREN), matcher.end())
                && flow.charAt(flow.length() - 1) == FormulaLexer.END_PAREN) {
            String label = matcher.group();
            return new FlowToken(label, lexCallerParameters(flow, label));
        }
        return new FlowToken("", FormulaLexer.lexParameters(FormulaLexer.START_PAREN + flow + FormulaLexer.END_PAREN));
    }

    private static Parameters lexCallerParameters(String text, String name) {
        String rest = text.substring(name.length());
        if (!rest.isEmpty()
                && !(rest.charAt(0) == FormulaLexer.START_PAREN && rest.charAt(rest.length() - 1) == FormulaLexer.END_PAREN)) {
            throw new IllegalNameException(text, LEGAL_NAME.pattern());
        }
        return FormulaLexer.lexParameters(rest);
    }

    private void flushIfContent() {
        if (hasContent()) {
            current.add(classify(mode));
        }
        resetBuffer();
    }

    private LineToken classify(Mode as) {
        int number = lineNumber + 1;
        String content = buffer.toString();
        try {
            return as == Mode.FLOW ? lexFlow(content) : lexStock(content);
        } catch (LineAwareException e) {
            throw e.attachLine(rawLine(number), number);
        } catch (ParseException e) {
            throw new LineParseException(rawLine(number), number, e);
        }
    }

    private void endLine() {
        lineNumber++;
        if (hasContent()) {
            throw new IllegalStateException("unused buffer at end of line " + lineNumber + ": " + buffer);
        }
        if (!current.isEmpty()) {
            lines.add(new Line(lineNumber, current));
        }
        current = new ArrayList<>();
        mode = Mode.STOCK;
        resetBuffer();
    }

    private boolean hasContent() {
        return buffer.length() > 1;
    }

    private void resetBuffer() {
        buffer.setLength(0);
        buffer.append(WHITESPACE);
    }

    private String rawLine(int number) {
        if (number < 1 || number > rawLines.length) {
            return "";
        }
        return rawLines[number - 1].strip();
    }

    private static boolean isWhitespace(char c) {
        return c == WHITESPACE || c == '\t' || c == '\r';
    }
}
