package org.stockflow.compiler.frontend.lexer;

import org.stockflow.compiler.diagnostics.InvalidParametersException;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Lexes formula expressions and parameter lists into {@link FormulaToken}s.
 *
 * <p>A formula is a flat sequence of operands separated by the operators {@code + - * /}.
 * Parentheses open a nested group, which becomes a nested {@link FormulaToken}. No
 * precedence is encoded here; evaluation is strictly left to right.</p>
 */
public final class FormulaLexer {

    /** The literal for positive infinity. */
    public static final String INFINITY = "inf";

    static final char START_PAREN = '(';
    static final char END_PAREN = ')';
    static final char PARAMETER_SEPARATOR = ',';

    private static final Pattern WHOLE = Pattern.compile("^-?[0-9]+$");
    private static final Pattern DECIMAL = Pattern.compile("^[0-9]+\\.[0-9]+$");

    private FormulaLexer() {}

    /**
     * Classifies a single operand, trying in order: the infinity keyword, an integer, a
     * decimal, and finally a stock reference.
     *
     * @param text The operand text.
     * @return The classified operand.
     */
    public static ValueTerm lexValue(String text) {
        String value = text.trim();
        if (INFINITY.equals(value)) {
            return new ValueTerm(ValueKind.INFINITY, value);
        } else if (WHOLE.matcher(value).matches()) {
            return new ValueTerm(ValueKind.WHOLE, value);
        } else if (DECIMAL.matcher(value).matches()) {
            return new ValueTerm(ValueKind.DECIMAL, value);
        }
        return new ValueTerm(ValueKind.REFERENCE, value);
    }

    /**
     * Lexes a formula expression.
     *
     * @param text The expression, e.g. {@code (Developers - Incidents) * 2}.
     * @return The lexed formula. It is not validated here.
     * @throws InvalidParametersException if the parentheses are unbalanced.
     */
    public static FormulaToken lexFormula(String text) {
        Deque<List<FormulaTerm>> groups = new ArrayDeque<>();
        List<FormulaTerm> terms = new ArrayList<>();
        StringBuilder literal = new StringBuilder();

        String input = text.trim() + '\n';
        for (int i = 0; i < input.length(); i++) {
            char c = input.charAt(i);
            Optional<Operator> operator = Operator.fromSymbol(c);
            if (c == START_PAREN) {
                closeLiteral(literal, terms);
                groups.push(terms);
                terms = new ArrayList<>();
            } else if (c == END_PAREN) {
                closeLiteral(literal, terms);
                if (groups.isEmpty()) {
                    throw new InvalidParametersException(text);
                }
                List<FormulaTerm> enclosing = groups.pop();
                enclosing.add(new FormulaToken(terms));
                terms = enclosing;
            } else if (Character.isWhitespace(c)) {
                closeLiteral(literal, terms);
            } else if (operator.isPresent()) {
                closeLiteral(literal, terms);
                terms.add(new OperatorTerm(operator.get()));
            } else {
                literal.append(c);
            }
        }

        if (!groups.isEmpty()) {
            throw new InvalidParametersException(text);
        }
        return new FormulaToken(terms);
    }

    /**
     * Lexes a parameter list.
     *
     * @param text Either the empty string or a parenthesized, comma-separated list.
     * @return The parameters; empty for the empty string.
     * @throws InvalidParametersException if the text is not wrapped in parentheses.
     */
    public static Parameters lexParameters(String text) {
        if (text.isEmpty()) {
            return Parameters.NONE;
        }
        if (text.charAt(0) != START_PAREN || text.charAt(text.length() - 1) != END_PAREN || text.length() < 2) {
            throw new InvalidParametersException(text);
        }
        String inner = text.substring(1, text.length() - 1);
        List<FormulaToken> formulas = new ArrayList<>();
        for (String param : inner.split(String.valueOf(PARAMETER_SEPARATOR), -1)) {
            formulas.add(lexFormula(param));
        }
        return new Parameters(formulas);
    }

    private static void closeLiteral(StringBuilder literal, List<FormulaTerm> terms) {
        if (literal.length() > 0) {
            terms.add(lexValue(literal.toString()));
            literal.setLength(0);
        }
    }
}
