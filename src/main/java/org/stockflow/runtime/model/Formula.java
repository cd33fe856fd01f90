package org.stockflow.runtime.model;

import org.stockflow.compiler.diagnostics.InvalidFormulaException;
import org.stockflow.compiler.frontend.lexer.FormulaLexer;
import org.stockflow.compiler.frontend.lexer.FormulaTerm;
import org.stockflow.compiler.frontend.lexer.FormulaToken;
import org.stockflow.compiler.frontend.lexer.OperatorTerm;
import org.stockflow.compiler.frontend.lexer.Operator;
import org.stockflow.compiler.frontend.lexer.TokenPrinter;
import org.stockflow.compiler.frontend.lexer.ValueTerm;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * An arithmetic expression over numeric literals, {@code inf} and stock references.
 *
 * <p>Formulas are evaluated strictly left to right with no operator precedence:
 * {@code 10 + 5 * 2} is {@code 30}. Arithmetic follows IEEE-754 double semantics, so
 * division by zero yields infinity. A reference that is missing from the environment
 * evaluates to {@code NaN}, which then propagates; model validation rejects such
 * references before a simulation starts.</p>
 *
 * <p>A formula is validated when constructed. Parenthesized groups are validated when they
 * are first evaluated.</p>
 */
public final class Formula {

    private final FormulaToken lexed;
    private final double defaultValue;

    /**
     * Lexes and validates a formula with a default value of 0.
     */
    public Formula(String definition) {
        this(FormulaLexer.lexFormula(definition), 0);
    }

    public Formula(FormulaToken lexed) {
        this(lexed, 0);
    }

    /**
     * @param lexed        The lexed expression.
     * @param defaultValue The value of an empty expression.
     * @throws InvalidFormulaException if the expression is malformed.
     */
    public Formula(FormulaToken lexed, double defaultValue) {
        this.lexed = Objects.requireNonNull(lexed, "lexed");
        this.defaultValue = defaultValue;
        validate();
    }

    /**
     * Creates a formula holding a single number, written out in plain digits. Positive
     * infinity becomes the {@code inf} literal and negative fractions become {@code 0 - x}.
     *
     * @throws IllegalArgumentException if the value is NaN or negative infinity.
     */
    public static Formula of(double value) {
        if (value == Double.POSITIVE_INFINITY) {
            return new Formula(FormulaLexer.INFINITY);
        }
        if (Double.isNaN(value) || Double.isInfinite(value)) {
            throw new IllegalArgumentException("Cannot write " + value + " as a formula");
        }
        String digits = BigDecimal.valueOf(Math.abs(value)).stripTrailingZeros().toPlainString();
        if (value >= 0) {
            return new Formula(digits);
        }
        return digits.indexOf('.') >= 0 ? new Formula("0 - " + digits) : new Formula("-" + digits);
    }

    /**
     * Checks that the formula is non-empty, neither starts nor ends with an operator, and
     * alternates strictly between operands and operators.
     */
    public void validate() {
        List<FormulaTerm> terms = lexed.terms();
        if (terms.isEmpty()) {
            throw new InvalidFormulaException(this, "formula is empty. must specify a number or a reference");
        }

        FormulaTerm previous = null;
        for (FormulaTerm term : terms) {
            if (term.isOperator()) {
                if (previous == null) {
                    throw new InvalidFormulaException(this, "can't start with an operation");
                } else if (previous.isOperator()) {
                    throw new InvalidFormulaException(this, "operation can't be preceded by an operation");
                }
            } else if (previous != null && !previous.isOperator()) {
                throw new InvalidFormulaException(this, "must have an operation between values or references");
            }
            previous = term;
        }
        if (previous.isOperator()) {
            throw new InvalidFormulaException(this, "formula cannot end with an operation");
        }
    }

    /**
     * Returns the names of all stocks referenced by this formula, in order of appearance
     * and with duplicates, including references inside parenthesized groups.
     */
    public List<String> references() {
        List<String> references = new ArrayList<>();
        collectReferences(lexed, references);
        return references;
    }

    private static void collectReferences(FormulaToken formula, List<String> into) {
        for (FormulaTerm term : formula.terms()) {
            if (term instanceof ValueTerm value && value.isReference()) {
                into.add(value.text());
            } else if (term instanceof FormulaToken group) {
                collectReferences(group, into);
            }
        }
    }

    /**
     * Evaluates the formula without any stock values.
     */
    public double compute() {
        return compute(Map.of());
    }

    /**
     * Evaluates the formula against the given stock values.
     *
     * @param environment Stock name to current value.
     * @return The value, or the default value if the expression is empty.
     */
    public double compute(Map<String, Double> environment) {
        Double accumulator = null;
        Operator pending = null;

        for (FormulaTerm term : lexed.terms()) {
            if (term instanceof OperatorTerm op) {
                pending = op.operator();
                continue;
            }
            double value = operand(term, environment);
            if (accumulator == null) {
                accumulator = value;
            } else if (pending != null) {
                accumulator = pending.apply(accumulator, value);
            }
        }

        return accumulator != null ? accumulator : defaultValue;
    }

    private static double operand(FormulaTerm term, Map<String, Double> environment) {
        if (term instanceof ValueTerm value) {
            switch (value.kind()) {
                case WHOLE:
                case DECIMAL:
                    return Double.parseDouble(value.text());
                case INFINITY:
                    return Double.POSITIVE_INFINITY;
                case REFERENCE:
                    Double resolved = environment.get(value.text());
                    return resolved != null ? resolved : Double.NaN;
                default:
                    throw new IllegalStateException("Unhandled value kind: " + value.kind());
            }
        } else if (term instanceof FormulaToken group) {
            return new Formula(group).compute(environment);
        }
        throw new IllegalStateException("Unexpected operand: " + term);
    }

    public FormulaToken getLexed() {
        return lexed;
    }

    public double getDefaultValue() {
        return defaultValue;
    }

    /**
     * @return the expression in model syntax, without the {@code F(...)} wrapper.
     */
    public String expression() {
        return TokenPrinter.readable(lexed);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Formula other)) return false;
        return lexed.equals(other.lexed);
    }

    @Override
    public int hashCode() {
        return lexed.hashCode();
    }

    @Override
    public String toString() {
        return "F(" + expression() + ")";
    }
}
