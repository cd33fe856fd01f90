package org.stockflow.compiler.frontend.lexer;

import java.util.List;

/**
 * A comma-separated parameter list; each parameter is a formula.
 *
 * @param formulas The parameters in order.
 */
public record Parameters(List<FormulaToken> formulas) {

    /** The parameter list of a bare stock or flow name. */
    public static final Parameters NONE = new Parameters(List.of());

    public Parameters {
        formulas = List.copyOf(formulas);
    }

    public boolean isEmpty() {
        return formulas.isEmpty();
    }

    public int size() {
        return formulas.size();
    }

    public FormulaToken get(int index) {
        return formulas.get(index);
    }
}
