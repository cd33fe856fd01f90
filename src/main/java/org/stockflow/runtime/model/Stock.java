package org.stockflow.runtime.model;

import java.util.Objects;

/**
 * A named numeric container.
 *
 * <p>The initial and maximum formulas can only be changed by {@link Model.Builder} while the
 * model is under construction, and only from their default to a declared value.</p>
 */
public final class Stock {

    /** The maximum of a stock without a declared maximum. */
    public static final double DEFAULT_MAXIMUM = Double.POSITIVE_INFINITY;

    private final String name;
    private Formula initial;
    private Formula maximum;
    private final boolean shown;

    Stock(String name, Formula initial, Formula maximum, boolean shown) {
        this.name = Objects.requireNonNull(name, "name");
        this.initial = Objects.requireNonNull(initial, "initial");
        this.maximum = Objects.requireNonNull(maximum, "maximum");
        this.shown = shown;
    }

    static Formula defaultInitial() {
        return Formula.of(0);
    }

    static Formula defaultMaximum() {
        return Formula.of(DEFAULT_MAXIMUM);
    }

    public String getName() {
        return name;
    }

    public Formula getInitial() {
        return initial;
    }

    public Formula getMaximum() {
        return maximum;
    }

    /**
     * @return false for stocks that are hidden from rendered output, i.e. infinite stocks.
     */
    public boolean isShown() {
        return shown;
    }

    /**
     * @return true if the stock's initial value is positive infinity.
     */
    public boolean isInfinite() {
        return initial.compute() == Double.POSITIVE_INFINITY;
    }

    void setInitial(Formula initial) {
        this.initial = initial;
    }

    void setMaximum(Formula maximum) {
        this.maximum = maximum;
    }

    @Override
    public String toString() {
        return "Stock(" + name + ")";
    }
}
