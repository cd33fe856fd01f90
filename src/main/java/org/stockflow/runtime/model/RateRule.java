package org.stockflow.runtime.model;

import org.stockflow.compiler.diagnostics.IllegalSourceStockException;

import java.util.Map;
import java.util.Objects;

/**
 * How much a flow moves per round.
 *
 * @param kind    The flow kind; selects the calculation.
 * @param formula The rate, conversion factor or leak fraction.
 */
public record RateRule(FlowKind kind, Formula formula) {

    public RateRule {
        Objects.requireNonNull(kind, "kind");
        Objects.requireNonNull(formula, "formula");
    }

    public static RateRule rate(Formula formula) {
        return new RateRule(FlowKind.RATE, formula);
    }

    public static RateRule conversion(Formula formula) {
        return new RateRule(FlowKind.CONVERSION, formula);
    }

    public static RateRule leak(Formula formula) {
        return new RateRule(FlowKind.LEAK, formula);
    }

    /**
     * Rejects sources this rule cannot draw from.
     *
     * @throws IllegalSourceStockException if the source is infinite and the rule is
     *                                     proportional to the source.
     */
    public void validateSource(Stock source) {
        if (!kind.acceptsInfiniteSource() && source.isInfinite()) {
            throw new IllegalSourceStockException(this, source.getName());
        }
    }

    /**
     * Computes this round's transfer.
     *
     * @param environment Current stock values.
     * @param source      Current value of the source stock.
     * @param destination Current value of the destination stock.
     * @param capacity    Room left in the destination.
     * @return Amounts to remove from the source and add to the destination.
     */
    public Transfer calculate(Map<String, Double> environment, double source, double destination, double capacity) {
        double evaluated = formula.compute(environment);
        return switch (kind) {
            case RATE -> rate(evaluated, source, capacity);
            case CONVERSION -> conversion(evaluated, source, destination, capacity);
            case LEAK -> leak(evaluated, source, capacity);
        };
    }

    private static Transfer rate(double rate, double source, double capacity) {
        if (source <= 0) {
            return Transfer.NONE;
        }
        double change = source - rate >= 0 ? rate : source;
        change = Math.max(0, Math.min(capacity, change));
        return Transfer.of(change);
    }

    private static Transfer conversion(double factor, double source, double destination, double capacity) {
        if (source <= 0) {
            return Transfer.NONE;
        }
        double convertible;
        if (destination == Double.POSITIVE_INFINITY || capacity == Double.POSITIVE_INFINITY) {
            convertible = source;
        } else {
            convertible = Math.min(source, Math.max(0, Math.floor((capacity - destination) / factor)));
        }
        double change = Math.floor(convertible * factor);
        if (change == 0 || Double.isNaN(change)) {
            return Transfer.NONE;
        }
        return new Transfer(convertible, change);
    }

    private static Transfer leak(double fraction, double source, double capacity) {
        if (source <= 0) {
            return Transfer.NONE;
        }
        double change = Math.floor(source * fraction);
        if (!Double.isNaN(capacity)) {
            change = Math.min(capacity, change);
        }
        change = Math.min(source, Math.max(0, change));
        return Transfer.of(change);
    }

    @Override
    public String toString() {
        return kind.label() + "(" + formula + ")";
    }
}
