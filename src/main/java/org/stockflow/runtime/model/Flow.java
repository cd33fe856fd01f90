package org.stockflow.runtime.model;

import java.util.Map;
import java.util.Objects;

/**
 * A directed transfer between two stocks, governed by a {@link RateRule}.
 */
public final class Flow {

    private final Stock source;
    private final Stock destination;
    private final RateRule rule;

    /**
     * @throws org.stockflow.compiler.diagnostics.IllegalSourceStockException
     *         if the rule cannot draw from the source.
     */
    public Flow(Stock source, Stock destination, RateRule rule) {
        this.source = Objects.requireNonNull(source, "source");
        this.destination = Objects.requireNonNull(destination, "destination");
        this.rule = Objects.requireNonNull(rule, "rule");
        rule.validateSource(source);
    }

    /**
     * Computes this flow's transfer for the current round with nothing else bound for the
     * destination.
     */
    public Transfer change(Map<String, Double> environment, double sourceValue, double destinationValue) {
        return change(environment, sourceValue, destinationValue, 0);
    }

    /**
     * Computes this flow's transfer for the current round. The destination's room is its
     * maximum minus its current value and the additions already bound for it this round, or
     * the bare maximum if the destination is infinite.
     *
     * @param environment      Current stock values.
     * @param sourceValue      Current value of the source.
     * @param destinationValue Current value of the destination.
     * @param pendingAddition  Amount other flows will add to the destination at the end of the round.
     */
    public Transfer change(Map<String, Double> environment, double sourceValue, double destinationValue,
                           double pendingAddition) {
        double maximum = destination.getMaximum().compute(environment);
        double capacity = destinationValue != Double.POSITIVE_INFINITY
                ? maximum - (destinationValue + pendingAddition)
                : maximum;
        return rule.calculate(environment, sourceValue, destinationValue, capacity);
    }

    public Stock getSource() {
        return source;
    }

    public Stock getDestination() {
        return destination;
    }

    public RateRule getRule() {
        return rule;
    }

    @Override
    public String toString() {
        return "Flow(" + source + " to " + destination + " at " + rule + ")";
    }
}
