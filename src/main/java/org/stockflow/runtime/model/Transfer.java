package org.stockflow.runtime.model;

/**
 * The effect of one flow in one round.
 *
 * @param removed Amount taken from the source.
 * @param added   Amount given to the destination. Differs from {@code removed} for
 *                conversions.
 */
public record Transfer(double removed, double added) {

    public static final Transfer NONE = new Transfer(0, 0);

    public static Transfer of(double amount) {
        return new Transfer(amount, amount);
    }
}
