package org.stockflow.runtime.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * The value of every stock at one round boundary. Independent of the state it was taken from.
 *
 * @param round  The round number; 0 is the initial state.
 * @param values Stock name to value, in model order.
 */
public record Snapshot(int round, Map<String, Double> values) {

    public Snapshot {
        values = Collections.unmodifiableMap(new LinkedHashMap<>(values));
    }

    /**
     * @throws IllegalArgumentException if the stock is not part of this snapshot.
     */
    public double value(String stock) {
        Double value = values.get(stock);
        if (value == null) {
            throw new IllegalArgumentException("No value for stock '" + stock + "' in round " + round);
        }
        return value;
    }
}
