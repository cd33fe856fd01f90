package org.stockflow.runtime;

import org.stockflow.runtime.model.Flow;
import org.stockflow.runtime.model.Model;
import org.stockflow.runtime.model.Snapshot;
import org.stockflow.runtime.model.Stock;
import org.stockflow.runtime.model.Transfer;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * The current value of every stock in a model.
 *
 * <p>Each state owns its value map. Several states may run the same validated model at once.</p>
 */
public final class SimulationState {

    private final Model model;
    private final Map<String, Double> values = new LinkedHashMap<>();

    /**
     * Computes initial values. Stocks whose initial value references nothing are initialized
     * first, in model order, followed by the remaining stocks in initialization order.
     *
     * @param model A validated model.
     */
    public SimulationState(Model model) {
        this.model = model;
        List<String> order = model.initializationOrder();

        for (Stock stock : model.stocks()) {
            if (!order.contains(stock.getName())) {
                values.put(stock.getName(), stock.getInitial().compute(values));
            }
        }
        for (String name : order) {
            model.getStock(name).ifPresent(stock -> values.put(name, stock.getInitial().compute(values)));
        }
    }

    /**
     * Advances one round. Flows are applied from last to first; each flow sees the removals
     * made by flows applied before it, while all additions are deferred to the end of the round.
     * Deferred additions count against the destination's maximum.
     */
    public void advance() {
        List<Flow> flows = model.flows();
        Map<String, Double> pending = new LinkedHashMap<>();

        for (int i = flows.size() - 1; i >= 0; i--) {
            Flow flow = flows.get(i);
            String source = flow.getSource().getName();
            String destination = flow.getDestination().getName();
            Transfer transfer = flow.change(values, values.get(source), values.get(destination),
                    pending.getOrDefault(destination, 0.0));
            values.put(source, values.get(source) - transfer.removed());
            pending.merge(destination, transfer.added(), Double::sum);
        }

        pending.forEach((destination, added) -> values.merge(destination, added, Double::sum));
    }

    public double value(String stock) {
        Double value = values.get(stock);
        if (value == null) {
            throw new IllegalArgumentException("Unknown stock '" + stock + "'");
        }
        return value;
    }

    /**
     * @return a read-only view of the live values.
     */
    public Map<String, Double> values() {
        return Collections.unmodifiableMap(values);
    }

    /**
     * Copies the current values.
     */
    public Snapshot snapshot(int round) {
        return new Snapshot(round, values);
    }
}
