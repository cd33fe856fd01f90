package org.stockflow.runtime.model;

import org.stockflow.compiler.diagnostics.CircularReferencesException;
import org.stockflow.compiler.diagnostics.ConflictingValuesException;
import org.stockflow.compiler.diagnostics.UnresolvedReferenceException;
import org.stockflow.compiler.frontend.semantics.DependencyResolver;
import org.stockflow.runtime.Simulation;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * An immutable set of stocks and the flows between them.
 *
 * <p>Stocks keep their declaration order, which is also the column order of rendered
 * results. Flows keep their declaration order and are applied in reverse each round.</p>
 *
 * <p>Once validated, a model can be run by any number of independent simulations, on any
 * number of threads.</p>
 */
public final class Model {

    private static final Logger LOG = LoggerFactory.getLogger(Model.class);

    private final List<Stock> stocks;
    private final List<Flow> flows;
    private final Map<String, Stock> stocksByName;
    private volatile List<String> initializationOrder;

    private Model(List<Stock> stocks, List<Flow> flows) {
        this.stocks = List.copyOf(stocks);
        this.flows = List.copyOf(flows);
        Map<String, Stock> byName = new LinkedHashMap<>();
        for (Stock stock : this.stocks) {
            byName.put(stock.getName(), stock);
        }
        this.stocksByName = Collections.unmodifiableMap(byName);
    }

    public static Builder builder() {
        return new Builder();
    }

    public List<Stock> stocks() {
        return stocks;
    }

    public List<Flow> flows() {
        return flows;
    }

    public Optional<Stock> getStock(String name) {
        return Optional.ofNullable(stocksByName.get(name));
    }

    /**
     * @return the stocks shown in rendered output, in model order.
     */
    public List<Stock> displayedStocks() {
        return stocks.stream().filter(Stock::isShown).collect(Collectors.toList());
    }

    /**
     * Checks that every formula references existing stocks and that initial values do not
     * reference each other in a cycle. Safe to call repeatedly.
     *
     * @throws UnresolvedReferenceException if a formula references an unknown stock.
     * @throws CircularReferencesException  if initial values form a cycle.
     */
    public void validate() {
        validateReferences();
        initializationOrder = resolveInitializationOrder();
        LOG.debug("Validated model with {} stock(s) and {} flow(s), initialization order {}",
                stocks.size(), flows.size(), initializationOrder);
    }

    /**
     * @return stocks whose initial value references other stocks, in the order they must be
     *         initialized. Validates the model on first use.
     */
    public List<String> initializationOrder() {
        List<String> order = initializationOrder;
        if (order == null) {
            validate();
            order = initializationOrder;
        }
        return order;
    }

    /**
     * Simulates the model from its initial state.
     *
     * @param rounds Number of rounds to advance.
     * @return {@code rounds + 1} snapshots, the first being the initial state.
     * @throws IllegalArgumentException if {@code rounds} is negative.
     */
    public List<Snapshot> run(int rounds) {
        return new Simulation(this).run(rounds);
    }

    private void validateReferences() {
        Set<String> names = stocksByName.keySet();
        for (Stock stock : stocks) {
            checkReferences(stock.getMaximum(), names);
            checkReferences(stock.getInitial(), names);
        }
        for (Flow flow : flows) {
            checkReferences(flow.getRule().formula(), names);
        }
    }

    private static void checkReferences(Formula formula, Set<String> names) {
        for (String reference : formula.references()) {
            if (!names.contains(reference)) {
                throw new UnresolvedReferenceException(formula, reference);
            }
        }
    }

    private List<String> resolveInitializationOrder() {
        Map<String, List<String>> outward = new LinkedHashMap<>();
        for (Stock stock : stocks) {
            outward.put(stock.getName(), stock.getInitial().references());
        }

        DependencyResolver.Resolution resolution = DependencyResolver.resolve(outward);
        if (resolution.hasCycle()) {
            throw new CircularReferencesException(resolution.residual(), outward);
        }
        return resolution.initializationOrder();
    }

    @Override
    public String toString() {
        return "Model(stocks=" + stocks + ", flows=" + flows + ")";
    }

    /**
     * Collects stocks and flows for a {@link Model}. Not thread-safe; single use.
     */
    public static final class Builder {

        private final List<Stock> stocks = new ArrayList<>();
        private final Map<String, Stock> stocksByName = new LinkedHashMap<>();
        private final List<Flow> flows = new ArrayList<>();
        private boolean built;

        private Builder() {
        }

        public Optional<Stock> getStock(String name) {
            return Optional.ofNullable(stocksByName.get(name));
        }

        /**
         * Declares a stock with default initial and maximum values.
         */
        public Stock declareStock(String name) {
            return declareStock(name, null, null);
        }

        /**
         * Declares a stock or redeclares an existing one.
         *
         * <p>A redeclaration may supply an initial or maximum value the stock still has at its
         * default. Supplying the value it already has is accepted. Supplying any other value
         * raises a conflict.</p>
         *
         * @param name    Stock name.
         * @param initial Initial value, or null for the default of 0.
         * @param maximum Maximum value, or null for the default of {@code inf}.
         * @return the declared stock.
         * @throws ConflictingValuesException if an existing non-default value differs.
         */
        public Stock declareStock(String name, Formula initial, Formula maximum) {
            ensureOpen();
            Formula defaultInitial = Stock.defaultInitial();
            Formula defaultMaximum = Stock.defaultMaximum();
            Formula declaredInitial = initial != null ? initial : defaultInitial;
            Formula declaredMaximum = maximum != null ? maximum : defaultMaximum;

            Stock existing = stocksByName.get(name);
            if (existing == null) {
                return add(new Stock(name, declaredInitial, declaredMaximum, true));
            }

            if (!declaredInitial.equals(defaultInitial) && !declaredInitial.equals(existing.getInitial())) {
                if (!existing.getInitial().equals(defaultInitial)) {
                    throw new ConflictingValuesException(name, existing.getInitial(), declaredInitial);
                }
                existing.setInitial(declaredInitial);
            }
            if (!declaredMaximum.equals(defaultMaximum) && !declaredMaximum.equals(existing.getMaximum())) {
                if (!existing.getMaximum().equals(defaultMaximum)) {
                    throw new ConflictingValuesException(name, existing.getMaximum(), declaredMaximum);
                }
                existing.setMaximum(declaredMaximum);
            }
            return existing;
        }

        /**
         * Declares a hidden stock holding positive infinity, or returns the stock already
         * declared under that name.
         */
        public Stock declareInfiniteStock(String name) {
            ensureOpen();
            Stock existing = stocksByName.get(name);
            if (existing != null) {
                return existing;
            }
            return add(new Stock(name, Formula.of(Double.POSITIVE_INFINITY), Stock.defaultMaximum(), false));
        }

        /**
         * Adds a flow between two declared stocks.
         *
         * @throws org.stockflow.compiler.diagnostics.IllegalSourceStockException
         *         if the rule cannot draw from the source.
         */
        public Flow flow(Stock source, Stock destination, RateRule rule) {
            ensureOpen();
            Flow flow = new Flow(source, destination, rule);
            flows.add(flow);
            return flow;
        }

        public Model build() {
            ensureOpen();
            built = true;
            return new Model(stocks, flows);
        }

        private Stock add(Stock stock) {
            stocks.add(stock);
            stocksByName.put(stock.getName(), stock);
            return stock;
        }

        private void ensureOpen() {
            if (built) {
                throw new IllegalStateException("Builder has already built its model");
            }
        }
    }
}
