package org.stockflow.runtime;

import org.stockflow.runtime.model.Model;
import org.stockflow.runtime.model.Snapshot;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Runs a model round by round from its initial state.
 */
public class Simulation {

    private static final Logger LOG = LoggerFactory.getLogger(Simulation.class);

    private final Model model;
    private final SimulationState state;
    private int currentRound = 0;

    /**
     * Validates the model and computes its initial state.
     *
     * @param model The model to simulate.
     * @throws org.stockflow.compiler.diagnostics.IllegalModelException if the model is invalid.
     */
    public Simulation(Model model) {
        this.model = model;
        model.validate();
        this.state = new SimulationState(model);
    }

    /**
     * Advances one round.
     *
     * @return the state after the round.
     */
    public Snapshot step() {
        state.advance();
        currentRound++;
        LOG.debug("Round {}: {}", currentRound, state.values());
        return state.snapshot(currentRound);
    }

    /**
     * Records the current state, then advances the given number of rounds.
     *
     * @param rounds Number of rounds to advance.
     * @return {@code rounds + 1} snapshots starting with the current state.
     * @throws IllegalArgumentException if {@code rounds} is negative.
     */
    public List<Snapshot> run(int rounds) {
        if (rounds < 0) {
            throw new IllegalArgumentException("rounds must not be negative: " + rounds);
        }
        List<Snapshot> snapshots = new ArrayList<>(rounds + 1);
        snapshots.add(state.snapshot(currentRound));
        for (int i = 0; i < rounds; i++) {
            snapshots.add(step());
        }
        LOG.debug("Simulated {} round(s) over {} stock(s)", rounds, model.stocks().size());
        return snapshots;
    }

    public int getCurrentRound() {
        return currentRound;
    }

    public SimulationState getState() {
        return state;
    }
}
