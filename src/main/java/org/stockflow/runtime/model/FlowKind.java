package org.stockflow.runtime.model;

import java.util.Locale;
import java.util.Optional;

/**
 * The built-in kinds of flow.
 */
public enum FlowKind {
    /** Moves a fixed amount per round. */
    RATE("Rate"),
    /** Consumes source units and adds them to the destination scaled by a factor. */
    CONVERSION("Conversion"),
    /** Moves a fraction of the source per round. */
    LEAK("Leak");

    private final String label;

    FlowKind(String label) {
        this.label = label;
    }

    /**
     * @return the name of this kind as written in specs.
     */
    public String label() {
        return label;
    }

    /**
     * @return false for kinds whose transfer is proportional to the source, which therefore
     *         cannot drain an infinite stock.
     */
    public boolean acceptsInfiniteSource() {
        return this == RATE;
    }

    /**
     * Looks up a kind by its label, ignoring case.
     */
    public static Optional<FlowKind> fromLabel(String label) {
        String normalized = label.toLowerCase(Locale.ROOT);
        for (FlowKind kind : values()) {
            if (kind.label.toLowerCase(Locale.ROOT).equals(normalized)) {
                return Optional.of(kind);
            }
        }
        return Optional.empty();
    }
}
