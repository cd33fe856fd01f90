package org.stockflow.cli.rendering;

import org.stockflow.runtime.model.Model;
import org.stockflow.runtime.model.Snapshot;

import java.util.List;

/**
 * Turns the snapshots of a simulation run into text.
 */
public interface ResultRenderer {

    /**
     * @param model     The simulated model. Only its displayed stocks are rendered.
     * @param snapshots The snapshots, one per round.
     * @return the rendered text, without a trailing newline.
     */
    String render(Model model, List<Snapshot> snapshots);
}
