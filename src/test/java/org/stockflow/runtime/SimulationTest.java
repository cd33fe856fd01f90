package org.stockflow.runtime;

import org.stockflow.compiler.frontend.parser.ModelParser;
import org.stockflow.compiler.diagnostics.CircularReferencesException;
import org.stockflow.runtime.model.Model;
import org.stockflow.runtime.model.Snapshot;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.concurrent.CompletableFuture;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@Tag("unit")
public class SimulationTest {

    @Test
    void stepAdvancesRoundCounter() {
        Simulation simulation = new Simulation(ModelParser.parse("a(3) > b @ 1"));

        Snapshot first = simulation.step();
        Snapshot second = simulation.step();

        assertThat(first.round()).isEqualTo(1);
        assertThat(second.round()).isEqualTo(2);
        assertThat(simulation.getCurrentRound()).isEqualTo(2);
        assertThat(second.value("b")).isEqualTo(2.0);
    }

    @Test
    void zeroRoundsYieldsInitialStateOnly() {
        List<Snapshot> snapshots = new Simulation(ModelParser.parse("a(3) > b @ 1")).run(0);

        assertThat(snapshots).hasSize(1);
        assertThat(snapshots.get(0).value("a")).isEqualTo(3.0);
    }

    @Test
    void constructionValidatesModel() {
        Model model = ModelParser.parse("a(b) > b(a) @ 1");

        assertThatThrownBy(() -> new Simulation(model)).isInstanceOf(CircularReferencesException.class);
    }

    @Test
    void stockValuesNeverGoNegative() {
        Model model = ModelParser.parse(String.join("\n",
                "a(7) > b @ 3",
                "a > c @ Leak(0.9)",
                "b > d @ 0.3",
                "c > e(0, 4) @ Conversion(2.0)",
                "e > a @ Rate(e * 2)"));

        for (Snapshot snapshot : model.run(20)) {
            assertThat(snapshot.values().values()).allMatch(value -> value >= 0);
        }
    }

    @Test
    void finiteStocksConserveUnitsUnderRateAndLeak() {
        Model model = ModelParser.parse(String.join("\n",
                "a(100) > b @ 7",
                "b > c @ Leak(0.25)",
                "c > a @ 3"));

        for (Snapshot snapshot : model.run(15)) {
            double total = snapshot.values().values().stream().mapToDouble(Double::doubleValue).sum();
            assertThat(total).isEqualTo(100.0);
        }
    }

    @Test
    void independentSimulationsOfOneModelAgree() throws Exception {
        Model model = ModelParser.parse("[Pool] > a @ 2\na > b @ Leak(0.5)");
        model.validate();

        CompletableFuture<List<Snapshot>> first = CompletableFuture.supplyAsync(() -> new Simulation(model).run(10));
        CompletableFuture<List<Snapshot>> second = CompletableFuture.supplyAsync(() -> new Simulation(model).run(10));

        assertThat(first.get()).isEqualTo(second.get());
    }

    @Test
    void parsingTheSameTextTwiceGivesTheSameRun() {
        String text = "[Candidates] > PhoneScreens @ 25\nPhoneScreens > Onsites @ 0.5\nOnsites > Offers(0, 4) @ Rate(Onsites / 2)\n";

        List<Snapshot> first = new Simulation(ModelParser.parse(text)).run(6);
        List<Snapshot> second = new Simulation(ModelParser.parse(text)).run(6);

        assertThat(first).isEqualTo(second);
    }
}
