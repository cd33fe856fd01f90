package org.stockflow.cli.rendering;

import org.stockflow.compiler.frontend.parser.ModelParser;
import org.stockflow.runtime.model.Model;
import org.stockflow.runtime.model.Snapshot;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

@Tag("unit")
public class TableRendererTest {

    @Test
    void rendersHeaderAndRoundRows() {
        Model model = ModelParser.parse("[Pool] > Hires @ 2");
        List<Snapshot> snapshots = model.run(2);

        String table = new TableRenderer("\t", true).render(model, snapshots);

        assertThat(table).isEqualTo("\tHires\n0\t0    \n1\t2    \n2\t4    ");
    }

    @Test
    void rendersWithoutPadding() {
        Model model = ModelParser.parse("[Pool] > Hires @ 2");

        String table = new TableRenderer(",", false).render(model, model.run(1));

        assertThat(table).isEqualTo(",Hires\n0,0\n1,2");
    }

    @Test
    void rendersFractionsAndInfinity() {
        Model model = ModelParser.parse("a(inf)\nb(0.5)");

        String table = new TableRenderer(" ", false).render(model, model.run(0));

        assertThat(table).isEqualTo(" a b\n0 inf 0.5");
    }

    @Test
    void formatsValues() {
        assertThat(ValueFormat.format(5.0)).isEqualTo("5");
        assertThat(ValueFormat.format(-3.0)).isEqualTo("-3");
        assertThat(ValueFormat.format(2.25)).isEqualTo("2.25");
        assertThat(ValueFormat.format(Double.POSITIVE_INFINITY)).isEqualTo("inf");
        assertThat(ValueFormat.format(Double.NaN)).isEqualTo("NaN");
    }
}
