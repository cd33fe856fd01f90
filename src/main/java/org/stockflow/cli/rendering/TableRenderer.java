package org.stockflow.cli.rendering;

import org.stockflow.runtime.model.Model;
import org.stockflow.runtime.model.Snapshot;
import org.stockflow.runtime.model.Stock;

import java.util.ArrayList;
import java.util.List;

/**
 * Renders snapshots as a delimited table.
 *
 * <p>The header starts with the separator and lists the displayed stocks. Each row starts
 * with the round number followed by one value per stock. With padding enabled every value
 * is right-padded to the width of its column header.</p>
 *
 * <pre>
 * 	a	b
 * 0	5	0
 * 1	4	1
 * </pre>
 */
public class TableRenderer implements ResultRenderer {

    private final String separator;
    private final boolean pad;

    public TableRenderer(String separator, boolean pad) {
        this.separator = separator;
        this.pad = pad;
    }

    @Override
    public String render(Model model, List<Snapshot> snapshots) {
        List<Stock> columns = model.displayedStocks();
        List<String> lines = new ArrayList<>(snapshots.size() + 1);

        StringBuilder header = new StringBuilder(separator);
        for (int i = 0; i < columns.size(); i++) {
            if (i > 0) {
                header.append(separator);
            }
            header.append(columns.get(i).getName());
        }
        lines.add(header.toString());

        for (Snapshot snapshot : snapshots) {
            StringBuilder row = new StringBuilder(String.valueOf(snapshot.round()));
            for (Stock column : columns) {
                String value = ValueFormat.format(snapshot.value(column.getName()));
                row.append(separator).append(pad ? padEnd(value, column.getName().length()) : value);
            }
            lines.add(row.toString());
        }
        return String.join("\n", lines);
    }

    private static String padEnd(String value, int width) {
        if (value.length() >= width) {
            return value;
        }
        return value + " ".repeat(width - value.length());
    }
}
