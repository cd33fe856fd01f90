package org.stockflow.cli.rendering;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonArray;
import com.google.gson.JsonObject;
import org.stockflow.runtime.model.Model;
import org.stockflow.runtime.model.Snapshot;
import org.stockflow.runtime.model.Stock;

import java.util.List;

/**
 * Renders snapshots as a JSON array of {@code {"round": n, "values": {...}}} objects.
 * Infinite values are written as {@code Infinity}.
 */
public class JsonRenderer implements ResultRenderer {

    private final Gson gson = new GsonBuilder()
            .setPrettyPrinting()
            .serializeSpecialFloatingPointValues()
            .create();

    @Override
    public String render(Model model, List<Snapshot> snapshots) {
        List<Stock> columns = model.displayedStocks();
        JsonArray rounds = new JsonArray();
        for (Snapshot snapshot : snapshots) {
            JsonObject values = new JsonObject();
            for (Stock column : columns) {
                values.addProperty(column.getName(), snapshot.value(column.getName()));
            }
            JsonObject round = new JsonObject();
            round.addProperty("round", snapshot.round());
            round.add("values", values);
            rounds.add(round);
        }
        return gson.toJson(rounds);
    }
}
