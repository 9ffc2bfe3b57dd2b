package io.surfworks.tirnarrow.narrow;

import java.util.List;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonArray;
import com.google.gson.JsonObject;

/**
 * Decisions taken for one function, in variable declaration order.
 *
 * <p>{@link #toJson()} gives a stable rendering suitable for storing next
 * to a test and diffing against later runs.
 */
public record NarrowingReport(String functionName, int targetBits, List<VariableDecision> decisions) {

    private static final Gson GSON = new GsonBuilder()
            .setPrettyPrinting()
            .disableHtmlEscaping()
            .create();

    public NarrowingReport {
        decisions = List.copyOf(decisions);
    }

    public int narrowedCount() {
        int count = 0;
        for (VariableDecision d : decisions) {
            if (d.isNarrowed()) {
                count++;
            }
        }
        return count;
    }

    public int keptCount() {
        return decisions.size() - narrowedCount();
    }

    /**
     * One-line summary for logs.
     */
    public String summary() {
        return String.format("%s: narrowed %d, kept %d (target %d bits)",
                functionName, narrowedCount(), keptCount(), targetBits);
    }

    public JsonObject toJsonTree() {
        JsonObject root = new JsonObject();
        root.addProperty("function", functionName);
        root.addProperty("targetBits", targetBits);
        root.addProperty("narrowed", narrowedCount());
        root.addProperty("kept", keptCount());

        JsonArray vars = new JsonArray();
        for (VariableDecision d : decisions) {
            JsonObject v = new JsonObject();
            v.addProperty("name", d.var().name());
            v.addProperty("kind", d.kind().name());
            v.addProperty("from", d.originalType().toString());
            v.addProperty("to", d.resolvedType().toString());
            v.addProperty("range", d.declaredRange().toString());
            v.addProperty("reason", d.reason().name());
            if (!d.detail().isEmpty()) {
                v.addProperty("detail", d.detail());
            }
            vars.add(v);
        }
        root.add("variables", vars);
        return root;
    }

    public String toJson() {
        return GSON.toJson(toJsonTree());
    }

    /**
     * Renders the reports of a whole module as one JSON array.
     */
    public static String toJson(List<NarrowingReport> reports) {
        JsonArray array = new JsonArray();
        for (NarrowingReport report : reports) {
            array.add(report.toJsonTree());
        }
        return GSON.toJson(array);
    }
}
