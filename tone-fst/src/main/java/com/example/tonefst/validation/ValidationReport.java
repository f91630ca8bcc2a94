package com.example.tonefst.validation;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonArray;
import com.google.gson.JsonObject;

import java.io.IOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

/**
 * Outcome of running a test set against a compiled relation.
 */
public record ValidationReport(int total, int passed, List<TestCase> failures) {

    private static final Gson GSON = new GsonBuilder().setPrettyPrinting().disableHtmlEscaping().create();

    public ValidationReport {
        failures = List.copyOf(failures);
    }

    public int failed() {
        return failures.size();
    }

    public boolean allPassed() {
        return failures.isEmpty();
    }

    public JsonObject toJson() {
        JsonObject root = new JsonObject();
        root.addProperty("total", total);
        root.addProperty("passed", passed);
        root.addProperty("failed", failed());
        JsonArray failed = new JsonArray();
        for (TestCase failure : failures) {
            JsonObject item = new JsonObject();
            item.addProperty("form", failure.form());
            item.addProperty("expected", failure.expected());
            failed.add(item);
        }
        root.add("failures", failed);
        return root;
    }

    public void write(Path path) throws IOException {
        if (path.getParent() != null) {
            Files.createDirectories(path.getParent());
        }
        try (Writer writer = Files.newBufferedWriter(path, StandardCharsets.UTF_8)) {
            GSON.toJson(toJson(), writer);
        }
    }
}
