package com.ttennebkram.moire.serialization;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;
import com.google.gson.JsonParser;
import com.ttennebkram.moire.batch.BatchOptions;
import com.ttennebkram.moire.processors.MoireRemovalPipeline;
import com.ttennebkram.moire.processors.PipelineStage;

import java.io.IOException;
import java.io.Reader;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Saves and loads batch settings and stage properties as JSON.
 *
 * <pre>
 * {
 *   "batch":  { "maxWorkers": 8, "extensions": [".png", ...] },
 *   "stages": { "medianBlur": {...}, "topHat": {...}, "entropyThreshold": {...},
 *               "axisExclusion": {...}, "toneCalibration": {...} }
 * }
 * </pre>
 * Stages are keyed by {@link PipelineStage#getName()}. Missing sections and keys keep
 * their current values, so a partial file only overrides what it names.
 */
public class SettingsSerializer {

    private static final Gson GSON = new GsonBuilder().setPrettyPrinting().create();

    private SettingsSerializer() {
    }

    public static JsonObject toJson(BatchOptions options, MoireRemovalPipeline pipeline) {
        JsonObject root = new JsonObject();

        JsonObject batch = new JsonObject();
        batch.addProperty("maxWorkers", options.getMaxWorkers());
        JsonArray extensions = new JsonArray();
        for (String ext : options.getExtensions()) {
            extensions.add(ext);
        }
        batch.add("extensions", extensions);
        root.add("batch", batch);

        JsonObject stages = new JsonObject();
        for (PipelineStage stage : pipeline.getConfigurableStages()) {
            JsonObject props = new JsonObject();
            stage.serializeProperties(props);
            stages.add(stage.getName(), props);
        }
        root.add("stages", stages);
        return root;
    }

    public static void save(Path path, BatchOptions options, MoireRemovalPipeline pipeline) throws IOException {
        Path parent = path.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        try (Writer writer = Files.newBufferedWriter(path, StandardCharsets.UTF_8)) {
            GSON.toJson(toJson(options, pipeline), writer);
        }
    }

    /**
     * Load settings from a file. Stage properties are applied to {@code pipeline} in place.
     *
     * @return batch options from the file, defaults where the file is silent
     * @throws IOException if the file cannot be read, is not JSON, or holds invalid values
     */
    public static BatchOptions load(Path path, MoireRemovalPipeline pipeline) throws IOException {
        JsonElement parsed;
        try (Reader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
            parsed = JsonParser.parseReader(reader);
        } catch (JsonParseException e) {
            throw new IOException("Invalid settings file " + path + ": " + e.getMessage(), e);
        }
        if (!parsed.isJsonObject()) {
            throw new IOException("Invalid settings file " + path + ": not a JSON object");
        }

        try {
            return apply(parsed.getAsJsonObject(), pipeline);
        } catch (IllegalArgumentException | IllegalStateException | UnsupportedOperationException e) {
            // Gson reports wrong value types as IllegalStateException or UnsupportedOperationException
            throw new IOException("Invalid settings file " + path + ": " + e.getMessage(), e);
        }
    }

    static BatchOptions apply(JsonObject root, MoireRemovalPipeline pipeline) {
        BatchOptions options = new BatchOptions();

        if (root.has("batch") && root.get("batch").isJsonObject()) {
            JsonObject batch = root.getAsJsonObject("batch");
            if (batch.has("maxWorkers")) {
                options.setMaxWorkers(batch.get("maxWorkers").getAsInt());
            }
            if (batch.has("extensions")) {
                List<String> extensions = new ArrayList<>();
                for (JsonElement ext : batch.get("extensions").getAsJsonArray()) {
                    extensions.add(ext.getAsString());
                }
                options.setExtensions(extensions);
            }
        }

        if (root.has("stages") && root.get("stages").isJsonObject()) {
            JsonObject stages = root.getAsJsonObject("stages");
            for (PipelineStage stage : pipeline.getConfigurableStages()) {
                if (stages.has(stage.getName()) && stages.get(stage.getName()).isJsonObject()) {
                    stage.deserializeProperties(stages.getAsJsonObject(stage.getName()));
                }
            }
        }
        return options;
    }
}
