package com.ttennebkram.moire.processors;

import com.google.gson.JsonObject;

/**
 * A stage with tunable properties in the settings file.
 * Each stage encapsulates:
 * - Processing logic (OpenCV operations)
 * - Serialization/deserialization of its tunable properties (JSON)
 *
 * Stages hold configuration only. Per-image state lives in local variables and
 * result objects, so one stage instance can serve every worker thread of a batch.
 */
public interface PipelineStage {

    /**
     * Get the stage name (e.g., "medianBlur", "axisExclusion").
     * Used as the key of the stage's object in the settings file.
     */
    String getName();

    /**
     * Serialize stage-specific properties to JSON.
     *
     * @param json The JSON object to add properties to
     */
    void serializeProperties(JsonObject json);

    /**
     * Deserialize stage-specific properties from JSON.
     * Missing keys keep their current values.
     *
     * @param json The JSON object to read properties from
     */
    void deserializeProperties(JsonObject json);
}
