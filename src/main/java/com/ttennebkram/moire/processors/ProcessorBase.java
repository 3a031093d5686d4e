package com.ttennebkram.moire.processors;

import com.google.gson.JsonObject;
import org.opencv.core.CvType;
import org.opencv.core.Mat;

/**
 * Abstract base class for the moire processors.
 * Provides input validation and, for {@link PipelineStage}s, JSON helper methods.
 */
public abstract class ProcessorBase {

    /**
     * Standard null/empty check for input validation.
     */
    protected boolean isInvalidInput(Mat input) {
        return input == null || input.empty();
    }

    /**
     * Reject anything that is not a non-empty single-channel 8-bit image.
     */
    protected void requireGray8(Mat input, String what) {
        if (isInvalidInput(input)) {
            throw new IllegalArgumentException(what + " must not be empty");
        }
        if (input.type() != CvType.CV_8UC1) {
            throw new IllegalArgumentException(what + " must be CV_8UC1, got " + CvType.typeToString(input.type()));
        }
    }

    /**
     * Kernel sizes for median and morphology must be positive and odd.
     */
    protected static int requireOddKernel(int size, String what) {
        if (size < 1 || size % 2 == 0) {
            throw new IllegalArgumentException(what + " must be a positive odd number, got " + size);
        }
        return size;
    }

    /**
     * Helper to safely get an int from JSON.
     */
    protected int getJsonInt(JsonObject json, String key, int defaultValue) {
        if (json.has(key)) {
            return json.get(key).getAsInt();
        }
        return defaultValue;
    }

    /**
     * Helper to safely get a boolean from JSON.
     */
    protected boolean getJsonBoolean(JsonObject json, String key, boolean defaultValue) {
        if (json.has(key)) {
            return json.get(key).getAsBoolean();
        }
        return defaultValue;
    }
}
