package com.ttennebkram.moire.batch;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * Batch-level settings: worker pool size and which extensions are treated as images.
 */
public class BatchOptions {

    public static final int DEFAULT_MAX_WORKERS = 8;

    public static final List<String> DEFAULT_EXTENSIONS = Collections.unmodifiableList(
        Arrays.asList(".png", ".jpg", ".jpeg", ".bmp", ".tif", ".tiff"));

    private int maxWorkers = DEFAULT_MAX_WORKERS;
    private List<String> extensions = new ArrayList<>(DEFAULT_EXTENSIONS);

    public int getMaxWorkers() {
        return maxWorkers;
    }

    public BatchOptions setMaxWorkers(int maxWorkers) {
        if (maxWorkers < 1) {
            throw new IllegalArgumentException("Worker count must be at least 1, got " + maxWorkers);
        }
        this.maxWorkers = maxWorkers;
        return this;
    }

    public List<String> getExtensions() {
        return Collections.unmodifiableList(extensions);
    }

    public BatchOptions setExtensions(List<String> extensions) {
        if (extensions == null || extensions.isEmpty()) {
            throw new IllegalArgumentException("At least one image extension is required");
        }
        this.extensions = new ArrayList<>(extensions);
        return this;
    }
}
