package com.ttennebkram.moire.processors;

import org.opencv.core.Core;
import org.opencv.core.Mat;

/**
 * Binary mask produced by a thresholding stage together with the threshold it used.
 *
 * The mask is CV_8UC1 with 255 where the input was strictly above the threshold and 0
 * elsewhere. {@link #isFallback()} reports that the automatic threshold could not be
 * determined (degenerate histogram) and the configured fallback value was used.
 *
 * Owns its mask: release with {@link #close()}.
 */
public class ThresholdResult implements AutoCloseable {

    private final Mat mask;
    private final int threshold;
    private final boolean fallback;

    public ThresholdResult(Mat mask, int threshold, boolean fallback) {
        this.mask = mask;
        this.threshold = threshold;
        this.fallback = fallback;
    }

    public Mat getMask() {
        return mask;
    }

    public int getThreshold() {
        return threshold;
    }

    public boolean isFallback() {
        return fallback;
    }

    /**
     * Number of mask pixels set.
     */
    public int countMarked() {
        return Core.countNonZero(mask);
    }

    @Override
    public void close() {
        mask.release();
    }
}
