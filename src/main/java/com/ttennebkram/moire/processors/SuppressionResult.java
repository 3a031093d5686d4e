package com.ttennebkram.moire.processors;

import org.opencv.core.Mat;

/**
 * Output of moire suppression for one page.
 *
 * Carries the CV_8UC1 image plus the peak detection diagnostics: the threshold the
 * detector settled on, whether that threshold was the degenerate-histogram fallback,
 * and how many spectrum pixels were zeroed.
 *
 * Owns its image: release with {@link #close()}.
 */
public class SuppressionResult implements AutoCloseable {

    private final Mat image;
    private final int threshold;
    private final boolean fallback;
    private final int suppressedPixels;

    public SuppressionResult(Mat image, int threshold, boolean fallback, int suppressedPixels) {
        this.image = image;
        this.threshold = threshold;
        this.fallback = fallback;
        this.suppressedPixels = suppressedPixels;
    }

    public Mat getImage() {
        return image;
    }

    public int getThreshold() {
        return threshold;
    }

    public boolean isFallback() {
        return fallback;
    }

    public int getSuppressedPixels() {
        return suppressedPixels;
    }

    /**
     * Same diagnostics with a replacement image. This result's image is released.
     */
    public SuppressionResult withImage(Mat replacement) {
        image.release();
        return new SuppressionResult(replacement, threshold, fallback, suppressedPixels);
    }

    @Override
    public void close() {
        image.release();
    }
}
