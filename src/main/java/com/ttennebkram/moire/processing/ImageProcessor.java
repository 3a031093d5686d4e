package com.ttennebkram.moire.processing;

import org.opencv.core.Mat;

/**
 * A single-page image operation: median denoise, top-hat, threshold, suppression,
 * or the whole moire removal pipeline.
 *
 * Implementations validate their input and throw IllegalArgumentException for an
 * empty Mat or an unsupported type rather than returning null.
 */
@FunctionalInterface
public interface ImageProcessor {
    /**
     * @param input page or spectrum view, owned by the caller and left untouched
     * @return a new Mat the caller releases
     */
    Mat process(Mat input);
}
