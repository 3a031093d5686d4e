package com.ttennebkram.moire.processing;

import org.opencv.core.Mat;

/**
 * An operation that combines the untouched source page with an intermediate result
 * of the same size, such as tone calibration.
 */
@FunctionalInterface
public interface DualImageProcessor {
    /**
     * @param original  source page, owned by the caller and left untouched
     * @param processed intermediate result, owned by the caller and left untouched
     * @return a new Mat the caller releases
     */
    Mat process(Mat original, Mat processed);
}
