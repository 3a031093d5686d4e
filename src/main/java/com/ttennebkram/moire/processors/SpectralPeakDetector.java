package com.ttennebkram.moire.processors;

import com.ttennebkram.moire.util.MatReleaser;
import org.opencv.core.Mat;

/**
 * Finds moire energy in a log-magnitude spectrum.
 *
 * Steps:
 * 1. Median blur (default 7x7) to drop shot noise.
 * 2. White top-hat with a rectangular element (default 17x17) to isolate peaks
 *    from their local background.
 * 3. Kapur maximum-entropy binarization of the residual, falling back to a fixed
 *    threshold (default 127) for a degenerate histogram.
 *
 * The returned mask is in the same (center-shifted) coordinates as the input.
 * Each step is a configurable stage of its own.
 */
public class SpectralPeakDetector extends ProcessorBase {

    private final MedianBlurProcessor medianBlur;
    private final TopHatProcessor topHat;
    private final EntropyThresholdProcessor entropyThreshold;

    public SpectralPeakDetector() {
        this(new MedianBlurProcessor(), new TopHatProcessor(), new EntropyThresholdProcessor());
    }

    public SpectralPeakDetector(MedianBlurProcessor medianBlur, TopHatProcessor topHat,
                                EntropyThresholdProcessor entropyThreshold) {
        this.medianBlur = medianBlur;
        this.topHat = topHat;
        this.entropyThreshold = entropyThreshold;
    }


    public MedianBlurProcessor getMedianBlur() {
        return medianBlur;
    }

    public TopHatProcessor getTopHat() {
        return topHat;
    }

    public EntropyThresholdProcessor getEntropyThreshold() {
        return entropyThreshold;
    }

    /**
     * Detect spectral peaks.
     *
     * @param logMagnitude CV_8UC1 log-magnitude spectrum (not modified)
     * @return peak mask and chosen threshold (caller must close)
     */
    public ThresholdResult detect(Mat logMagnitude) {
        requireGray8(logMagnitude, "Log-magnitude spectrum");

        try (MatReleaser releaser = new MatReleaser()) {
            Mat denoised = releaser.track(medianBlur.process(logMagnitude));
            Mat residual = releaser.track(topHat.process(denoised));
            return entropyThreshold.apply(residual);
        }
    }
}
