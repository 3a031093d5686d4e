package com.ttennebkram.moire.processors;

import com.ttennebkram.moire.fft.FFTUtils;
import com.ttennebkram.moire.processing.ImageProcessor;
import com.ttennebkram.moire.util.MatReleaser;
import org.opencv.core.Core;
import org.opencv.core.CvType;
import org.opencv.core.Mat;

/**
 * Removes off-axis spectral peaks from a grayscale page.
 *
 * 1. Forward DFT, center-shifted copy for detection.
 * 2. Log-magnitude view, fed to the {@link SpectralPeakDetector}.
 * 3. Peaks inside the {@link AxisExclusionMask} are kept; the remaining peaks form the
 *    suppression set.
 * 4. The keep-mask (NOT suppression set) is inverse-shifted, scaled to [0,1] and
 *    multiplied into the unshifted spectrum.
 * 5. Inverse DFT, real part, min-max normalized to 0-255.
 *
 * With an all-ones keep-mask the reconstruction reproduces the input up to
 * floating point error.
 */
public class MoireSuppressionProcessor extends ProcessorBase implements ImageProcessor {

    private final SpectralPeakDetector peakDetector;
    private final AxisExclusionMask axisExclusion;

    public MoireSuppressionProcessor() {
        this(new SpectralPeakDetector(), new AxisExclusionMask());
    }

    public MoireSuppressionProcessor(SpectralPeakDetector peakDetector, AxisExclusionMask axisExclusion) {
        this.peakDetector = peakDetector;
        this.axisExclusion = axisExclusion;
    }


    public SpectralPeakDetector getPeakDetector() {
        return peakDetector;
    }

    public AxisExclusionMask getAxisExclusion() {
        return axisExclusion;
    }

    @Override
    public Mat process(Mat input) {
        SuppressionResult result = suppress(input);
        return result.getImage();
    }

    /**
     * Suppress moire in one page.
     *
     * @param gray CV_8UC1 page (not modified)
     * @return reconstructed CV_8UC1 page with diagnostics (caller must close)
     */
    public SuppressionResult suppress(Mat gray) {
        requireGray8(gray, "Page");

        try (MatReleaser releaser = new MatReleaser()) {
            Mat spectrum = releaser.track(FFTUtils.forwardDft(gray));
            Mat shifted = releaser.track(FFTUtils.fftShift(spectrum));
            Mat logMagnitude = releaser.track(FFTUtils.logMagnitude(shifted));

            try (ThresholdResult peaks = peakDetector.detect(logMagnitude)) {
                Mat keepMask = releaser.track(buildKeepMask(peaks.getMask()));
                int suppressed = (int) keepMask.total() - Core.countNonZero(keepMask);

                Mat real = releaser.track(reconstruct(spectrum, keepMask));
                Mat image = FFTUtils.normalizeToByte(real);
                return new SuppressionResult(image, peaks.getThreshold(), peaks.isFallback(), suppressed);
            }
        }
    }

    /**
     * Keep-mask in shifted coordinates: 0 at off-axis peaks, 255 everywhere else.
     *
     * @param peakMask CV_8UC1 peak mask in shifted coordinates
     */
    public Mat buildKeepMask(Mat peakMask) {
        requireGray8(peakMask, "Peak mask");

        try (MatReleaser releaser = new MatReleaser()) {
            Mat axes = releaser.track(axisExclusion.create(peakMask.rows(), peakMask.cols()));
            Mat offAxes = releaser.track(new Mat());
            Core.bitwise_not(axes, offAxes);

            Mat offAxisPeaks = releaser.track(new Mat());
            Core.bitwise_and(peakMask, offAxes, offAxisPeaks);

            Mat keep = new Mat();
            Core.bitwise_not(offAxisPeaks, keep);
            return keep;
        }
    }

    /**
     * Apply a shifted-domain keep-mask to an unshifted spectrum and invert it.
     *
     * @param spectrum unshifted CV_64FC2 spectrum of the page
     * @param keepMask CV_8UC1 mask in shifted coordinates, 255 = keep
     * @return real part of the inverse transform, CV_64F, before normalization
     */
    public Mat reconstruct(Mat spectrum, Mat keepMask) {
        try (MatReleaser releaser = new MatReleaser()) {
            Mat unshifted = releaser.track(FFTUtils.ifftShift(keepMask));
            Mat scale = releaser.track(new Mat());
            unshifted.convertTo(scale, CvType.CV_64F, 1.0 / 255.0);

            Mat masked = releaser.track(FFTUtils.applyMask(spectrum, scale));
            return FFTUtils.inverseDftRealPart(masked);
        }
    }
}
