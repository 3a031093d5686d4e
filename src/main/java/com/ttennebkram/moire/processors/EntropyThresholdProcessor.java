package com.ttennebkram.moire.processors;

import com.google.gson.JsonObject;
import com.ttennebkram.moire.processing.ImageProcessor;
import org.opencv.core.Mat;
import org.opencv.core.MatOfFloat;
import org.opencv.core.MatOfInt;
import org.opencv.imgproc.Imgproc;

import java.util.Collections;

/**
 * Maximum-entropy (Kapur) threshold processor.
 *
 * For every candidate split s of the 256-bin histogram the total entropy of the
 * background class [0, s] and foreground class (s, 255] is
 * <pre>
 *   TE(s) = ln(P(s) * (1 - P(s))) - H(s) / P(s) - H'(s) / (1 - P(s))
 * </pre>
 * where P(s) is the background mass and H(s), H'(s) are the sums of p*ln(p) over each
 * class. The split with the largest TE wins; the first one on ties. Splits that leave
 * either class (almost) empty are skipped. If every split is skipped, as for a
 * single-intensity image, the fallback threshold is used and the result is flagged.
 *
 * Binarization follows Imgproc.threshold(THRESH_BINARY): pixels above the threshold
 * become 255.
 */
public class EntropyThresholdProcessor extends ProcessorBase implements PipelineStage, ImageProcessor {

    public static final int DEFAULT_FALLBACK_THRESHOLD = 127;

    /** Returned by {@link #kapurThreshold(double[])} when no split is usable. */
    public static final int NO_THRESHOLD = -1;

    private static final double EPSILON = 1e-9;

    private int fallbackThreshold = DEFAULT_FALLBACK_THRESHOLD;

    @Override
    public String getName() {
        return "entropyThreshold";
    }


    public int getFallbackThreshold() {
        return fallbackThreshold;
    }

    public void setFallbackThreshold(int fallbackThreshold) {
        if (fallbackThreshold < 0 || fallbackThreshold > 255) {
            throw new IllegalArgumentException("Fallback threshold must be within 0-255, got " + fallbackThreshold);
        }
        this.fallbackThreshold = fallbackThreshold;
    }

    @Override
    public Mat process(Mat input) {
        return apply(input).getMask();
    }

    /**
     * Pick the maximum-entropy threshold for an 8-bit image and binarize it.
     *
     * @param input CV_8UC1 image (not modified)
     * @return mask, threshold and whether the fallback was used (caller must close)
     */
    public ThresholdResult apply(Mat input) {
        requireGray8(input, "Threshold input");

        int threshold = kapurThreshold(histogram(input));
        boolean fallback = threshold == NO_THRESHOLD;
        if (fallback) {
            threshold = fallbackThreshold;
        }

        Mat mask = new Mat();
        Imgproc.threshold(input, mask, threshold, 255, Imgproc.THRESH_BINARY);
        return new ThresholdResult(mask, threshold, fallback);
    }

    /**
     * Normalized 256-bin histogram (probabilities summing to 1) of a CV_8UC1 image.
     */
    public static double[] histogram(Mat gray) {
        double[] p = new double[256];
        if (gray.total() == 0) {
            return p;
        }

        Mat hist = new Mat();
        Imgproc.calcHist(Collections.singletonList(gray), new MatOfInt(0), new Mat(), hist,
            new MatOfInt(256), new MatOfFloat(0f, 256f));
        float[] counts = new float[256];
        hist.get(0, 0, counts);
        hist.release();

        double total = gray.total();
        for (int i = 0; i < 256; i++) {
            p[i] = counts[i] / total;
        }
        return p;
    }

    /**
     * Kapur's maximum-entropy split of a normalized histogram.
     *
     * @param p probabilities for intensities 0-255
     * @return the split s in [0, 254] maximizing TE(s), or {@link #NO_THRESHOLD}
     */
    public static int kapurThreshold(double[] p) {
        if (p.length != 256) {
            throw new IllegalArgumentException("Histogram must have 256 bins, got " + p.length);
        }

        double[] pLogP = new double[256];
        for (int i = 0; i < 256; i++) {
            pLogP[i] = p[i] > EPSILON ? p[i] * Math.log(p[i]) : 0.0;
        }

        // Prefix sums for the background class, suffix sums for the foreground class
        double[] mass = new double[256];
        double[] entropy = new double[256];
        double[] entropyAbove = new double[257];
        double m = 0.0;
        double h = 0.0;
        for (int i = 0; i < 256; i++) {
            m += p[i];
            h += pLogP[i];
            mass[i] = m;
            entropy[i] = h;
        }
        for (int i = 255; i >= 0; i--) {
            entropyAbove[i] = entropyAbove[i + 1] + pLogP[i];
        }

        double best = Double.NEGATIVE_INFINITY;
        int threshold = NO_THRESHOLD;
        for (int s = 0; s < 255; s++) {
            double background = mass[s];
            double foreground = 1.0 - background;
            if (background < EPSILON || foreground < EPSILON) {
                continue;
            }
            double te = Math.log(background * foreground)
                - entropy[s] / background
                - entropyAbove[s + 1] / foreground;
            if (te > best) {
                best = te;
                threshold = s;
            }
        }
        return threshold;
    }

    @Override
    public void serializeProperties(JsonObject json) {
        json.addProperty("fallbackThreshold", fallbackThreshold);
    }

    @Override
    public void deserializeProperties(JsonObject json) {
        setFallbackThreshold(getJsonInt(json, "fallbackThreshold", fallbackThreshold));
    }
}
