package com.ttennebkram.moire.processors;

import com.google.gson.JsonObject;
import com.ttennebkram.moire.processing.DualImageProcessor;
import com.ttennebkram.moire.util.MatReleaser;
import org.opencv.core.Core;
import org.opencv.core.CvType;
import org.opencv.core.Mat;
import org.opencv.core.Scalar;

/**
 * Restores the black and white points of a page after frequency-domain processing.
 *
 * Pixels that are exactly 255 (white reference) or exactly 0 (black reference) in the
 * original page anchor a linear rescale of the processed page: the mean processed value
 * over the white reference maps to 255, the mean over the black reference maps to 0.
 * An empty reference set defaults to 255 / 0. Rescaled values are truncated toward zero,
 * not rounded. The reference pixels are then forced back to their exact original values.
 */
public class ToneCalibrationProcessor extends ProcessorBase implements PipelineStage, DualImageProcessor {

    private boolean enabled = true;

    @Override
    public String getName() {
        return "toneCalibration";
    }


    public boolean isEnabled() {
        return enabled;
    }

    public void setEnabled(boolean enabled) {
        this.enabled = enabled;
    }

    /**
     * @param original  CV_8UC1 source page (not modified)
     * @param processed CV_8UC1 processed page of the same size (not modified)
     * @return calibrated CV_8UC1 page (caller must release)
     */
    @Override
    public Mat process(Mat original, Mat processed) {
        requireGray8(original, "Original page");
        requireGray8(processed, "Processed page");
        if (!original.size().equals(processed.size())) {
            throw new IllegalArgumentException("Page sizes differ: " + original.size() + " vs " + processed.size());
        }

        if (!enabled) {
            return processed.clone();
        }

        try (MatReleaser releaser = new MatReleaser()) {
            Mat whiteRef = releaser.track(new Mat());
            Mat blackRef = releaser.track(new Mat());
            Core.compare(original, new Scalar(255), whiteRef, Core.CMP_EQ);
            Core.compare(original, new Scalar(0), blackRef, Core.CMP_EQ);

            double avgWhite = meanOver(processed, whiteRef, 255.0);
            double avgBlack = meanOver(processed, blackRef, 0.0);
            double denominator = avgWhite != avgBlack ? avgWhite - avgBlack : 1.0;

            // (x - black) / denom, clipped to [0,1], scaled to 0-255
            Mat scaled = releaser.track(new Mat());
            processed.convertTo(scaled, CvType.CV_64F);
            Core.subtract(scaled, new Scalar(avgBlack), scaled);
            Core.divide(scaled, new Scalar(denominator), scaled);
            Core.min(scaled, new Scalar(1.0), scaled);
            Core.max(scaled, new Scalar(0.0), scaled);
            Core.multiply(scaled, new Scalar(255.0), scaled);

            Mat output = new Mat();
            truncate(scaled, output, releaser);

            output.setTo(new Scalar(0), blackRef);
            output.setTo(new Scalar(255), whiteRef);
            return output;
        }
    }

    /**
     * Non-negative CV_64F to CV_8U by truncation. convertTo rounds to nearest, so
     * values it rounded up are stepped back down by one.
     */
    private static void truncate(Mat scaled, Mat output, MatReleaser releaser) {
        Mat nearest = releaser.track(new Mat());
        Mat roundedUp = releaser.track(new Mat());
        scaled.convertTo(nearest, CvType.CV_32S);
        nearest.convertTo(nearest, CvType.CV_64F);
        Core.compare(nearest, scaled, roundedUp, Core.CMP_GT);
        Core.subtract(nearest, new Scalar(1.0), nearest, roundedUp);
        nearest.convertTo(output, CvType.CV_8U);
    }

    private static double meanOver(Mat image, Mat reference, double whenEmpty) {
        if (Core.countNonZero(reference) == 0) {
            return whenEmpty;
        }
        return Core.mean(image, reference).val[0];
    }

    @Override
    public void serializeProperties(JsonObject json) {
        json.addProperty("enabled", enabled);
    }

    @Override
    public void deserializeProperties(JsonObject json) {
        enabled = getJsonBoolean(json, "enabled", enabled);
    }
}
