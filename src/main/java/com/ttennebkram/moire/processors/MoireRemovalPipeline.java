package com.ttennebkram.moire.processors;

import com.ttennebkram.moire.processing.ImageProcessor;
import org.opencv.core.Mat;

import java.util.Arrays;
import java.util.List;

/**
 * Complete per-page moire removal: suppression transform followed by tone calibration.
 *
 * Stage instances hold configuration only, so a single pipeline is shared by all
 * workers of a batch. Configure it before the batch starts.
 */
public class MoireRemovalPipeline implements ImageProcessor {

    private final MoireSuppressionProcessor suppression;
    private final ToneCalibrationProcessor toneCalibration;

    public MoireRemovalPipeline() {
        this(new MoireSuppressionProcessor(), new ToneCalibrationProcessor());
    }

    public MoireRemovalPipeline(MoireSuppressionProcessor suppression, ToneCalibrationProcessor toneCalibration) {
        this.suppression = suppression;
        this.toneCalibration = toneCalibration;
    }

    public MoireSuppressionProcessor getSuppression() {
        return suppression;
    }

    public ToneCalibrationProcessor getToneCalibration() {
        return toneCalibration;
    }

    /**
     * Stages with tunable properties, in settings-file order.
     */
    public List<PipelineStage> getConfigurableStages() {
        SpectralPeakDetector peakDetector = suppression.getPeakDetector();
        return Arrays.asList(
            peakDetector.getMedianBlur(),
            peakDetector.getTopHat(),
            peakDetector.getEntropyThreshold(),
            suppression.getAxisExclusion(),
            toneCalibration);
    }

    @Override
    public Mat process(Mat input) {
        return removeMoire(input).getImage();
    }

    /**
     * Run the full pipeline on one page.
     *
     * @param gray CV_8UC1 page (not modified)
     * @return tone-corrected page with peak detection diagnostics (caller must close)
     */
    public SuppressionResult removeMoire(Mat gray) {
        SuppressionResult suppressed = suppression.suppress(gray);
        try {
            Mat calibrated = toneCalibration.process(gray, suppressed.getImage());
            return suppressed.withImage(calibrated);
        } catch (RuntimeException e) {
            suppressed.close();
            throw e;
        }
    }
}
