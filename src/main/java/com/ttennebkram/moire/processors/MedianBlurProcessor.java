package com.ttennebkram.moire.processors;

import com.google.gson.JsonObject;
import com.ttennebkram.moire.processing.ImageProcessor;
import org.opencv.core.Mat;
import org.opencv.imgproc.Imgproc;

/**
 * Median Blur processor.
 * Removes shot noise from the log-magnitude spectrum before morphology,
 * so isolated bright pixels are not mistaken for moire peaks.
 */
public class MedianBlurProcessor extends ProcessorBase implements PipelineStage, ImageProcessor {

    public static final int DEFAULT_KERNEL_SIZE = 7;

    private int kernelSize = DEFAULT_KERNEL_SIZE;

    public MedianBlurProcessor() {
    }

    public MedianBlurProcessor(int kernelSize) {
        setKernelSize(kernelSize);
    }

    @Override
    public String getName() {
        return "medianBlur";
    }


    public int getKernelSize() {
        return kernelSize;
    }

    public void setKernelSize(int kernelSize) {
        this.kernelSize = requireOddKernel(kernelSize, "Median kernel size");
    }

    @Override
    public Mat process(Mat input) {
        requireGray8(input, "Median blur input");

        Mat output = new Mat();
        Imgproc.medianBlur(input, output, kernelSize);
        return output;
    }

    @Override
    public void serializeProperties(JsonObject json) {
        json.addProperty("ksize", kernelSize);
    }

    @Override
    public void deserializeProperties(JsonObject json) {
        setKernelSize(getJsonInt(json, "ksize", kernelSize));
    }
}
