package com.ttennebkram.moire.processors;

import com.google.gson.JsonObject;
import com.ttennebkram.moire.processing.ImageProcessor;
import org.opencv.core.Core;
import org.opencv.core.Mat;
import org.opencv.core.Size;
import org.opencv.imgproc.Imgproc;

/**
 * White top-hat processor.
 * Opening = erosion followed by dilation with a rectangular structuring element.
 * The residual (input - opening) keeps bright features smaller than the element,
 * which in a spectrum are the frequency peaks standing above their local background.
 */
public class TopHatProcessor extends ProcessorBase implements PipelineStage, ImageProcessor {

    public static final int DEFAULT_KERNEL_SIZE = 17;

    private int kernelSize = DEFAULT_KERNEL_SIZE;

    public TopHatProcessor() {
    }

    public TopHatProcessor(int kernelSize) {
        setKernelSize(kernelSize);
    }

    @Override
    public String getName() {
        return "topHat";
    }


    public int getKernelSize() {
        return kernelSize;
    }

    public void setKernelSize(int kernelSize) {
        this.kernelSize = requireOddKernel(kernelSize, "Top-hat kernel size");
    }

    @Override
    public Mat process(Mat input) {
        requireGray8(input, "Top-hat input");

        Mat kernel = Imgproc.getStructuringElement(Imgproc.MORPH_RECT,
            new Size(kernelSize, kernelSize));

        Mat opening = new Mat();
        Imgproc.morphologyEx(input, opening, Imgproc.MORPH_OPEN, kernel);
        kernel.release();

        // Saturating subtract, opening never exceeds the input anyway
        Mat output = new Mat();
        Core.subtract(input, opening, output);
        opening.release();
        return output;
    }

    @Override
    public void serializeProperties(JsonObject json) {
        json.addProperty("kernelSize", kernelSize);
    }

    @Override
    public void deserializeProperties(JsonObject json) {
        setKernelSize(getJsonInt(json, "kernelSize", kernelSize));
    }
}
