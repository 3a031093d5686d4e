package com.ttennebkram.moire.processors;

import com.google.gson.JsonObject;
import org.opencv.core.CvType;
import org.opencv.core.Mat;
import org.opencv.core.Scalar;

/**
 * Static cross-shaped template protecting the DC term and the spectrum axes.
 *
 * A horizontal band of {@code horizontalBandHeight} rows spanning all columns and a
 * vertical band of {@code verticalBandWidth} columns spanning all rows, both centered
 * on (rows / 2, cols / 2), the position of the DC term after a center shift.
 * Bands are clipped to the grid. Peaks inside the cross are never suppressed.
 *
 * Default sizes (23 and 12) are empirical; no value is derived from the image.
 */
public class AxisExclusionMask extends ProcessorBase implements PipelineStage {

    public static final int DEFAULT_HORIZONTAL_BAND_HEIGHT = 23;
    public static final int DEFAULT_VERTICAL_BAND_WIDTH = 12;

    private int horizontalBandHeight = DEFAULT_HORIZONTAL_BAND_HEIGHT;
    private int verticalBandWidth = DEFAULT_VERTICAL_BAND_WIDTH;

    public AxisExclusionMask() {
    }

    public AxisExclusionMask(int horizontalBandHeight, int verticalBandWidth) {
        setHorizontalBandHeight(horizontalBandHeight);
        setVerticalBandWidth(verticalBandWidth);
    }

    @Override
    public String getName() {
        return "axisExclusion";
    }


    public int getHorizontalBandHeight() {
        return horizontalBandHeight;
    }

    public void setHorizontalBandHeight(int horizontalBandHeight) {
        if (horizontalBandHeight < 0) {
            throw new IllegalArgumentException("Horizontal band height must not be negative, got " + horizontalBandHeight);
        }
        this.horizontalBandHeight = horizontalBandHeight;
    }

    public int getVerticalBandWidth() {
        return verticalBandWidth;
    }

    public void setVerticalBandWidth(int verticalBandWidth) {
        if (verticalBandWidth < 0) {
            throw new IllegalArgumentException("Vertical band width must not be negative, got " + verticalBandWidth);
        }
        this.verticalBandWidth = verticalBandWidth;
    }

    /**
     * Build the template for a spectrum of the given size.
     *
     * @return CV_8UC1 Mat, 255 inside the bands, 0 elsewhere (caller must release)
     */
    public Mat create(int rows, int cols) {
        if (rows <= 0 || cols <= 0) {
            throw new IllegalArgumentException("Mask size must be positive, got " + rows + "x" + cols);
        }
        Mat mask = Mat.zeros(rows, cols, CvType.CV_8UC1);
        fillCentered(mask, horizontalBandHeight, cols);
        fillCentered(mask, rows, verticalBandWidth);
        return mask;
    }

    /**
     * Set a rectangle of the given size, centered on the grid center, to 255.
     */
    private static void fillCentered(Mat mask, int rectHeight, int rectWidth) {
        int rows = mask.rows();
        int cols = mask.cols();
        int startY = rows / 2 - rectHeight / 2;
        int startX = cols / 2 - rectWidth / 2;

        int y0 = Math.max(0, startY);
        int y1 = Math.min(rows, startY + rectHeight);
        int x0 = Math.max(0, startX);
        int x1 = Math.min(cols, startX + rectWidth);
        if (y0 >= y1 || x0 >= x1) {
            return;
        }

        Mat band = mask.submat(y0, y1, x0, x1);
        band.setTo(new Scalar(255));
        band.release();
    }

    @Override
    public void serializeProperties(JsonObject json) {
        json.addProperty("horizontalBandHeight", horizontalBandHeight);
        json.addProperty("verticalBandWidth", verticalBandWidth);
    }

    @Override
    public void deserializeProperties(JsonObject json) {
        setHorizontalBandHeight(getJsonInt(json, "horizontalBandHeight", horizontalBandHeight));
        setVerticalBandWidth(getJsonInt(json, "verticalBandWidth", verticalBandWidth));
    }
}
