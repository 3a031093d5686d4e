package com.ttennebkram.moire.fft;

import com.ttennebkram.moire.util.MatReleaser;
import org.opencv.core.Core;
import org.opencv.core.CvType;
import org.opencv.core.Mat;
import org.opencv.core.Scalar;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Frequency-domain helpers shared by the moire suppression stages.
 *
 * Spectra are two-channel CV_64F Mats (real, imaginary) with the same size as the
 * image they were computed from. No padding to an optimal DFT size is applied, so
 * masks built in spectrum space always line up with the image grid.
 *
 * All methods return newly allocated Mats and never modify their inputs.
 */
public final class FFTUtils {

    /** Real reconstructions whose range is below this are treated as flat. */
    public static final double FLAT_RANGE_EPSILON = 1e-6;

    private FFTUtils() {
    }

    /**
     * Forward 2D DFT of a single-channel image.
     *
     * @param image single-channel image of any depth
     * @return unshifted complex spectrum (DC term at [0,0]), CV_64FC2
     */
    public static Mat forwardDft(Mat image) {
        requireSingleChannel(image, "image");

        try (MatReleaser releaser = new MatReleaser()) {
            Mat real = releaser.track(new Mat());
            image.convertTo(real, CvType.CV_64F);
            Mat imaginary = releaser.track(Mat.zeros(real.size(), CvType.CV_64F));

            Mat complex = new Mat();
            Core.merge(Arrays.asList(real, imaginary), complex);
            Core.dft(complex, complex);
            return complex;
        }
    }

    /**
     * Inverse 2D DFT, keeping only the real part.
     *
     * @param spectrum unshifted complex spectrum, CV_64FC2
     * @return real part of the scaled inverse transform, CV_64F
     */
    public static Mat inverseDftRealPart(Mat spectrum) {
        requireComplex(spectrum, "spectrum");

        try (MatReleaser releaser = new MatReleaser()) {
            Mat inverse = releaser.track(new Mat());
            Core.idft(spectrum, inverse, Core.DFT_SCALE);

            List<Mat> planes = new ArrayList<>();
            Core.split(inverse, planes);
            releaser.trackAll(planes);
            return releaser.keep(planes.get(0));
        }
    }

    /**
     * Move the DC term from [0,0] to the grid center (numpy fftshift semantics,
     * correct for odd and even dimensions).
     */
    public static Mat fftShift(Mat input) {
        return roll(input, input.rows() / 2, input.cols() / 2);
    }

    /**
     * Undo {@link #fftShift(Mat)}: move the grid center back to [0,0].
     */
    public static Mat ifftShift(Mat input) {
        int rows = input.rows();
        int cols = input.cols();
        return roll(input, rows - rows / 2, cols - cols / 2);
    }

    /**
     * Circularly shift a Mat so that element [y][x] lands at [(y + dy) % rows][(x + dx) % cols].
     */
    public static Mat roll(Mat input, int dy, int dx) {
        if (input == null || input.empty()) {
            throw new IllegalArgumentException("Cannot shift an empty Mat");
        }
        int rows = input.rows();
        int cols = input.cols();
        int shiftY = Math.floorMod(dy, rows);
        int shiftX = Math.floorMod(dx, cols);

        Mat output = new Mat(input.size(), input.type());

        // Source row/col ranges and where they land in the output
        int[][] rowBlocks = {
            {0, rows - shiftY, shiftY, rows},
            {rows - shiftY, rows, 0, shiftY}
        };
        int[][] colBlocks = {
            {0, cols - shiftX, shiftX, cols},
            {cols - shiftX, cols, 0, shiftX}
        };

        for (int[] rb : rowBlocks) {
            if (rb[0] == rb[1]) continue;
            for (int[] cb : colBlocks) {
                if (cb[0] == cb[1]) continue;
                Mat from = input.submat(rb[0], rb[1], cb[0], cb[1]);
                Mat to = output.submat(rb[2], rb[3], cb[2], cb[3]);
                from.copyTo(to);
                from.release();
                to.release();
            }
        }
        return output;
    }

    /**
     * Log-compressed magnitude of a spectrum, min-max normalized to 0-255.
     *
     * @param spectrum complex spectrum (normally the center-shifted one), CV_64FC2
     * @return log1p(|spectrum|) scaled to CV_8U
     */
    public static Mat logMagnitude(Mat spectrum) {
        requireComplex(spectrum, "spectrum");

        try (MatReleaser releaser = new MatReleaser()) {
            List<Mat> planes = new ArrayList<>();
            Core.split(spectrum, planes);
            releaser.trackAll(planes);

            Mat magnitude = releaser.track(new Mat());
            Core.magnitude(planes.get(0), planes.get(1), magnitude);
            Core.add(magnitude, Scalar.all(1.0), magnitude);
            Core.log(magnitude, magnitude);

            Mat output = new Mat();
            Core.normalize(magnitude, output, 0, 255, Core.NORM_MINMAX, CvType.CV_8U);
            return output;
        }
    }

    /**
     * Scale real and imaginary parts of a spectrum element-wise by a real mask.
     * Phase is unchanged wherever the mask is non-zero.
     *
     * @param spectrum complex spectrum, CV_64FC2
     * @param mask     CV_64F mask of the same size, normally with values in [0,1]
     */
    public static Mat applyMask(Mat spectrum, Mat mask) {
        requireComplex(spectrum, "spectrum");
        if (mask == null || !mask.size().equals(spectrum.size()) || mask.type() != CvType.CV_64F) {
            throw new IllegalArgumentException("Mask must be CV_64F with the spectrum's size " + spectrum.size());
        }

        try (MatReleaser releaser = new MatReleaser()) {
            List<Mat> planes = new ArrayList<>();
            Core.split(spectrum, planes);
            releaser.trackAll(planes);
            Core.multiply(planes.get(0), mask, planes.get(0));
            Core.multiply(planes.get(1), mask, planes.get(1));

            Mat masked = new Mat();
            Core.merge(planes, masked);
            return masked;
        }
    }

    /**
     * Min-max normalize a real image to CV_8U 0-255.
     * A flat image (range below {@link #FLAT_RANGE_EPSILON}) keeps its value, clamped and
     * rounded, instead of collapsing to 0.
     */
    public static Mat normalizeToByte(Mat real) {
        requireSingleChannel(real, "real");

        Core.MinMaxLocResult range = Core.minMaxLoc(real);
        Mat output = new Mat();
        if (range.maxVal - range.minVal < FLAT_RANGE_EPSILON) {
            real.convertTo(output, CvType.CV_8U);
        } else {
            Core.normalize(real, output, 0, 255, Core.NORM_MINMAX, CvType.CV_8U);
        }
        return output;
    }

    private static void requireSingleChannel(Mat mat, String name) {
        if (mat == null || mat.empty()) {
            throw new IllegalArgumentException(name + " must not be empty");
        }
        if (mat.channels() != 1) {
            throw new IllegalArgumentException(name + " must have one channel, got " + mat.channels());
        }
    }

    private static void requireComplex(Mat mat, String name) {
        if (mat == null || mat.empty()) {
            throw new IllegalArgumentException(name + " must not be empty");
        }
        if (mat.type() != CvType.CV_64FC2) {
            throw new IllegalArgumentException(name + " must be a CV_64FC2 spectrum, got " + CvType.typeToString(mat.type()));
        }
    }
}
