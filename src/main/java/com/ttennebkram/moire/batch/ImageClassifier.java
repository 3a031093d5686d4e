package com.ttennebkram.moire.batch;

import com.ttennebkram.moire.util.MatReleaser;
import org.opencv.core.Core;
import org.opencv.core.CvType;
import org.opencv.core.Mat;
import org.opencv.imgcodecs.Imgcodecs;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Decides how an input file is handled.
 *
 * Files with an accepted extension are decoded as-is (Imgcodecs.IMREAD_UNCHANGED, so
 * OpenCV does not convert color to gray for us). An 8-bit single-channel image is
 * grayscale. An 8-bit 3- or 4-channel image is grayscale only if the first three
 * channels are equal at every pixel; alpha is ignored. Everything else decodable is
 * non-grayscale.
 */
public class ImageClassifier {

    private final Set<String> extensions;

    public ImageClassifier(Collection<String> extensions) {
        this.extensions = new LinkedHashSet<>();
        for (String ext : extensions) {
            this.extensions.add(normalizeExtension(ext));
        }
    }

    public Set<String> getExtensions() {
        return extensions;
    }

    /**
     * Whether the file name ends in one of the accepted extensions (case-insensitive).
     */
    public boolean isAcceptedImage(Path file) {
        String name = file.getFileName().toString();
        int dot = name.lastIndexOf('.');
        return dot >= 0 && extensions.contains(name.substring(dot).toLowerCase(Locale.ROOT));
    }

    /**
     * Classify a file. The caller must close the result.
     */
    public ClassifiedImage classify(Path file) {
        if (!isAcceptedImage(file)) {
            return ClassifiedImage.unreadable(file, "not a supported image type");
        }

        Mat image = Imgcodecs.imread(file.toString(), Imgcodecs.IMREAD_UNCHANGED);
        if (image.empty()) {
            image.release();
            return ClassifiedImage.unreadable(file, "cannot be decoded");
        }

        if (image.depth() != CvType.CV_8U) {
            String layout = CvType.typeToString(image.type()) + " depth";
            image.release();
            return ClassifiedImage.nonGrayscale(file, layout);
        }

        int channels = image.channels();
        if (channels == 1) {
            return ClassifiedImage.grayscale(file, image);
        }

        try {
            if ((channels == 3 || channels == 4) && hasEqualColorChannels(image)) {
                Mat page = new Mat();
                Core.extractChannel(image, page, 0);
                return ClassifiedImage.grayscale(file, page);
            }
            return ClassifiedImage.nonGrayscale(file, channels + "-channel color");
        } finally {
            image.release();
        }
    }

    /**
     * Exhaustive check that channels 0, 1 and 2 are identical at every pixel.
     */
    static boolean hasEqualColorChannels(Mat image) {
        try (MatReleaser releaser = new MatReleaser()) {
            List<Mat> planes = new ArrayList<>();
            Core.split(image, planes);
            releaser.trackAll(planes);

            Mat diff = releaser.track(new Mat());
            Core.absdiff(planes.get(0), planes.get(1), diff);
            if (Core.countNonZero(diff) != 0) {
                return false;
            }
            Core.absdiff(planes.get(1), planes.get(2), diff);
            return Core.countNonZero(diff) == 0;
        }
    }

    private static String normalizeExtension(String ext) {
        String lower = ext.trim().toLowerCase(Locale.ROOT);
        return lower.startsWith(".") ? lower : "." + lower;
    }
}
