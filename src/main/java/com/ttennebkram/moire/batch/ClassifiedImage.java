package com.ttennebkram.moire.batch;

import org.opencv.core.Mat;

import java.io.IOException;
import java.nio.file.Path;

/**
 * Result of classifying one input file. Exactly one of three variants:
 * <ul>
 *   <li>{@link Grayscale} - decoded single-channel page, ready for moire removal</li>
 *   <li>{@link NonGrayscale} - decodable but not grayscale, copied through unchanged</li>
 *   <li>{@link Unreadable} - not a supported or decodable image, copied through unchanged</li>
 * </ul>
 * The constructor is private, so the three nested classes are the only variants and
 * {@link Visitor} dispatch is exhaustive.
 */
public abstract class ClassifiedImage implements AutoCloseable {

    /**
     * Exhaustive dispatch over the variants.
     */
    public interface Visitor<R> {
        R grayscale(Grayscale image) throws IOException;

        R nonGrayscale(NonGrayscale image) throws IOException;

        R unreadable(Unreadable image) throws IOException;
    }

    private final Path source;

    private ClassifiedImage(Path source) {
        this.source = source;
    }

    public Path getSource() {
        return source;
    }

    public abstract <R> R accept(Visitor<R> visitor) throws IOException;

    /**
     * Release any decoded pixel data.
     */
    @Override
    public void close() {
    }

    public static Grayscale grayscale(Path source, Mat page) {
        return new Grayscale(source, page);
    }

    public static NonGrayscale nonGrayscale(Path source, String layout) {
        return new NonGrayscale(source, layout);
    }

    public static Unreadable unreadable(Path source, String reason) {
        return new Unreadable(source, reason);
    }

    /**
     * A page whose pixels all have equal channel values, reduced to one CV_8UC1 channel.
     */
    public static final class Grayscale extends ClassifiedImage {
        private final Mat page;

        private Grayscale(Path source, Mat page) {
            super(source);
            this.page = page;
        }

        public Mat getPage() {
            return page;
        }

        @Override
        public <R> R accept(Visitor<R> visitor) throws IOException {
            return visitor.grayscale(this);
        }

        @Override
        public void close() {
            page.release();
        }
    }

    /**
     * A color image or an image with a channel layout / depth the pipeline does not handle.
     * The payload is the source file itself, copied byte for byte.
     */
    public static final class NonGrayscale extends ClassifiedImage {
        private final String layout;

        private NonGrayscale(Path source, String layout) {
            super(source);
            this.layout = layout;
        }

        /**
         * Human readable channel layout, e.g. "3-channel color" or "16-bit depth".
         */
        public String getLayout() {
            return layout;
        }

        @Override
        public <R> R accept(Visitor<R> visitor) throws IOException {
            return visitor.nonGrayscale(this);
        }
    }

    /**
     * A file that is not an accepted image type or cannot be decoded.
     */
    public static final class Unreadable extends ClassifiedImage {
        private final String reason;

        private Unreadable(Path source, String reason) {
            super(source);
            this.reason = reason;
        }

        public String getReason() {
            return reason;
        }

        @Override
        public <R> R accept(Visitor<R> visitor) throws IOException {
            return visitor.unreadable(this);
        }
    }
}
