package com.ttennebkram.moire.util;

import org.opencv.core.Mat;

import java.util.ArrayDeque;
import java.util.Deque;

/**
 * Scope for native OpenCV Mats that must be released when a processing step ends.
 *
 * Usage:
 * <pre>
 * try (MatReleaser releaser = new MatReleaser()) {
 *     Mat planes = releaser.track(new Mat());
 *     ...
 *     return releaser.keep(result);
 * }
 * </pre>
 *
 * Mats are released in reverse order of tracking. A Mat handed to {@link #keep(Mat)}
 * is removed from the scope and becomes the caller's responsibility.
 *
 * Instances are not thread-safe; each processing call owns its own scope.
 */
public class MatReleaser implements AutoCloseable {

    private final Deque<Mat> tracked = new ArrayDeque<>();

    /**
     * Track a Mat for release at the end of the scope.
     *
     * @return the same Mat, for inline use
     */
    public Mat track(Mat mat) {
        if (mat != null) {
            tracked.push(mat);
        }
        return mat;
    }

    /**
     * Track every Mat of a list (e.g. the planes produced by Core.split).
     */
    public <T extends Iterable<Mat>> T trackAll(T mats) {
        for (Mat mat : mats) {
            track(mat);
        }
        return mats;
    }

    /**
     * Remove a Mat from the scope so it survives close().
     */
    public Mat keep(Mat mat) {
        tracked.removeIf(m -> m == mat);
        return mat;
    }

    /**
     * Number of Mats that will be released on close.
     */
    public int size() {
        return tracked.size();
    }

    @Override
    public void close() {
        while (!tracked.isEmpty()) {
            tracked.pop().release();
        }
    }
}
