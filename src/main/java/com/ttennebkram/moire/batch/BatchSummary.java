package com.ttennebkram.moire.batch;

/**
 * Per-outcome file counts of a finished batch run.
 */
public class BatchSummary {

    private final int processed;
    private final int copied;
    private final int skipped;
    private final int unreadable;
    private final int failed;
    private final int cancelled;
    private final int fallbackThresholds;

    public BatchSummary(int processed, int copied, int skipped, int unreadable,
                        int failed, int cancelled, int fallbackThresholds) {
        this.processed = processed;
        this.copied = copied;
        this.skipped = skipped;
        this.unreadable = unreadable;
        this.failed = failed;
        this.cancelled = cancelled;
        this.fallbackThresholds = fallbackThresholds;
    }

    /** Grayscale pages run through moire removal. */
    public int getProcessed() {
        return processed;
    }

    /** Files copied through (non-grayscale or unreadable). */
    public int getCopied() {
        return copied;
    }

    /** Copy-through files whose output was already up to date. */
    public int getSkipped() {
        return skipped;
    }

    /** Files that could not be decoded or are not an accepted image type. */
    public int getUnreadable() {
        return unreadable;
    }

    public int getFailed() {
        return failed;
    }

    /** Files not started because a stop was requested. */
    public int getCancelled() {
        return cancelled;
    }

    /** Processed pages whose peak threshold came from the degenerate-histogram fallback. */
    public int getFallbackThresholds() {
        return fallbackThresholds;
    }

    /**
     * Files that have an output after this run.
     */
    public int getOutputCount() {
        return processed + copied + skipped;
    }

    @Override
    public String toString() {
        return String.format("processed=%d copied=%d skipped=%d unreadable=%d failed=%d cancelled=%d fallbackThresholds=%d",
            processed, copied, skipped, unreadable, failed, cancelled, fallbackThresholds);
    }
}
