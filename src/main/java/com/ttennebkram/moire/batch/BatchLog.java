package com.ttennebkram.moire.batch;

import com.ttennebkram.moire.processors.SuppressionResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Log handle for one batch run.
 *
 * Created once per run and handed to every work unit. Emits one line per file
 * outcome and keeps per-outcome counters; both are safe to call from worker threads.
 */
public class BatchLog {

    private final Logger logger;

    private final AtomicInteger processed = new AtomicInteger();
    private final AtomicInteger copied = new AtomicInteger();
    private final AtomicInteger skipped = new AtomicInteger();
    private final AtomicInteger unreadable = new AtomicInteger();
    private final AtomicInteger failed = new AtomicInteger();
    private final AtomicInteger cancelled = new AtomicInteger();
    private final AtomicInteger fallbacks = new AtomicInteger();

    public BatchLog() {
        this(LoggerFactory.getLogger(BatchLog.class));
    }

    public BatchLog(Logger logger) {
        this.logger = logger;
    }

    public void started(Path inputRoot, Path outputRoot, int units, int workers) {
        logger.info("Processing {} files from {} into {} with {} workers", units, inputRoot, outputRoot, workers);
    }

    public void directoryCreated(Path dir) {
        logger.debug("Ensured output directory {}", dir);
    }

    public void processed(Path relative, SuppressionResult result) {
        processed.incrementAndGet();
        if (result.isFallback()) {
            fallbacks.incrementAndGet();
            logger.warn("{}: no entropy split in spectrum histogram, used fallback threshold {}",
                relative, result.getThreshold());
        }
        logger.info("Processed {} (threshold={}, suppressed={} spectrum pixels)",
            relative, result.getThreshold(), result.getSuppressedPixels());
    }

    public void copied(Path relative, String layout) {
        copied.incrementAndGet();
        logger.info("Copied {} ({})", relative, layout);
    }

    public void upToDate(Path relative) {
        skipped.incrementAndGet();
        logger.debug("Skipped {}: output is up to date", relative);
    }

    public void unreadable(Path relative, String reason) {
        unreadable.incrementAndGet();
        logger.warn("Copied {} unchanged: {}", relative, reason);
    }

    public void failed(Path relative, Exception e) {
        failed.incrementAndGet();
        logger.error("Failed to process {}: {}", relative, e.getMessage(), e);
    }

    public void cancelled(Path relative) {
        cancelled.incrementAndGet();
        logger.debug("Not started {}: stop requested", relative);
    }

    public BatchSummary summary() {
        return new BatchSummary(processed.get(), copied.get(), skipped.get(), unreadable.get(),
            failed.get(), cancelled.get(), fallbacks.get());
    }

    public BatchSummary finished(long elapsedMillis) {
        BatchSummary summary = summary();
        logger.info("Batch finished in {} ms: {}", elapsedMillis, summary);
        return summary;
    }
}
