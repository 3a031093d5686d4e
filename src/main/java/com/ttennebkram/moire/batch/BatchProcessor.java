package com.ttennebkram.moire.batch;

import com.ttennebkram.moire.processors.MoireRemovalPipeline;
import com.ttennebkram.moire.processors.SuppressionResult;
import org.opencv.imgcodecs.Imgcodecs;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.LinkOption;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Mirrors an input directory tree into an output tree, removing moire from every
 * grayscale page and copying everything else through unchanged.
 *
 * The calling thread enumerates all work units first (creating output directories as
 * it goes), then submits them to a fixed pool of worker threads and waits for all of
 * them. A unit is one input file; units share nothing but the output tree.
 *
 * {@link #requestStop()} may be called from any thread. Units that have not started
 * when it is observed are counted as cancelled; running units finish normally.
 */
public class BatchProcessor {

    private final MoireRemovalPipeline pipeline;
    private final BatchOptions options;
    private final ImageClassifier classifier;
    private final AtomicBoolean stopRequested = new AtomicBoolean(false);

    public BatchProcessor(MoireRemovalPipeline pipeline, BatchOptions options) {
        this.pipeline = pipeline;
        this.options = options;
        this.classifier = new ImageClassifier(options.getExtensions());
    }

    public void requestStop() {
        stopRequested.set(true);
    }

    public boolean isStopRequested() {
        return stopRequested.get();
    }

    public BatchSummary run(Path inputRoot, Path outputRoot) throws IOException {
        return run(inputRoot, outputRoot, new BatchLog());
    }

    /**
     * Process a whole tree.
     *
     * @throws NoSuchFileException if the input directory does not exist
     * @throws IOException         if the tree cannot be listed or an output directory cannot be created
     */
    public BatchSummary run(Path inputRoot, Path outputRoot, BatchLog log) throws IOException {
        if (!Files.isDirectory(inputRoot)) {
            throw new NoSuchFileException(inputRoot.toString(), null, "input directory does not exist");
        }
        Path in = inputRoot.toAbsolutePath().normalize();
        Path out = outputRoot.toAbsolutePath().normalize();
        long start = System.currentTimeMillis();

        Files.createDirectories(out);
        List<WorkUnit> units = new ArrayList<>();
        collect(in, in, out, units, log);

        int workers = options.getMaxWorkers();
        log.started(in, out, units.size(), workers);

        ExecutorService pool = Executors.newFixedThreadPool(workers, new WorkerThreadFactory());
        try {
            List<Future<?>> futures = new ArrayList<>();
            for (WorkUnit unit : units) {
                futures.add(pool.submit(() -> runUnit(unit, log)));
            }
            boolean interrupted = false;
            for (int i = 0; i < futures.size(); i++) {
                interrupted |= awaitUnit(futures.get(i), units.get(i), log);
            }
            if (interrupted) {
                Thread.currentThread().interrupt();
            }
        } finally {
            pool.shutdown();
        }

        return log.finished(System.currentTimeMillis() - start);
    }

    /**
     * Wait for one unit. An interrupt turns into a stop request and the wait continues,
     * so every submitted unit is accounted for exactly once.
     *
     * @return whether the waiting thread was interrupted
     */
    private boolean awaitUnit(Future<?> future, WorkUnit unit, BatchLog log) {
        boolean interrupted = false;
        while (true) {
            try {
                future.get();
                return interrupted;
            } catch (InterruptedException e) {
                interrupted = true;
                requestStop();
            } catch (ExecutionException e) {
                // runUnit contains its own failures; only an Error gets here
                log.failed(unit.relative, e);
                return interrupted;
            }
        }
    }

    /**
     * Depth-first enumeration in natural order, files of a directory before its
     * subdirectories. Output directories are created here, before any file beneath
     * them is dispatched.
     */
    private void collect(Path inputRoot, Path dir, Path outputRoot, List<WorkUnit> units, BatchLog log)
            throws IOException {
        List<Path> entries;
        try (Stream<Path> listing = Files.list(dir)) {
            entries = listing
                .sorted(Comparator.comparing((Path p) -> p.getFileName().toString(), NaturalOrderComparator.INSTANCE))
                .collect(Collectors.toList());
        }

        List<Path> subdirectories = new ArrayList<>();
        for (Path entry : entries) {
            if (Files.isSymbolicLink(entry) && Files.isDirectory(entry)) {
                // Linked directories are not descended; a link back up the tree would never end
                continue;
            }
            if (Files.isDirectory(entry, LinkOption.NOFOLLOW_LINKS)) {
                // Output tree nested inside the input tree is not input
                if (!entry.equals(outputRoot)) {
                    subdirectories.add(entry);
                }
            } else if (Files.isRegularFile(entry)) {
                Path relative = inputRoot.relativize(entry);
                units.add(new WorkUnit(entry, outputRoot.resolve(relative.toString()), relative));
            }
        }

        for (Path sub : subdirectories) {
            Path target = outputRoot.resolve(inputRoot.relativize(sub).toString());
            Files.createDirectories(target);
            log.directoryCreated(target);
            collect(inputRoot, sub, outputRoot, units, log);
        }
    }

    private void runUnit(WorkUnit unit, BatchLog log) {
        if (stopRequested.get()) {
            log.cancelled(unit.relative);
            return;
        }
        processFile(unit, log);
    }

    /**
     * Classify and dispatch one file. Every failure stays inside this unit.
     */
    void processFile(WorkUnit unit, BatchLog log) {
        try (ClassifiedImage classified = classifier.classify(unit.source)) {
            // Idempotent; another worker may be creating the same directory
            Files.createDirectories(unit.target.getParent());

            classified.accept(new ClassifiedImage.Visitor<Void>() {
                @Override
                public Void grayscale(ClassifiedImage.Grayscale image) throws IOException {
                    try (SuppressionResult result = pipeline.removeMoire(image.getPage())) {
                        if (!Imgcodecs.imwrite(unit.target.toString(), result.getImage())) {
                            throw new IOException("No image encoder wrote " + unit.target);
                        }
                        log.processed(unit.relative, result);
                    }
                    return null;
                }

                @Override
                public Void nonGrayscale(ClassifiedImage.NonGrayscale image) throws IOException {
                    if (copyThrough(unit.source, unit.target)) {
                        log.copied(unit.relative, image.getLayout());
                    } else {
                        log.upToDate(unit.relative);
                    }
                    return null;
                }

                @Override
                public Void unreadable(ClassifiedImage.Unreadable image) throws IOException {
                    if (copyThrough(unit.source, unit.target)) {
                        log.unreadable(unit.relative, image.getReason());
                    } else {
                        log.upToDate(unit.relative);
                    }
                    return null;
                }
            });
        } catch (IOException | RuntimeException e) {
            log.failed(unit.relative, e);
        }
    }

    /**
     * Byte-for-byte copy that keeps the source modification time.
     *
     * @return false if the target already exists and is not older than the source
     */
    static boolean copyThrough(Path source, Path target) throws IOException {
        if (Files.exists(target)
                && Files.getLastModifiedTime(target).compareTo(Files.getLastModifiedTime(source)) >= 0) {
            return false;
        }
        Files.copy(source, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.COPY_ATTRIBUTES);
        return true;
    }

    static final class WorkUnit {
        final Path source;
        final Path target;
        final Path relative;

        WorkUnit(Path source, Path target, Path relative) {
            this.source = source;
            this.target = target;
            this.relative = relative;
        }
    }

    private static final class WorkerThreadFactory implements ThreadFactory {
        private final AtomicInteger counter = new AtomicInteger();

        @Override
        public Thread newThread(Runnable r) {
            return new Thread(r, "moire-worker-" + counter.incrementAndGet());
        }
    }
}
