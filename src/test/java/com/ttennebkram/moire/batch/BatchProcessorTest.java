package com.ttennebkram.moire.batch;

import com.ttennebkram.moire.processors.MoireRemovalPipeline;
import org.junit.Assume;
import org.junit.Before;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;
import org.opencv.core.CvType;
import org.opencv.core.Mat;
import org.opencv.core.Scalar;
import org.opencv.imgcodecs.Imgcodecs;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.attribute.FileTime;
import java.util.Arrays;
import java.util.Set;
import java.util.TreeSet;
import java.util.stream.Collectors;
import java.util.stream.Stream;

import static org.junit.Assert.assertArrayEquals;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

public class BatchProcessorTest {

    static {
        nu.pattern.OpenCV.loadLocally();
    }

    @Rule
    public TemporaryFolder folder = new TemporaryFolder();

    private Path input;

    /** Relative paths of every file created under the input tree. */
    private static final Set<String> INPUT_FILES = new TreeSet<>(Arrays.asList(
        "cover.png",
        "notes.txt",
        "chapter1/page1.png",
        "chapter1/page2.png",
        "chapter1/photo.png",
        "chapter10/page10.jpg",
        "chapter10/scans/page11.bmp",
        "chapter10/broken.tif"));

    private static Mat grayPage(int seed) {
        Mat page = new Mat(40, 48, CvType.CV_8UC1);
        byte[] data = new byte[40 * 48];
        for (int i = 0; i < data.length; i++) {
            int y = i / 48;
            int x = i % 48;
            double v = 140 + 30 * Math.cos(2 * Math.PI * (9.5 * x / 48.0 + 7.5 * y / 40.0)) + seed;
            data[i] = (byte) Math.max(0, Math.min(255, (int) Math.round(v)));
        }
        page.put(0, 0, data);
        return page;
    }

    private Path file(String relative) throws IOException {
        Path path = input.resolve(relative);
        Files.createDirectories(path.getParent());
        return path;
    }

    @Before
    public void createInputTree() throws IOException {
        input = folder.newFolder("in").toPath();

        Imgcodecs.imwrite(file("cover.png").toString(), grayPage(0));
        Imgcodecs.imwrite(file("chapter1/page1.png").toString(), grayPage(1));
        Imgcodecs.imwrite(file("chapter1/page2.png").toString(), grayPage(2));
        Imgcodecs.imwrite(file("chapter10/page10.jpg").toString(), grayPage(3));
        Imgcodecs.imwrite(file("chapter10/scans/page11.bmp").toString(), grayPage(4));

        Mat photo = new Mat(20, 20, CvType.CV_8UC3, new Scalar(30, 120, 200));
        Imgcodecs.imwrite(file("chapter1/photo.png").toString(), photo);

        Files.write(file("notes.txt"), "reading notes".getBytes(StandardCharsets.UTF_8));
        Files.write(file("chapter10/broken.tif"), new byte[]{1, 2, 3, 4});
    }

    private static Set<String> listFiles(Path root) throws IOException {
        try (Stream<Path> walk = Files.walk(root)) {
            return walk.filter(Files::isRegularFile)
                .map(p -> root.relativize(p).toString().replace('\\', '/'))
                .collect(Collectors.toCollection(TreeSet::new));
        }
    }

    private static BatchProcessor processor(int workers) {
        return new BatchProcessor(new MoireRemovalPipeline(), new BatchOptions().setMaxWorkers(workers));
    }

    @Test
    public void mirrorsTreeWithOneWorker() throws IOException {
        Path output = folder.getRoot().toPath().resolve("out1");
        BatchSummary summary = processor(1).run(input, output);

        assertEquals(INPUT_FILES, listFiles(output));
        assertEquals(5, summary.getProcessed());
        assertEquals(1, summary.getCopied());
        assertEquals(2, summary.getUnreadable());
        assertEquals(0, summary.getFailed());
    }

    @Test
    public void resultSetDoesNotDependOnPoolSize() throws IOException {
        Path out1 = folder.getRoot().toPath().resolve("pool1");
        Path out8 = folder.getRoot().toPath().resolve("pool8");
        processor(1).run(input, out1);
        processor(8).run(input, out8);

        assertEquals(INPUT_FILES, listFiles(out8));
        assertEquals(listFiles(out1), listFiles(out8));
        for (String relative : INPUT_FILES) {
            assertArrayEquals(relative,
                Files.readAllBytes(out1.resolve(relative)), Files.readAllBytes(out8.resolve(relative)));
        }
    }

    @Test
    public void processedPagesKeepFormatAndSize() throws IOException {
        Path output = folder.getRoot().toPath().resolve("out");
        processor(2).run(input, output);

        Mat page = Imgcodecs.imread(output.resolve("chapter1/page1.png").toString(), Imgcodecs.IMREAD_UNCHANGED);
        assertEquals(CvType.CV_8UC1, page.type());
        assertEquals(40, page.rows());
        assertEquals(48, page.cols());
    }

    @Test
    public void colorAndUnreadableFilesAreCopiedByteForByte() throws IOException {
        Path output = folder.getRoot().toPath().resolve("out");
        processor(4).run(input, output);

        for (String relative : Arrays.asList("chapter1/photo.png", "notes.txt", "chapter10/broken.tif")) {
            assertArrayEquals(relative,
                Files.readAllBytes(input.resolve(relative)), Files.readAllBytes(output.resolve(relative)));
            assertEquals(Files.getLastModifiedTime(input.resolve(relative)),
                Files.getLastModifiedTime(output.resolve(relative)));
        }
    }

    @Test
    public void upToDateCopiesAreSkippedOnRerun() throws IOException {
        Path output = folder.getRoot().toPath().resolve("out");
        processor(4).run(input, output);
        BatchSummary second = processor(4).run(input, output);

        assertEquals(5, second.getProcessed());
        assertEquals(3, second.getSkipped());
        assertEquals(0, second.getCopied());
        assertEquals(0, second.getUnreadable());
        assertEquals(8, second.getOutputCount());
    }

    @Test
    public void staleCopyIsReplaced() throws IOException {
        Path output = folder.getRoot().toPath().resolve("out");
        processor(1).run(input, output);

        Path notes = input.resolve("notes.txt");
        Files.write(notes, "revised notes".getBytes(StandardCharsets.UTF_8));
        Files.setLastModifiedTime(notes, FileTime.fromMillis(System.currentTimeMillis() + 60_000));

        BatchSummary second = processor(1).run(input, output);
        assertEquals(1, second.getUnreadable());
        assertEquals("revised notes", new String(Files.readAllBytes(output.resolve("notes.txt")), StandardCharsets.UTF_8));
    }

    @Test
    public void failingFileDoesNotAbortBatch() throws IOException {
        Path output = folder.getRoot().toPath().resolve("out");
        // An old, non-empty directory where notes.txt should be copied
        Path blocker = output.resolve("notes.txt");
        Files.createDirectories(blocker.resolve("child"));
        Files.setLastModifiedTime(blocker, FileTime.fromMillis(0));

        BatchSummary summary = processor(3).run(input, output);

        assertEquals(1, summary.getFailed());
        assertEquals(5, summary.getProcessed());
        assertEquals(1, summary.getCopied());
        assertEquals(1, summary.getUnreadable());
        assertTrue(Files.isRegularFile(output.resolve("chapter10/broken.tif")));
    }

    @Test
    public void stopBeforeRunCancelsEveryUnit() throws IOException {
        Path output = folder.getRoot().toPath().resolve("out");
        BatchProcessor processor = processor(2);
        processor.requestStop();
        assertTrue(processor.isStopRequested());

        BatchSummary summary = processor.run(input, output);
        assertEquals(INPUT_FILES.size(), summary.getCancelled());
        assertEquals(0, summary.getOutputCount());
        assertTrue(listFiles(output).isEmpty());
        // Directory structure is still mirrored
        assertTrue(Files.isDirectory(output.resolve("chapter10/scans")));
    }

    @Test
    public void outputNestedInInputIsNotReprocessed() throws IOException {
        Path output = input.resolve("cleaned");
        BatchSummary first = processor(2).run(input, output);
        BatchSummary second = processor(2).run(input, output);

        assertEquals(first.getProcessed(), second.getProcessed());
        assertEquals(INPUT_FILES, listFiles(output));
        assertFalse(Files.exists(output.resolve("cleaned")));
    }

    @Test
    public void linkBackToInputRootIsNotFollowed() throws IOException {
        try {
            Files.createSymbolicLink(input.resolve("chapter1/loop"), input);
        } catch (UnsupportedOperationException | IOException e) {
            Assume.assumeNoException("symbolic links unavailable", e);
        }
        Path output = folder.getRoot().toPath().resolve("out");
        BatchSummary summary = processor(2).run(input, output);

        assertEquals(INPUT_FILES, listFiles(output));
        assertEquals(INPUT_FILES.size(), summary.getOutputCount());
        assertFalse(Files.exists(output.resolve("chapter1/loop")));
    }

    @Test
    public void emptyInputProducesEmptyOutput() throws IOException {
        Path empty = folder.newFolder("empty").toPath();
        Path output = folder.getRoot().toPath().resolve("emptyOut");
        BatchSummary summary = processor(8).run(empty, output);
        assertEquals(0, summary.getOutputCount());
        assertTrue(Files.isDirectory(output));
    }

    @Test(expected = NoSuchFileException.class)
    public void missingInputDirectoryIsRejected() throws IOException {
        processor(1).run(folder.getRoot().toPath().resolve("missing"), folder.getRoot().toPath().resolve("out"));
    }

    @Test
    public void logCountsEveryOutcome() throws IOException {
        BatchLog log = new BatchLog();
        processor(2).run(input, folder.getRoot().toPath().resolve("out"), log);
        BatchSummary summary = log.summary();
        assertEquals(8, summary.getProcessed() + summary.getCopied() + summary.getUnreadable());
    }

    @Test(expected = IllegalArgumentException.class)
    public void rejectsZeroWorkers() {
        new BatchOptions().setMaxWorkers(0);
    }
}
