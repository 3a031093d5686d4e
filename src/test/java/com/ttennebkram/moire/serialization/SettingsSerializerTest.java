package com.ttennebkram.moire.serialization;

import com.google.gson.JsonObject;
import com.ttennebkram.moire.batch.BatchOptions;
import com.ttennebkram.moire.processors.MoireRemovalPipeline;
import com.ttennebkram.moire.processors.MoireSuppressionProcessor;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

public class SettingsSerializerTest {

    @Rule
    public TemporaryFolder folder = new TemporaryFolder();

    private Path writeSettings(String json) throws IOException {
        Path path = folder.getRoot().toPath().resolve("settings.json");
        Files.write(path, json.getBytes(StandardCharsets.UTF_8));
        return path;
    }

    @Test
    public void defaultsAreWrittenUnderStageNames() {
        JsonObject root = SettingsSerializer.toJson(new BatchOptions(), new MoireRemovalPipeline());

        JsonObject batch = root.getAsJsonObject("batch");
        assertEquals(8, batch.get("maxWorkers").getAsInt());
        assertEquals(6, batch.getAsJsonArray("extensions").size());

        JsonObject stages = root.getAsJsonObject("stages");
        assertEquals(7, stages.getAsJsonObject("medianBlur").get("ksize").getAsInt());
        assertEquals(17, stages.getAsJsonObject("topHat").get("kernelSize").getAsInt());
        assertEquals(127, stages.getAsJsonObject("entropyThreshold").get("fallbackThreshold").getAsInt());
        JsonObject axes = stages.getAsJsonObject("axisExclusion");
        assertEquals(23, axes.get("horizontalBandHeight").getAsInt());
        assertEquals(12, axes.get("verticalBandWidth").getAsInt());
        assertTrue(stages.getAsJsonObject("toneCalibration").get("enabled").getAsBoolean());
        assertFalse(stages.has("suppression"));
        assertFalse(stages.has("peakDetector"));
    }

    @Test
    public void savedSettingsLoadIntoFreshPipeline() throws IOException {
        MoireRemovalPipeline tuned = new MoireRemovalPipeline();
        MoireSuppressionProcessor suppression = tuned.getSuppression();
        suppression.getPeakDetector().getMedianBlur().setKernelSize(5);
        suppression.getPeakDetector().getTopHat().setKernelSize(25);
        suppression.getAxisExclusion().setHorizontalBandHeight(31);
        tuned.getToneCalibration().setEnabled(false);
        BatchOptions options = new BatchOptions().setMaxWorkers(3).setExtensions(Arrays.asList(".png", ".tif"));

        Path path = folder.getRoot().toPath().resolve("nested/settings.json");
        SettingsSerializer.save(path, options, tuned);

        MoireRemovalPipeline fresh = new MoireRemovalPipeline();
        BatchOptions loaded = SettingsSerializer.load(path, fresh);

        assertEquals(3, loaded.getMaxWorkers());
        assertEquals(Arrays.asList(".png", ".tif"), loaded.getExtensions());
        assertEquals(5, fresh.getSuppression().getPeakDetector().getMedianBlur().getKernelSize());
        assertEquals(25, fresh.getSuppression().getPeakDetector().getTopHat().getKernelSize());
        assertEquals(31, fresh.getSuppression().getAxisExclusion().getHorizontalBandHeight());
        assertEquals(12, fresh.getSuppression().getAxisExclusion().getVerticalBandWidth());
        assertFalse(fresh.getToneCalibration().isEnabled());
    }

    @Test
    public void partialFileOnlyOverridesWhatItNames() throws IOException {
        Path path = writeSettings("{ \"stages\": { \"axisExclusion\": { \"verticalBandWidth\": 4 } } }");
        MoireRemovalPipeline pipeline = new MoireRemovalPipeline();
        BatchOptions options = SettingsSerializer.load(path, pipeline);

        assertEquals(BatchOptions.DEFAULT_MAX_WORKERS, options.getMaxWorkers());
        assertEquals(BatchOptions.DEFAULT_EXTENSIONS, options.getExtensions());
        assertEquals(4, pipeline.getSuppression().getAxisExclusion().getVerticalBandWidth());
        assertEquals(23, pipeline.getSuppression().getAxisExclusion().getHorizontalBandHeight());
        assertEquals(7, pipeline.getSuppression().getPeakDetector().getMedianBlur().getKernelSize());
    }

    @Test(expected = IOException.class)
    public void malformedJsonIsAnIoError() throws IOException {
        SettingsSerializer.load(writeSettings("{ \"batch\": "), new MoireRemovalPipeline());
    }

    @Test(expected = IOException.class)
    public void nonObjectRootIsAnIoError() throws IOException {
        SettingsSerializer.load(writeSettings("[1, 2, 3]"), new MoireRemovalPipeline());
    }

    @Test(expected = IOException.class)
    public void invalidKernelSizeIsAnIoError() throws IOException {
        SettingsSerializer.load(writeSettings("{ \"stages\": { \"medianBlur\": { \"ksize\": 4 } } }"),
            new MoireRemovalPipeline());
    }

    @Test(expected = IOException.class)
    public void wrongValueTypeIsAnIoError() throws IOException {
        SettingsSerializer.load(writeSettings("{ \"batch\": { \"extensions\": \"png\" } }"), new MoireRemovalPipeline());
    }

    @Test(expected = IOException.class)
    public void missingFileIsAnIoError() throws IOException {
        SettingsSerializer.load(folder.getRoot().toPath().resolve("absent.json"), new MoireRemovalPipeline());
    }
}
