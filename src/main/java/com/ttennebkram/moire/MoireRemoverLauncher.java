package com.ttennebkram.moire;

import com.ttennebkram.moire.batch.BatchOptions;
import com.ttennebkram.moire.batch.BatchProcessor;
import com.ttennebkram.moire.batch.BatchSummary;
import com.ttennebkram.moire.processors.MoireRemovalPipeline;
import com.ttennebkram.moire.serialization.SettingsSerializer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;

/**
 * Command line entry point: remove moire from every grayscale page under an input
 * directory, mirroring the tree into an output directory.
 */
public class MoireRemoverLauncher {

    private static final Logger logger = LoggerFactory.getLogger(MoireRemoverLauncher.class);

    static final int EXIT_OK = 0;
    static final int EXIT_USAGE = 1;
    static final int EXIT_BAD_CONFIG = 2;

    public static void main(String[] args) {
        System.exit(run(args));
    }

    /**
     * Parse arguments and run one batch.
     *
     * @return process exit code
     */
    static int run(String[] args) {
        Integer maxWorkers = null;
        String configFile = null;
        String saveConfigFile = null;
        List<String> positional = new ArrayList<>();

        for (int i = 0; i < args.length; i++) {
            String param = args[i];
            if ("-h".equals(param) || "--help".equals(param)) {
                printHelp();
                return EXIT_OK;
            } else if ("--max_workers".equals(param)) {
                if (i + 1 < args.length) {
                    try {
                        maxWorkers = Integer.parseInt(args[++i]);
                    } catch (NumberFormatException e) {
                        System.err.println("Error: --max_workers requires a numeric value");
                        return EXIT_USAGE;
                    }
                    if (maxWorkers < 1) {
                        System.err.println("Error: --max_workers must be at least 1");
                        return EXIT_USAGE;
                    }
                } else {
                    System.err.println("Error: --max_workers requires a value");
                    return EXIT_USAGE;
                }
            } else if ("--config".equals(param)) {
                if (i + 1 < args.length) {
                    configFile = args[++i];
                } else {
                    System.err.println("Error: --config requires a settings file path");
                    return EXIT_USAGE;
                }
            } else if ("--save_config".equals(param)) {
                if (i + 1 < args.length) {
                    saveConfigFile = args[++i];
                } else {
                    System.err.println("Error: --save_config requires a settings file path");
                    return EXIT_USAGE;
                }
            } else if (!param.startsWith("-")) {
                positional.add(param);
            } else {
                System.err.println("Unknown option: " + param);
                printHelp();
                return EXIT_USAGE;
            }
        }

        if (positional.size() != 2) {
            System.err.println("Error: expected <input_dir> <output_dir>");
            printHelp();
            return EXIT_USAGE;
        }
        Path inputDir = Paths.get(positional.get(0));
        Path outputDir = Paths.get(positional.get(1));
        if (!Files.isDirectory(inputDir)) {
            System.err.println("Error: input directory does not exist: " + inputDir);
            return EXIT_USAGE;
        }

        nu.pattern.OpenCV.loadLocally();

        MoireRemovalPipeline pipeline = new MoireRemovalPipeline();
        BatchOptions options;
        if (configFile != null) {
            try {
                options = SettingsSerializer.load(Paths.get(configFile), pipeline);
            } catch (IOException e) {
                System.err.println("Error: cannot read settings: " + e.getMessage());
                return EXIT_BAD_CONFIG;
            }
        } else {
            options = new BatchOptions();
        }
        if (maxWorkers != null) {
            options.setMaxWorkers(maxWorkers);
        }

        if (saveConfigFile != null) {
            try {
                SettingsSerializer.save(Paths.get(saveConfigFile), options, pipeline);
                logger.info("Saved settings to {}", saveConfigFile);
            } catch (IOException e) {
                System.err.println("Error: cannot write settings: " + e.getMessage());
                return EXIT_BAD_CONFIG;
            }
        }

        try {
            BatchSummary summary = new BatchProcessor(pipeline, options).run(inputDir, outputDir);
            System.out.println(summary);
            System.out.println("Processing complete.");
            return EXIT_OK;
        } catch (IOException e) {
            logger.error("Batch aborted: {}", e.getMessage(), e);
            System.err.println("Error: " + e.getMessage());
            return EXIT_USAGE;
        }
    }

    private static void printHelp() {
        System.out.println("Usage: moire-remover [options] <input_dir> <output_dir>");
        System.out.println();
        System.out.println("Removes periodic moire patterns from grayscale scans. Color and");
        System.out.println("unreadable files are copied through unchanged.");
        System.out.println();
        System.out.println("Options:");
        System.out.println("  --max_workers N        Number of worker threads (default " + BatchOptions.DEFAULT_MAX_WORKERS + ")");
        System.out.println("  --config FILE          Load batch and stage settings from a JSON file");
        System.out.println("  --save_config FILE     Write the effective settings to a JSON file");
        System.out.println("  -h, --help             Show this help message");
        System.out.println();
        System.out.println("Exit codes: 0 success, 1 bad arguments or missing input directory, 2 bad settings file");
    }
}
