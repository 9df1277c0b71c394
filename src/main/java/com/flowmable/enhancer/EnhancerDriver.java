package com.flowmable.enhancer;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.TimeUnit;
import java.util.stream.Stream;

/**
 * CLI driver: batch-enhances photos into lossless PNGs with a JSON report,
 * or watches a directory and enhances photos as they arrive.
 * <p>
 * Usage: {@code EnhancerDriver [--output DIR] [--report FILE] [--watch] [--interval SECONDS] [INPUT...]}
 * <p>
 * Inputs may be files or directories; the default input is {@code pic/}.
 */
public class EnhancerDriver {

    private static final Logger logger = LoggerFactory.getLogger(EnhancerDriver.class);

    static final Path DEFAULT_INPUT = Path.of("pic");
    static final Path DEFAULT_OUTPUT = Path.of("enhanced");
    static final String REPORT_NAME = "enhancement_report.json";
    static final long DEFAULT_INTERVAL_SECONDS = 2;

    record Options(List<Path> inputs, Path outputDir, Path reportFile, boolean watch, long intervalSeconds) {}

    private final PhotoEnhancer enhancer;
    private final ReportWriter reportWriter = new ReportWriter();

    public EnhancerDriver() {
        this(new PhotoEnhancer());
    }

    public EnhancerDriver(PhotoEnhancer enhancer) {
        this.enhancer = enhancer;
    }

    public static void main(String[] args) {
        int code = new EnhancerDriver().run(args);
        if (code != 0) {
            System.exit(code);
        }
    }

    /**
     * @return process exit code: 0 on success, 1 when no image was found, 2 on bad arguments
     */
    public int run(String[] args) {
        Options options;
        try {
            options = parse(args);
        } catch (IllegalArgumentException e) {
            logger.error(e.getMessage());
            System.err.println("Usage: EnhancerDriver [--output DIR] [--report FILE] [--watch] [--interval SECONDS] [INPUT...]");
            return 2;
        }

        try {
            return options.watch() ? watch(options) : batch(options);
        } catch (IOException e) {
            logger.error("Enhancement run failed", e);
            return 1;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return 0;
        }
    }

    static Options parse(String[] args) {
        List<Path> inputs = new ArrayList<>();
        Path output = DEFAULT_OUTPUT;
        Path report = null;
        boolean watch = false;
        long interval = DEFAULT_INTERVAL_SECONDS;

        for (int i = 0; i < args.length; i++) {
            String arg = args[i];
            switch (arg) {
                case "--output", "-o" -> output = Path.of(value(args, ++i, arg));
                case "--report" -> report = Path.of(value(args, ++i, arg));
                case "--watch", "-w" -> watch = true;
                case "--interval" -> {
                    String v = value(args, ++i, arg);
                    try {
                        interval = Long.parseLong(v);
                    } catch (NumberFormatException e) {
                        throw new IllegalArgumentException("Invalid --interval: " + v, e);
                    }
                    if (interval <= 0) {
                        throw new IllegalArgumentException("--interval must be positive: " + v);
                    }
                }
                default -> {
                    if (arg.startsWith("-")) {
                        throw new IllegalArgumentException("Unknown option: " + arg);
                    }
                    inputs.add(Path.of(arg));
                }
            }
        }
        if (inputs.isEmpty()) {
            inputs.add(DEFAULT_INPUT);
        }
        if (report == null) {
            report = output.resolve(REPORT_NAME);
        }
        return new Options(List.copyOf(inputs), output, report, watch, interval);
    }

    private static String value(String[] args, int i, String option) {
        if (i >= args.length) {
            throw new IllegalArgumentException("Missing value for " + option);
        }
        return args[i];
    }

    private int batch(Options options) throws IOException {
        List<Path> images = findImages(options.inputs());
        if (images.isEmpty()) {
            logger.error("No images found in {}", options.inputs());
            return 1;
        }

        logger.info("Found {} image(s) to enhance, output directory {}", images.size(),
                options.outputDir().toAbsolutePath());
        FileEnhancer fileEnhancer = new FileEnhancer(enhancer, options.outputDir());

        List<Map<String, Object>> entries = new ArrayList<>();
        for (int i = 0; i < images.size(); i++) {
            Path file = images.get(i);
            logger.info(">>> Image {}/{}: {}", i + 1, images.size(), file.getFileName());
            try {
                entries.add(fileEnhancer.process(file));
            } catch (IOException | EnhancementException e) {
                logger.warn("Skipping {}", file, e);
            }
        }

        reportWriter.write(options.reportFile(),
                reportWriter.batchReport(options.outputDir(), entries));
        printSummary(entries, options);
        return 0;
    }

    private int watch(Options options) throws IOException, InterruptedException {
        Path inputDir = options.inputs().get(0);
        if (options.inputs().size() > 1 || (Files.exists(inputDir) && !Files.isDirectory(inputDir))) {
            throw new IOException("--watch expects a single input directory, got " + options.inputs());
        }
        FileEnhancer fileEnhancer = new FileEnhancer(enhancer, options.outputDir());
        try (DirectoryWatcher watcher = new DirectoryWatcher(
                fileEnhancer, inputDir, inputDir.resolve(DirectoryWatcher.TRACKER_FILE))) {
            Runtime.getRuntime().addShutdownHook(new Thread(watcher::close, "watcher-shutdown"));
            watcher.start(options.intervalSeconds(), TimeUnit.SECONDS);
            watcher.awaitTermination();
        }
        return 0;
    }

    static List<Path> findImages(List<Path> inputs) throws IOException {
        List<Path> images = new ArrayList<>();
        for (Path input : inputs) {
            if (Files.isDirectory(input)) {
                try (Stream<Path> stream = Files.list(input)) {
                    stream.filter(Files::isRegularFile)
                            .filter(ImageFiles::isSupported)
                            .sorted()
                            .forEach(images::add);
                }
            } else if (Files.isRegularFile(input) && ImageFiles.isSupported(input)) {
                images.add(input);
            } else {
                logger.warn("Ignoring {}: not a supported image or directory", input);
            }
        }
        return images;
    }

    @SuppressWarnings("unchecked")
    private static void printSummary(List<Map<String, Object>> entries, Options options) {
        System.out.println("═══════════════════════════════════════════════════════════");
        System.out.println("  ENHANCEMENT SUMMARY");
        System.out.println("═══════════════════════════════════════════════════════════");
        System.out.printf("  Images enhanced : %d%n", entries.size());
        System.out.printf("  Output format   : %s%n", ReportWriter.OUTPUT_FORMAT);
        System.out.printf("  Output directory: %s%n", options.outputDir().toAbsolutePath());
        System.out.printf("  Report          : %s%n", options.reportFile().toAbsolutePath());
        for (Map<String, Object> entry : entries) {
            Map<String, Object> before = (Map<String, Object>) entry.get("analysis_before");
            Map<String, Object> after = (Map<String, Object>) entry.get("analysis_after");
            System.out.printf("%n  %s%n", entry.get("input"));
            System.out.printf("     -> %s (%s KB)%n", entry.get("output"), entry.get("output_size_kb"));
            System.out.printf("     Score: %s -> %s%n", before.get("overall_score"), after.get("overall_score"));
            System.out.printf("     Stages: %s%n", String.join(", ", (List<String>) entry.get("enhancements")));
        }
        System.out.println("═══════════════════════════════════════════════════════════");
    }
}
