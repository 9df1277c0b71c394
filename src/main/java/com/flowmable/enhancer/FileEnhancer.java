package com.flowmable.enhancer;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Enhances one image file into {@code <name>_enhanced.png} and describes the
 * run as a report entry. Shared by the batch runner and the directory watcher.
 */
public class FileEnhancer {

    private final PhotoEnhancer enhancer;
    private final Path outputDir;

    public FileEnhancer(PhotoEnhancer enhancer, Path outputDir) {
        this.enhancer = enhancer;
        this.outputDir = outputDir;
    }

    public Path outputDir() {
        return outputDir;
    }

    /**
     * @return report entry for the processed file
     * @throws IOException if decoding or writing fails
     * @throws EnhancementException if the decoded raster cannot be processed
     */
    public Map<String, Object> process(Path input) throws IOException {
        long start = System.nanoTime();
        RasterImage raster = ImageFiles.read(input);
        EnhancementResult result = enhancer.enhance(raster);

        Path output = outputDir.resolve(ImageFiles.enhancedName(input));
        ImageFiles.writePng(result.output(), output);
        double seconds = (System.nanoTime() - start) / 1e9;

        Map<String, Object> entry = new LinkedHashMap<>();
        entry.put("input", input.getFileName().toString());
        entry.put("output", output.getFileName().toString());
        entry.put("original_mode", raster.hasAlpha() ? "RGBA" : "RGB");
        entry.put("input_size_kb", kilobytes(Files.size(input)));
        entry.put("output_size_kb", kilobytes(Files.size(output)));
        entry.put("processing_time", Math.round(seconds * 10.0) / 10.0);
        entry.putAll(result.toMap());
        return entry;
    }

    private static double kilobytes(long bytes) {
        return Math.round(bytes / 1024.0 * 10.0) / 10.0;
    }
}
