package com.flowmable.enhancer;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDateTime;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Writes the batch JSON report from the map form of the results.
 */
public class ReportWriter {

    static final String TOOL_NAME = "photo-enhancer " + EnhancementThresholds.THRESHOLDS_VERSION;
    static final String OUTPUT_FORMAT = "PNG (lossless, optimized)";

    private final ObjectMapper mapper = new ObjectMapper()
            .enable(SerializationFeature.INDENT_OUTPUT);

    public Map<String, Object> batchReport(Path outputDir, List<Map<String, Object>> images) {
        Map<String, Object> report = new LinkedHashMap<>();
        report.put("agent", TOOL_NAME);
        report.put("timestamp", LocalDateTime.now().toString());
        report.put("total_images", images.size());
        report.put("output_format", OUTPUT_FORMAT);
        report.put("output_directory", outputDir.toAbsolutePath().toString());
        report.put("images", images);
        return report;
    }

    public void write(Path reportFile, Map<String, Object> report) throws IOException {
        Path parent = reportFile.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        mapper.writeValue(reportFile.toFile(), report);
    }

    public String toJson(Map<String, Object> report) throws IOException {
        return mapper.writeValueAsString(report);
    }
}
