package com.flowmable.enhancer;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Batch CLI runs against a temporary directory.
 */
class EnhancerDriverTest {

    @TempDir
    Path tmp;

    private final EnhancerDriver driver = new EnhancerDriver();

    private Path writeInput(Path dir, String name, RasterImage raster) throws IOException {
        Path file = dir.resolve(name);
        ImageFiles.writePng(raster, file);
        return file;
    }

    @Test
    void batch_enhancesEveryImageAndWritesReport() throws IOException {
        Path in = Files.createDirectories(tmp.resolve("pic"));
        writeInput(in, "good.png", TestRasters.allGood());
        writeInput(in, "green.png", TestRasters.uniform(6, 6, 150, 200, 150));
        Files.writeString(in.resolve("notes.txt"), "ignored");
        Path out = tmp.resolve("enhanced");

        int code = driver.run(new String[]{in.toString(), "--output", out.toString()});

        assertEquals(0, code);
        assertTrue(Files.isRegularFile(out.resolve("good_enhanced.png")));
        assertTrue(Files.isRegularFile(out.resolve("green_enhanced.png")));

        JsonNode report = new ObjectMapper().readTree(out.resolve(EnhancerDriver.REPORT_NAME).toFile());
        assertEquals(2, report.get("total_images").asInt());
        assertEquals(ReportWriter.OUTPUT_FORMAT, report.get("output_format").asText());
        JsonNode first = report.get("images").get(0);
        assertEquals("good.png", first.get("input").asText(), "Images are processed in name order");
        assertEquals("RGB", first.get("original_mode").asText());
        assertEquals(100, first.get("analysis_before").get("overall_score").asInt());
        assertTrue(first.get("enhancements").isArray());
    }

    @Test
    void batch_customReportPath() throws IOException {
        Path img = writeInput(tmp, "one.png", TestRasters.random(10, 10, RasterImage.RGBA, 4L));
        Path report = tmp.resolve("reports/run.json");

        int code = driver.run(new String[]{img.toString(), "-o", tmp.resolve("out").toString(),
                "--report", report.toString()});

        assertEquals(0, code);
        assertTrue(Files.isRegularFile(report));
        JsonNode json = new ObjectMapper().readTree(report.toFile());
        assertEquals("RGBA", json.get("images").get(0).get("original_mode").asText());
    }

    @Test
    void batch_noImages_exitsWithOne() throws IOException {
        Path empty = Files.createDirectories(tmp.resolve("empty"));
        assertEquals(1, driver.run(new String[]{empty.toString(), "--output", tmp.resolve("o").toString()}));
    }

    @Test
    void batch_undecodableFileIsSkipped() throws IOException {
        Path in = Files.createDirectories(tmp.resolve("mixed"));
        writeInput(in, "ok.png", TestRasters.allGood());
        Files.writeString(in.resolve("bad.jpg"), "garbage");
        Path out = tmp.resolve("out");

        assertEquals(0, driver.run(new String[]{in.toString(), "--output", out.toString()}));
        JsonNode report = new ObjectMapper().readTree(out.resolve(EnhancerDriver.REPORT_NAME).toFile());
        assertEquals(1, report.get("total_images").asInt());
    }

    @Test
    void badArguments_exitWithTwo() {
        assertEquals(2, driver.run(new String[]{"--bogus"}));
        assertEquals(2, driver.run(new String[]{"--output"}));
        assertEquals(2, driver.run(new String[]{"--interval", "0"}));
        assertEquals(2, driver.run(new String[]{"--interval", "soon"}));
    }

    @Test
    void parse_defaults() {
        EnhancerDriver.Options options = EnhancerDriver.parse(new String[0]);
        assertEquals(List.of(EnhancerDriver.DEFAULT_INPUT), options.inputs());
        assertEquals(EnhancerDriver.DEFAULT_OUTPUT, options.outputDir());
        assertEquals(EnhancerDriver.DEFAULT_OUTPUT.resolve(EnhancerDriver.REPORT_NAME), options.reportFile());
        assertFalse(options.watch());
        assertEquals(EnhancerDriver.DEFAULT_INTERVAL_SECONDS, options.intervalSeconds());
    }

    @Test
    void parse_watchOptions() {
        EnhancerDriver.Options options = EnhancerDriver.parse(new String[]{"-w", "--interval", "5", "inbox"});
        assertTrue(options.watch());
        assertEquals(5, options.intervalSeconds());
        assertEquals(List.of(Path.of("inbox")), options.inputs());
    }
}
