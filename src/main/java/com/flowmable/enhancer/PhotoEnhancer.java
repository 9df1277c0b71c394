package com.flowmable.enhancer;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.function.BooleanSupplier;

/**
 * Top-level entry point for the diagnostics and enhancement pipeline.
 * <p>
 * PIPELINE:
 * 1. Measure: detailed statistics of the input.
 * 2. Classify: per-metric severities, score, recommendations.
 * 3. Plan: stage selection with parameters frozen from step 1.
 * 4. Apply: each planned stage in order, each consuming the previous output.
 * 5. Re-measure the output and assemble before/after reports.
 * <p>
 * Holds no per-run state; one instance may serve concurrent runs.
 */
public class PhotoEnhancer {

    private static final Logger logger = LoggerFactory.getLogger(PhotoEnhancer.class);

    private static final BooleanSupplier NEVER = () -> false;

    private final StatisticsEngine statistics;
    private final SeverityClassifier classifier;
    private final AdaptivePlanner planner;

    public PhotoEnhancer() {
        this(EnhancementThresholds.DEFAULT);
    }

    public PhotoEnhancer(EnhancementThresholds thresholds) {
        this.statistics = new StatisticsEngine(thresholds);
        this.classifier = new SeverityClassifier(thresholds);
        this.planner = new AdaptivePlanner(thresholds);
    }

    public DetailedStatistics measure(RasterImage raster) {
        return statistics.analyzeDetailed(raster);
    }

    public DiagnosticsReport analyze(RasterImage raster) {
        return classifier.classify(measure(raster));
    }

    public EnhancementPlan plan(DetailedStatistics stats, DiagnosticsReport report) {
        return planner.plan(stats, report);
    }

    /**
     * Decode an image file and enhance it.
     *
     * @throws IOException if the file cannot be read or decoded
     */
    public EnhancementResult enhance(Path imageFile) throws IOException {
        return enhance(ImageFiles.read(imageFile));
    }

    public EnhancementResult enhance(RasterImage raster) {
        DetailedStatistics stats = measure(raster);
        DiagnosticsReport report = classifier.classify(stats);
        logger.debug("Diagnosed {}: score {}, {} issue(s)", raster, report.overallScore(), report.issuesFound());
        return apply(raster, plan(stats, report));
    }

    public EnhancementResult apply(RasterImage raster, EnhancementPlan plan) {
        return apply(raster, plan, NEVER);
    }

    /**
     * Run the planned stages over {@code raster}.
     * <p>
     * Before each stage the current thread's interrupt flag and
     * {@code abortRequested} are checked; on abort nothing is returned.
     *
     * @throws UnsupportedFormatException if the raster is neither RGB nor RGBA
     * @throws InvalidDimensionsException if width or height is zero
     * @throws EnhancementCancelledException if aborted between stages
     */
    public EnhancementResult apply(RasterImage raster, EnhancementPlan plan, BooleanSupplier abortRequested) {
        StatisticsEngine.validate(raster, plan.stages().isEmpty()
                ? StatisticsEngine.STEP
                : plan.stages().get(0).type().key());
        long start = System.nanoTime();
        RasterImage current = raster;
        List<StageType> applied = new ArrayList<>(plan.stages().size());

        for (EnhancementStage stage : plan.stages()) {
            if (Thread.currentThread().isInterrupted() || abortRequested.getAsBoolean()) {
                throw new EnhancementCancelledException(stage.type());
            }
            long t0 = System.nanoTime();
            current = stage.apply(current);
            applied.add(stage.type());
            if (logger.isDebugEnabled()) {
                logger.debug("  {} {} in {} ms", stage.type().displayName(), stage.parameters(),
                        (System.nanoTime() - t0) / 1_000_000);
            }
        }

        DetailedStatistics after = measure(current);
        DiagnosticsReport afterReport = classifier.classify(after);

        logger.info("Enhanced {} with {} stage(s): score {} -> {}, brightness {} -> {} ({} ms)",
                raster, applied.size(),
                plan.diagnostics().overallScore(), afterReport.overallScore(),
                PhotoStatistics.round2(plan.statistics().brightness()),
                PhotoStatistics.round2(after.brightness()),
                (System.nanoTime() - start) / 1_000_000);

        return new EnhancementResult(
                plan.diagnostics(), afterReport, applied, current,
                plan.statistics(), after);
    }
}
