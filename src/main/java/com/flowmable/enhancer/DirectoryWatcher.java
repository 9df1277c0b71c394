package com.flowmable.enhancer;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.stream.Stream;

/**
 * Polls an input directory and enhances images that are new or changed
 * since they were last processed.
 * <p>
 * A file is picked up only once its size is non-zero and unchanged between
 * two consecutive polls, so files still being copied are left alone.
 */
public class DirectoryWatcher implements AutoCloseable {

    private static final Logger logger = LoggerFactory.getLogger(DirectoryWatcher.class);

    static final String TRACKER_FILE = ".processed_tracker.json";

    private final FileEnhancer fileEnhancer;
    private final Path inputDir;
    private final ProcessedTracker tracker;
    private final Map<String, Long> pendingSizes = new HashMap<>();
    private final AtomicBoolean closed = new AtomicBoolean();
    private final ScheduledExecutorService scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
        Thread t = new Thread(r, "directory-watcher");
        t.setDaemon(true);
        return t;
    });

    public DirectoryWatcher(FileEnhancer fileEnhancer, Path inputDir, Path trackerFile) throws IOException {
        this.fileEnhancer = fileEnhancer;
        this.inputDir = inputDir;
        Files.createDirectories(inputDir);
        Files.createDirectories(fileEnhancer.outputDir());
        this.tracker = ProcessedTracker.load(trackerFile);
    }

    /**
     * Scan once and process every ready, unprocessed image.
     *
     * @return number of images enhanced in this scan
     */
    public synchronized int pollOnce() throws IOException {
        List<Path> images;
        try (Stream<Path> stream = Files.list(inputDir)) {
            images = stream.filter(Files::isRegularFile)
                    .filter(ImageFiles::isSupported)
                    .sorted()
                    .toList();
        }

        // Forget files that disappeared before they became ready
        Set<String> present = images.stream()
                .map(p -> p.getFileName().toString())
                .collect(Collectors.toSet());
        pendingSizes.keySet().retainAll(present);

        int processed = 0;
        for (Path file : images) {
            String name = file.getFileName().toString();
            String fingerprint = ProcessedTracker.fingerprint(file);
            if (tracker.isUpToDate(name, fingerprint)) {
                continue;
            }
            if (!isReady(name, Files.size(file))) {
                continue;
            }

            logger.info("[{}] {} detected, enhancing", tracker.isKnown(name) ? "Modified" : "New", name);
            try {
                Map<String, Object> entry = fileEnhancer.process(file);
                logger.info("  -> {} ({} KB, {} s)", entry.get("output"), entry.get("output_size_kb"),
                        entry.get("processing_time"));
                tracker.markProcessed(name, fingerprint);
                processed++;
            } catch (IOException | EnhancementException e) {
                logger.error("Failed to enhance {}", name, e);
            }
        }
        return processed;
    }

    // Ready once the same non-zero size has been seen on two polls in a row
    private boolean isReady(String name, long size) {
        Long previous = pendingSizes.put(name, size);
        if (size > 0 && previous != null && previous == size) {
            pendingSizes.remove(name);
            return true;
        }
        return false;
    }

    /** Start polling in the background with the given delay between scans. */
    public void start(long interval, TimeUnit unit) {
        logger.info("Watching {} (output {}), every {} {}", inputDir.toAbsolutePath(),
                fileEnhancer.outputDir().toAbsolutePath(), interval, unit.toString().toLowerCase(Locale.ROOT));
        scheduler.scheduleWithFixedDelay(() -> {
            try {
                pollOnce();
            } catch (IOException e) {
                logger.warn("Scan of {} failed", inputDir, e);
            }
        }, 0, interval, unit);
    }

    /** Block until {@link #close()} is called or the thread is interrupted. */
    public void awaitTermination() throws InterruptedException {
        scheduler.awaitTermination(Long.MAX_VALUE, TimeUnit.DAYS);
    }

    public int trackedCount() {
        return tracker.size();
    }

    synchronized int pendingCount() {
        return pendingSizes.size();
    }

    boolean isClosed() {
        return closed.get();
    }

    /** Stop polling. Safe to call more than once (shutdown hook and try-with-resources). */
    @Override
    public void close() {
        if (!closed.compareAndSet(false, true)) {
            return;
        }
        scheduler.shutdownNow();
        logger.info("Watcher stopped. {} photo(s) tracked.", tracker.size());
    }
}
