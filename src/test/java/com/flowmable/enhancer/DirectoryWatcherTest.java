package com.flowmable.enhancer;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.FileTime;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Polling, readiness and change detection of the watch mode.
 */
class DirectoryWatcherTest {

    @TempDir
    Path tmp;

    private DirectoryWatcher newWatcher(Path in, Path out) throws IOException {
        return new DirectoryWatcher(new FileEnhancer(new PhotoEnhancer(), out), in,
                in.resolve(DirectoryWatcher.TRACKER_FILE));
    }

    @Test
    void newFile_processedOnceSizeIsStable() throws IOException {
        Path in = tmp.resolve("inbox");
        Path out = tmp.resolve("out");
        try (DirectoryWatcher watcher = newWatcher(in, out)) {
            ImageFiles.writePng(TestRasters.allGood(), in.resolve("shot.png"));

            assertEquals(0, watcher.pollOnce(), "First sighting only records the size");
            assertEquals(1, watcher.pollOnce());
            assertEquals(0, watcher.pollOnce(), "Already up to date");
            assertEquals(1, watcher.trackedCount());
        }
        assertTrue(Files.isRegularFile(out.resolve("shot_enhanced.png")));
        assertTrue(Files.isRegularFile(in.resolve(DirectoryWatcher.TRACKER_FILE)));
    }

    @Test
    void modifiedFile_isReprocessed() throws IOException {
        Path in = tmp.resolve("inbox");
        Path out = tmp.resolve("out");
        Path shot = in.resolve("shot.png");
        try (DirectoryWatcher watcher = newWatcher(in, out)) {
            ImageFiles.writePng(TestRasters.allGood(), shot);
            watcher.pollOnce();
            assertEquals(1, watcher.pollOnce());

            ImageFiles.writePng(TestRasters.uniform(8, 8, 150, 200, 150), shot);
            Files.setLastModifiedTime(shot, FileTime.fromMillis(Files.getLastModifiedTime(shot).toMillis() + 5_000));
            assertEquals(0, watcher.pollOnce());
            assertEquals(1, watcher.pollOnce());
            assertEquals(1, watcher.trackedCount());
        }
    }

    @Test
    void tracker_survivesRestart() throws IOException {
        Path in = tmp.resolve("inbox");
        Path out = tmp.resolve("out");
        try (DirectoryWatcher watcher = newWatcher(in, out)) {
            ImageFiles.writePng(TestRasters.allGood(), in.resolve("a.png"));
            watcher.pollOnce();
            watcher.pollOnce();
        }
        try (DirectoryWatcher restarted = newWatcher(in, out)) {
            assertEquals(1, restarted.trackedCount());
            assertEquals(0, restarted.pollOnce());
            assertEquals(0, restarted.pollOnce());
        }
    }

    @Test
    void emptyFile_neverReady() throws IOException {
        Path in = tmp.resolve("inbox");
        try (DirectoryWatcher watcher = newWatcher(in, tmp.resolve("out"))) {
            Files.createFile(in.resolve("pending.jpg"));
            assertEquals(0, watcher.pollOnce());
            assertEquals(0, watcher.pollOnce());
            assertEquals(0, watcher.trackedCount());
        }
    }

    @Test
    void deletedPendingFile_isForgotten() throws IOException {
        Path in = tmp.resolve("inbox");
        try (DirectoryWatcher watcher = newWatcher(in, tmp.resolve("out"))) {
            Path partial = in.resolve("partial.png");
            ImageFiles.writePng(TestRasters.allGood(), partial);
            assertEquals(0, watcher.pollOnce());
            assertEquals(1, watcher.pendingCount());

            Files.delete(partial);
            assertEquals(0, watcher.pollOnce());
            assertEquals(0, watcher.pendingCount());
        }
    }

    @Test
    void close_isIdempotent() throws IOException {
        DirectoryWatcher watcher = newWatcher(tmp.resolve("inbox"), tmp.resolve("out"));
        assertFalse(watcher.isClosed());
        watcher.close();
        watcher.close();
        assertTrue(watcher.isClosed());
    }

    @Test
    void fingerprint_changesWithContent() throws IOException {
        Path file = tmp.resolve("f.png");
        Files.writeString(file, "abc");
        String first = ProcessedTracker.fingerprint(file);
        assertEquals(32, first.length(), "MD5 hex digest");
        assertEquals(first, ProcessedTracker.fingerprint(file));

        Files.writeString(file, "abcdef");
        assertNotEquals(first, ProcessedTracker.fingerprint(file));
    }
}
