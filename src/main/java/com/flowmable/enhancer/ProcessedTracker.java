package com.flowmable.enhancer;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Remembers which input files were already enhanced, keyed by file name,
 * with a fingerprint of path, size and modification time. Persisted as JSON.
 */
public class ProcessedTracker {

    private static final TypeReference<LinkedHashMap<String, String>> MAP_TYPE = new TypeReference<>() {};

    private final ObjectMapper mapper = new ObjectMapper();
    private final Path file;
    private final Map<String, String> entries;

    private ProcessedTracker(Path file, Map<String, String> entries) {
        this.file = file;
        this.entries = entries;
    }

    public static ProcessedTracker load(Path file) throws IOException {
        Map<String, String> entries = new LinkedHashMap<>();
        if (Files.isRegularFile(file)) {
            entries.putAll(new ObjectMapper().readValue(file.toFile(), MAP_TYPE));
        }
        return new ProcessedTracker(file, entries);
    }

    public static String fingerprint(Path input) throws IOException {
        String key = input.toAbsolutePath() + "|" + Files.size(input) + "|"
                + Files.getLastModifiedTime(input).toMillis();
        try {
            MessageDigest md5 = MessageDigest.getInstance("MD5");
            return HexFormat.of().formatHex(md5.digest(key.getBytes(StandardCharsets.UTF_8)));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("MD5 not available", e);
        }
    }

    public boolean isKnown(String name) {
        return entries.containsKey(name);
    }

    public boolean isUpToDate(String name, String fingerprint) {
        return fingerprint.equals(entries.get(name));
    }

    public void markProcessed(String name, String fingerprint) throws IOException {
        entries.put(name, fingerprint);
        mapper.writerWithDefaultPrettyPrinter().writeValue(file.toFile(), entries);
    }

    public int size() {
        return entries.size();
    }
}
