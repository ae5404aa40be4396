package com.accesslog.analyzer;

import java.nio.file.Path;
import java.time.Instant;
import java.util.Collections;
import java.util.List;

/**
 * An immutable, fully loaded record set together with how it was produced.
 */
public final class LogSnapshot {

    private final List<LogRecord> records;
    private final IngestStats stats;
    private final Path sourceDirectory;
    private final Instant loadedAt;

    public LogSnapshot(IngestResult result, Path sourceDirectory, Instant loadedAt) {
        this.records = result.getRecords();
        this.stats = result.getStats();
        this.sourceDirectory = sourceDirectory;
        this.loadedAt = loadedAt;
    }

    public static LogSnapshot empty(Path sourceDirectory) {
        return new LogSnapshot(new IngestResult(Collections.emptyList(), IngestStats.empty()), sourceDirectory, null);
    }

    public List<LogRecord> getRecords() {
        return records;
    }

    public IngestStats getStats() {
        return stats;
    }

    public Path getSourceDirectory() {
        return sourceDirectory;
    }

    /** Null until the first load. */
    public Instant getLoadedAt() {
        return loadedAt;
    }

    public int size() {
        return records.size();
    }
}
