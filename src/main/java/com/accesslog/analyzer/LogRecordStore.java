package com.accesslog.analyzer;

import java.nio.file.Path;
import java.time.Instant;
import java.util.concurrent.atomic.AtomicReference;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Holds the current record set. A refresh builds a complete new snapshot and
 * then swaps it in, so readers see either the old set or the new one.
 */
public class LogRecordStore {

    private static final Logger logger = LoggerFactory.getLogger(LogRecordStore.class);

    private final LogFileIngestor ingestor;
    private final Path directory;
    private final Integer maxRecords;
    private final AtomicReference<LogSnapshot> current;

    public LogRecordStore(LogFileIngestor ingestor, Path directory, Integer maxRecords) {
        this.ingestor = ingestor;
        this.directory = directory;
        this.maxRecords = maxRecords;
        this.current = new AtomicReference<>(LogSnapshot.empty(directory));
    }

    public LogSnapshot current() {
        return current.get();
    }

    public LogSnapshot refresh() {
        long start = System.currentTimeMillis();
        IngestResult result = ingestor.ingestWithStats(directory, maxRecords);
        LogSnapshot snapshot = new LogSnapshot(result, directory, Instant.now());
        current.set(snapshot);
        logger.info("Reloaded {} log entries from {} in {} ms", snapshot.size(), directory,
                System.currentTimeMillis() - start);
        return snapshot;
    }

    public Path getDirectory() {
        return directory;
    }

    public Integer getMaxRecords() {
        return maxRecords;
    }
}
