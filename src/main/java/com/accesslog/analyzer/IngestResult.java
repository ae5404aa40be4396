package com.accesslog.analyzer;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

public class IngestResult {

    private final List<LogRecord> records;
    private final IngestStats stats;

    public IngestResult(List<LogRecord> records, IngestStats stats) {
        this.records = Collections.unmodifiableList(new ArrayList<>(records));
        this.stats = stats;
    }

    public List<LogRecord> getRecords() {
        return records;
    }

    public IngestStats getStats() {
        return stats;
    }
}
