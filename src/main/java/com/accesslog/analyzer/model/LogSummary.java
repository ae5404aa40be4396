package com.accesslog.analyzer.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

public final class LogSummary {

    public static final String NO_DATA = "No data";

    private final long totalEntries;
    private final long uniqueAddresses;
    private final String dateRange;
    private final List<String> filesProcessed;

    public LogSummary(long totalEntries, long uniqueAddresses, String dateRange, List<String> filesProcessed) {
        this.totalEntries = totalEntries;
        this.uniqueAddresses = uniqueAddresses;
        this.dateRange = dateRange;
        this.filesProcessed = Collections.unmodifiableList(new ArrayList<>(filesProcessed));
    }

    public long getTotalEntries() {
        return totalEntries;
    }

    public long getUniqueAddresses() {
        return uniqueAddresses;
    }

    /** "{first} to {last}" in ISO dates, or {@value #NO_DATA}. */
    public String getDateRange() {
        return dateRange;
    }

    public List<String> getFilesProcessed() {
        return filesProcessed;
    }

    @Override
    public String toString() {
        return String.format("%,d entries, %,d unique IPs, %s, %d files", totalEntries, uniqueAddresses,
                dateRange, filesProcessed.size());
    }
}
