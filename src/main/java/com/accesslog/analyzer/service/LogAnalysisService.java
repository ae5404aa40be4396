package com.accesslog.analyzer.service;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

import com.accesslog.analyzer.LogRecord;
import com.accesslog.analyzer.SoftwareFamily;
import com.accesslog.analyzer.accumulator.CountingAccumulator;
import com.accesslog.analyzer.accumulator.TrafficAccumulator;
import com.accesslog.analyzer.model.CategoryDistribution;
import com.accesslog.analyzer.model.FrequencyTable;
import com.accesslog.analyzer.model.Granularity;
import com.accesslog.analyzer.model.LogSummary;
import com.accesslog.analyzer.model.TrafficSeries;
import com.accesslog.filter.FilterCriteria;
import com.accesslog.filter.RecordFilter;

/**
 * Builds the aggregate views over a fixed list of records. Every view is
 * recomputed from the records on each call; nothing is cached or mutated.
 */
public class LogAnalysisService {

    public static final String NO_DATA_TITLE = "No data available";
    public static final String HOURLY_TITLE = "Traffic by Hour";
    public static final String DAILY_TITLE = "Traffic by Day";
    public static final String BROWSER_TITLE = "Browser Usage Distribution";
    public static final int DEFAULT_TOP_N = 20;

    private final List<LogRecord> records;

    public LogAnalysisService(List<LogRecord> records) {
        this.records = records != null ? Collections.unmodifiableList(new ArrayList<>(records)) : Collections.emptyList();
    }

    public List<LogRecord> getRecords() {
        return records;
    }

    public List<LogRecord> applyFilters(FilterCriteria criteria) {
        return RecordFilter.apply(records, criteria);
    }

    /**
     * Returns a service over the records matching the criteria.
     */
    public LogAnalysisService filter(FilterCriteria criteria) {
        return new LogAnalysisService(applyFilters(criteria));
    }

    public TrafficSeries trafficOverTime(Granularity granularity) {
        Granularity effective = granularity != null ? granularity : Granularity.HOURLY;
        if (records.isEmpty()) {
            return new TrafficSeries(NO_DATA_TITLE, effective, Collections.emptyList());
        }

        TrafficAccumulator accumulator = new TrafficAccumulator(effective);
        records.forEach(accumulator::accumulate);

        String title = effective == Granularity.HOURLY ? HOURLY_TITLE : DAILY_TITLE;
        return new TrafficSeries(title, effective, accumulator.getBuckets());
    }

    /**
     * Most active client addresses. A non-positive {@code topN} falls back to {@value #DEFAULT_TOP_N}.
     */
    public FrequencyTable addressFrequency(int topN) {
        int limit = topN > 0 ? topN : DEFAULT_TOP_N;
        if (records.isEmpty()) {
            return new FrequencyTable(NO_DATA_TITLE, limit, Collections.emptyList());
        }

        CountingAccumulator<String> accumulator = new CountingAccumulator<>(LogRecord::getClientAddress);
        records.forEach(accumulator::accumulate);

        return new FrequencyTable(String.format("Top %d IP Addresses", limit), limit, accumulator.getTop(limit));
    }

    public FrequencyTable addressFrequency() {
        return addressFrequency(DEFAULT_TOP_N);
    }

    public CategoryDistribution softwareDistribution() {
        if (records.isEmpty()) {
            return new CategoryDistribution(NO_DATA_TITLE, Collections.emptyList());
        }

        CountingAccumulator<SoftwareFamily> accumulator = new CountingAccumulator<>(LogRecord::getSoftwareFamily);
        records.forEach(accumulator::accumulate);

        return new CategoryDistribution(BROWSER_TITLE, accumulator.getEntries());
    }

    public LogSummary summary() {
        if (records.isEmpty()) {
            return new LogSummary(0, 0, LogSummary.NO_DATA, Collections.emptyList());
        }

        Set<String> addresses = new LinkedHashSet<>();
        Set<String> files = new LinkedHashSet<>();
        LocalDate first = null;
        LocalDate last = null;
        for (LogRecord record : records) {
            addresses.add(record.getClientAddress());
            if (!record.getSourceFile().isEmpty()) {
                files.add(record.getSourceFile());
            }
            LocalDate date = record.getOccurredAt().toLocalDate();
            if (first == null || date.isBefore(first)) {
                first = date;
            }
            if (last == null || date.isAfter(last)) {
                last = date;
            }
        }
        return new LogSummary(records.size(), addresses.size(), first + " to " + last, new ArrayList<>(files));
    }
}
