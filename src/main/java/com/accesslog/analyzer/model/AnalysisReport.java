package com.accesslog.analyzer.model;

import java.time.Instant;

import com.accesslog.filter.FilterCriteria;

/**
 * Everything a report generator renders for one run.
 */
public final class AnalysisReport {

    private final String sourceDirectory;
    private final Instant generatedAt;
    private final FilterCriteria criteria;
    private final LogSummary summary;
    private final long matchingEntries;
    private final TrafficSeries traffic;
    private final FrequencyTable topAddresses;
    private final CategoryDistribution softwareFamilies;

    /**
     * @param summary summary of the unfiltered record set
     * @param matchingEntries number of records left after filtering
     */
    public AnalysisReport(String sourceDirectory, Instant generatedAt, FilterCriteria criteria, LogSummary summary,
            long matchingEntries, TrafficSeries traffic, FrequencyTable topAddresses,
            CategoryDistribution softwareFamilies) {
        this.sourceDirectory = sourceDirectory;
        this.generatedAt = generatedAt;
        this.criteria = criteria != null ? criteria : FilterCriteria.none();
        this.summary = summary;
        this.matchingEntries = matchingEntries;
        this.traffic = traffic;
        this.topAddresses = topAddresses;
        this.softwareFamilies = softwareFamilies;
    }

    public String getSourceDirectory() {
        return sourceDirectory;
    }

    public Instant getGeneratedAt() {
        return generatedAt;
    }

    public FilterCriteria getCriteria() {
        return criteria;
    }

    public LogSummary getSummary() {
        return summary;
    }

    public long getMatchingEntries() {
        return matchingEntries;
    }

    public TrafficSeries getTraffic() {
        return traffic;
    }

    public FrequencyTable getTopAddresses() {
        return topAddresses;
    }

    public CategoryDistribution getSoftwareFamilies() {
        return softwareFamilies;
    }
}
