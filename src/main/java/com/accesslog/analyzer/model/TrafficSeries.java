package com.accesslog.analyzer.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

public final class TrafficSeries {

    private final String title;
    private final Granularity granularity;
    private final List<TrafficBucket> buckets;

    public TrafficSeries(String title, Granularity granularity, List<TrafficBucket> buckets) {
        this.title = title;
        this.granularity = granularity;
        this.buckets = Collections.unmodifiableList(new ArrayList<>(buckets));
    }

    public String getTitle() {
        return title;
    }

    public Granularity getGranularity() {
        return granularity;
    }

    public List<TrafficBucket> getBuckets() {
        return buckets;
    }

    public boolean isEmpty() {
        return buckets.isEmpty();
    }

    public long getTotal() {
        return buckets.stream().mapToLong(TrafficBucket::getCount).sum();
    }

    public long getMaxCount() {
        return buckets.stream().mapToLong(TrafficBucket::getCount).max().orElse(0);
    }
}
