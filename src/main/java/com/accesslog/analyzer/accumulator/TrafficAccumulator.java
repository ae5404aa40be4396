package com.accesslog.analyzer.accumulator;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

import com.accesslog.analyzer.LogRecord;
import com.accesslog.analyzer.model.Granularity;
import com.accesslog.analyzer.model.TrafficBucket;

/**
 * Counts records per time bucket. Hourly buckets ignore the date, so hour 5 of
 * every day lands in the same bucket.
 */
public class TrafficAccumulator {

    private final Granularity granularity;
    private final long[] hourCounts = new long[24];
    private final Map<LocalDate, Long> dayCounts = new TreeMap<>();
    private long total;

    public TrafficAccumulator(Granularity granularity) {
        this.granularity = granularity != null ? granularity : Granularity.HOURLY;
    }

    public void accumulate(LogRecord record) {
        LocalDateTime occurredAt = record.getOccurredAt();
        if (granularity == Granularity.HOURLY) {
            hourCounts[occurredAt.getHour()]++;
        } else {
            dayCounts.merge(occurredAt.toLocalDate(), 1L, Long::sum);
        }
        total++;
    }

    /**
     * Hourly: always 24 buckets, 0 through 23. Daily: one bucket per date seen, ascending.
     */
    public List<TrafficBucket> getBuckets() {
        List<TrafficBucket> buckets = new ArrayList<>();
        if (granularity == Granularity.HOURLY) {
            for (int hour = 0; hour < hourCounts.length; hour++) {
                buckets.add(TrafficBucket.ofHour(hour, hourCounts[hour]));
            }
        } else {
            dayCounts.forEach((date, count) -> buckets.add(TrafficBucket.ofDate(date, count)));
        }
        return buckets;
    }

    public Granularity getGranularity() {
        return granularity;
    }

    public long getTotal() {
        return total;
    }
}
