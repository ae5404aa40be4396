package com.accesslog.analyzer.model;

import java.time.LocalDate;
import java.util.Objects;

/**
 * One point of a traffic series, keyed by hour of day or by calendar date.
 */
public final class TrafficBucket {

    private final Integer hour;
    private final LocalDate date;
    private final long count;

    private TrafficBucket(Integer hour, LocalDate date, long count) {
        this.hour = hour;
        this.date = date;
        this.count = count;
    }

    public static TrafficBucket ofHour(int hour, long count) {
        if (hour < 0 || hour > 23) {
            throw new IllegalArgumentException("Hour out of range: " + hour);
        }
        return new TrafficBucket(hour, null, count);
    }

    public static TrafficBucket ofDate(LocalDate date, long count) {
        return new TrafficBucket(null, Objects.requireNonNull(date, "date"), count);
    }

    /** Null for daily buckets. */
    public Integer getHour() {
        return hour;
    }

    /** Null for hourly buckets. */
    public LocalDate getDate() {
        return date;
    }

    public long getCount() {
        return count;
    }

    /**
     * The bucket key as text: the hour number or the ISO date.
     */
    public String getLabel() {
        return hour != null ? String.valueOf(hour) : date.toString();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        TrafficBucket other = (TrafficBucket) o;
        return count == other.count && Objects.equals(hour, other.hour) && Objects.equals(date, other.date);
    }

    @Override
    public int hashCode() {
        return Objects.hash(hour, date, count);
    }

    @Override
    public String toString() {
        return getLabel() + "=" + count;
    }
}
