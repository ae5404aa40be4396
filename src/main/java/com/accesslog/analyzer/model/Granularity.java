package com.accesslog.analyzer.model;

import com.accesslog.filter.FilterCriteria;

/**
 * Time unit used to bucket traffic.
 */
public enum Granularity {
    HOURLY("hourly"),
    DAILY("daily");

    Granularity(final String pName) {
        this.name = pName;
    }

    private final String name;

    public String getName() {
        return name;
    }

    /**
     * Null maps to hourly; anything other than "hourly" maps to daily.
     */
    public static Granularity fromString(final String value) {
        if (value == null) {
            return HOURLY;
        }
        return HOURLY.name.equalsIgnoreCase(value.trim()) ? HOURLY : DAILY;
    }

    /**
     * Picks the granularity that makes sense for the active filters. A single day
     * is shown by hour, a single hour is shown across days; otherwise the
     * requested granularity stands.
     */
    public static Granularity resolve(final Granularity requested, final FilterCriteria criteria) {
        Granularity fallback = requested != null ? requested : HOURLY;
        if (criteria == null) {
            return fallback;
        }
        boolean dateActive = criteria.isDateFilterActive();
        boolean hourActive = criteria.isHourFilterActive();
        if (dateActive && !hourActive) {
            return HOURLY;
        }
        if (hourActive && !dateActive) {
            return DAILY;
        }
        return fallback;
    }

    @Override
    public String toString() {
        return name;
    }
}
