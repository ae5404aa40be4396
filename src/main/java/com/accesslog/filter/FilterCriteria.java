package com.accesslog.filter;

import java.time.LocalDate;
import java.time.format.DateTimeParseException;
import java.util.Objects;

import com.accesslog.analyzer.SoftwareFamily;

/**
 * Optional record constraints. A null field places no constraint.
 */
public final class FilterCriteria {

    private static final FilterCriteria NONE = new FilterCriteria(null, null, null, null);

    private final String date;
    private final LocalDate parsedDate;
    private final Integer hour;
    private final String clientAddress;
    private final SoftwareFamily softwareFamily;

    /**
     * @param date calendar date as YYYY-MM-DD; an unparsable value is ignored when filtering
     * @param hour hour of day, 0-23
     */
    public FilterCriteria(String date, Integer hour, String clientAddress, SoftwareFamily softwareFamily) {
        if (hour != null && (hour < 0 || hour > 23)) {
            throw new IllegalArgumentException("Hour must be between 0 and 23: " + hour);
        }
        this.date = blankToNull(date);
        this.parsedDate = parseDate(this.date);
        this.hour = hour;
        this.clientAddress = blankToNull(clientAddress);
        this.softwareFamily = softwareFamily;
    }

    public static FilterCriteria none() {
        return NONE;
    }

    private static String blankToNull(String value) {
        return value == null || value.trim().isEmpty() ? null : value.trim();
    }

    private static LocalDate parseDate(String value) {
        if (value == null) {
            return null;
        }
        try {
            return LocalDate.parse(value);
        } catch (DateTimeParseException e) {
            return null;
        }
    }

    public String getDate() {
        return date;
    }

    /**
     * The date constraint, or null when no date was given or it is not a YYYY-MM-DD date.
     */
    public LocalDate getParsedDate() {
        return parsedDate;
    }

    public Integer getHour() {
        return hour;
    }

    public String getClientAddress() {
        return clientAddress;
    }

    public SoftwareFamily getSoftwareFamily() {
        return softwareFamily;
    }

    /**
     * True only when the date parses; an unparsable date constrains nothing.
     */
    public boolean isDateFilterActive() {
        return parsedDate != null;
    }

    public boolean isHourFilterActive() {
        return hour != null;
    }

    public boolean isEmpty() {
        return date == null && hour == null && clientAddress == null && softwareFamily == null;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        FilterCriteria other = (FilterCriteria) o;
        return Objects.equals(date, other.date) && Objects.equals(hour, other.hour) &&
               Objects.equals(clientAddress, other.clientAddress) && softwareFamily == other.softwareFamily;
    }

    @Override
    public int hashCode() {
        return Objects.hash(date, hour, clientAddress, softwareFamily);
    }

    @Override
    public String toString() {
        if (isEmpty()) {
            return "none";
        }
        StringBuilder sb = new StringBuilder();
        if (date != null) sb.append("date=").append(date).append(' ');
        if (hour != null) sb.append("hour=").append(hour).append(' ');
        if (clientAddress != null) sb.append("ip=").append(clientAddress).append(' ');
        if (softwareFamily != null) sb.append("browser=").append(softwareFamily.getDisplayName()).append(' ');
        return sb.toString().trim();
    }
}
