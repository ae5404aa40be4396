package com.accesslog.analyzer.model;

import static org.junit.jupiter.api.Assertions.*;

import org.junit.jupiter.api.Test;

import com.accesslog.filter.FilterCriteria;

public class GranularityTest {

    @Test
    public void testFromString() {
        assertEquals(Granularity.HOURLY, Granularity.fromString(null));
        assertEquals(Granularity.HOURLY, Granularity.fromString("hourly"));
        assertEquals(Granularity.HOURLY, Granularity.fromString(" HOURLY "));
        assertEquals(Granularity.DAILY, Granularity.fromString("daily"));
        assertEquals(Granularity.DAILY, Granularity.fromString("weekly"));
    }

    @Test
    public void testResolveDateFilterForcesHourly() {
        FilterCriteria criteria = new FilterCriteria("2025-07-31", null, null, null);
        assertEquals(Granularity.HOURLY, Granularity.resolve(Granularity.DAILY, criteria));
    }

    @Test
    public void testResolveHourFilterForcesDaily() {
        FilterCriteria criteria = new FilterCriteria(null, 17, null, null);
        assertEquals(Granularity.DAILY, Granularity.resolve(Granularity.HOURLY, criteria));
    }

    @Test
    public void testResolveKeepsRequestOtherwise() {
        FilterCriteria both = new FilterCriteria("2025-07-31", 17, null, null);
        assertEquals(Granularity.DAILY, Granularity.resolve(Granularity.DAILY, both));
        assertEquals(Granularity.HOURLY, Granularity.resolve(Granularity.HOURLY, both));
        assertEquals(Granularity.DAILY, Granularity.resolve(Granularity.DAILY, FilterCriteria.none()));
        assertEquals(Granularity.HOURLY, Granularity.resolve(null, null));
    }

    @Test
    public void testUnparsableDateDoesNotForceHourly() {
        FilterCriteria badDate = new FilterCriteria("not-a-date", null, null, null);
        assertEquals(Granularity.DAILY, Granularity.resolve(Granularity.DAILY, badDate));
        assertEquals(Granularity.resolve(Granularity.DAILY, FilterCriteria.none()),
                Granularity.resolve(Granularity.DAILY, badDate));

        // with an hour filter a bad date behaves like no date at all
        FilterCriteria badDateWithHour = new FilterCriteria("31/07/2025", 17, null, null);
        assertEquals(Granularity.DAILY, Granularity.resolve(Granularity.HOURLY, badDateWithHour));
    }
}
