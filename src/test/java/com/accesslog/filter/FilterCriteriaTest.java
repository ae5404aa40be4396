package com.accesslog.filter;

import static org.junit.jupiter.api.Assertions.*;

import java.time.LocalDate;

import org.junit.jupiter.api.Test;

import com.accesslog.analyzer.SoftwareFamily;

public class FilterCriteriaTest {

    @Test
    public void testNone() {
        FilterCriteria none = FilterCriteria.none();
        assertTrue(none.isEmpty());
        assertFalse(none.isDateFilterActive());
        assertFalse(none.isHourFilterActive());
        assertEquals("none", none.toString());
    }

    @Test
    public void testBlankValuesAreUnset() {
        FilterCriteria criteria = new FilterCriteria("  ", null, "", null);
        assertTrue(criteria.isEmpty());
        assertEquals(FilterCriteria.none(), criteria);
    }

    @Test
    public void testHourRange() {
        assertThrows(IllegalArgumentException.class, () -> new FilterCriteria(null, 24, null, null));
        assertThrows(IllegalArgumentException.class, () -> new FilterCriteria(null, -1, null, null));
        assertTrue(new FilterCriteria(null, 0, null, null).isHourFilterActive());
    }

    @Test
    public void testToString() {
        FilterCriteria criteria = new FilterCriteria("2025-07-31", 17, "10.0.0.1", SoftwareFamily.BOT_OR_CRAWLER);
        assertEquals("date=2025-07-31 hour=17 ip=10.0.0.1 browser=Bot/Crawler", criteria.toString());
    }

    @Test
    public void testDateFilterActiveOnlyWhenParsable() {
        FilterCriteria valid = new FilterCriteria("2025-07-31", null, null, null);
        assertTrue(valid.isDateFilterActive());
        assertEquals(LocalDate.of(2025, 7, 31), valid.getParsedDate());

        FilterCriteria invalid = new FilterCriteria("not-a-date", null, null, null);
        assertFalse(invalid.isDateFilterActive());
        assertNull(invalid.getParsedDate());
        assertEquals("not-a-date", invalid.getDate());
    }
}
