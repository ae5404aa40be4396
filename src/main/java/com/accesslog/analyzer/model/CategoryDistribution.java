package com.accesslog.analyzer.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import com.accesslog.analyzer.SoftwareFamily;

/**
 * Record counts per software family, in the order families were first seen.
 */
public final class CategoryDistribution {

    private final String title;
    private final List<CountEntry<SoftwareFamily>> entries;

    public CategoryDistribution(String title, List<CountEntry<SoftwareFamily>> entries) {
        this.title = title;
        this.entries = Collections.unmodifiableList(new ArrayList<>(entries));
    }

    public String getTitle() {
        return title;
    }

    public List<CountEntry<SoftwareFamily>> getEntries() {
        return entries;
    }

    public boolean isEmpty() {
        return entries.isEmpty();
    }

    public long getTotal() {
        return entries.stream().mapToLong(CountEntry::getCount).sum();
    }
}
