package com.accesslog.analyzer.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Most frequent keys, highest count first.
 */
public final class FrequencyTable {

    private final String title;
    private final int topN;
    private final List<CountEntry<String>> entries;

    public FrequencyTable(String title, int topN, List<CountEntry<String>> entries) {
        this.title = title;
        this.topN = topN;
        this.entries = Collections.unmodifiableList(new ArrayList<>(entries));
    }

    public String getTitle() {
        return title;
    }

    public int getTopN() {
        return topN;
    }

    public List<CountEntry<String>> getEntries() {
        return entries;
    }

    public boolean isEmpty() {
        return entries.isEmpty();
    }
}
