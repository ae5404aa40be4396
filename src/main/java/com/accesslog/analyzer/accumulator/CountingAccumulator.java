package com.accesslog.analyzer.accumulator;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Function;
import java.util.stream.Collectors;

import com.accesslog.analyzer.LogRecord;
import com.accesslog.analyzer.model.CountEntry;

/**
 * Counts records per key, remembering the order in which keys were first seen.
 */
public class CountingAccumulator<K> {

    private final Function<LogRecord, K> keyExtractor;
    private final Map<K, Long> counts = new LinkedHashMap<>();

    public CountingAccumulator(Function<LogRecord, K> keyExtractor) {
        this.keyExtractor = keyExtractor;
    }

    public void accumulate(LogRecord record) {
        K key = keyExtractor.apply(record);
        if (key == null) {
            return;
        }
        counts.merge(key, 1L, Long::sum);
    }

    /**
     * Entries in first-seen order.
     */
    public List<CountEntry<K>> getEntries() {
        List<CountEntry<K>> entries = new ArrayList<>(counts.size());
        counts.forEach((key, count) -> entries.add(new CountEntry<>(key, count)));
        return entries;
    }

    /**
     * The {@code limit} most frequent keys, highest count first. Equal counts keep
     * first-seen order since the sort is stable.
     */
    public List<CountEntry<K>> getTop(int limit) {
        return getEntries().stream()
                .sorted(Comparator.comparingLong((CountEntry<K> e) -> e.getCount()).reversed())
                .limit(Math.max(limit, 0))
                .collect(Collectors.toList());
    }

    public int getSize() {
        return counts.size();
    }
}
