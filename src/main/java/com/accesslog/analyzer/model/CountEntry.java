package com.accesslog.analyzer.model;

import java.util.Objects;

/**
 * A bucket key together with the number of records that fell into it.
 */
public final class CountEntry<K> {

    private final K key;
    private final long count;

    public CountEntry(K key, long count) {
        this.key = key;
        this.count = count;
    }

    public K getKey() {
        return key;
    }

    public long getCount() {
        return count;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        CountEntry<?> other = (CountEntry<?>) o;
        return count == other.count && Objects.equals(key, other.key);
    }

    @Override
    public int hashCode() {
        return Objects.hash(key, count);
    }

    @Override
    public String toString() {
        return key + "=" + count;
    }
}
