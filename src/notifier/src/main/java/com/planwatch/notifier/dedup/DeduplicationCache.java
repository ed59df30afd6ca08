package com.planwatch.notifier.dedup;

import com.planwatch.notifier.event.DedupKey;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Bounded recency filter for pushed flight-plan occurrences.
 *
 * <p>Keys are kept in insertion order; once {@code capacity} keys are held, recording a new one
 * evicts the oldest. Duplicates older than the window are not caught. Not thread-safe: callers
 * serialize access.
 */
public class DeduplicationCache {
  public static final int DEFAULT_CAPACITY = 500;

  private final int capacity;
  private final Map<DedupKey, Boolean> recent;

  public DeduplicationCache() {
    this(DEFAULT_CAPACITY);
  }

  public DeduplicationCache(int capacity) {
    if (capacity <= 0) {
      throw new IllegalArgumentException("capacity must be positive: " + capacity);
    }
    this.capacity = capacity;
    this.recent = new LinkedHashMap<>(capacity * 2, 0.75f, false) {
      @Override
      protected boolean removeEldestEntry(Map.Entry<DedupKey, Boolean> eldest) {
        return size() > DeduplicationCache.this.capacity;
      }
    };
  }

  public boolean seen(DedupKey key) {
    return recent.containsKey(key);
  }

  public void record(DedupKey key) {
    recent.putIfAbsent(key, Boolean.TRUE);
  }

  public int size() {
    return recent.size();
  }

  public int capacity() {
    return capacity;
  }
}
