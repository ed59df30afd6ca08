package com.planwatch.notifier.dedup;

import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;

/**
 * Per-feed baseline of entity identifiers for poll transports.
 *
 * <p>Each call returns the identifiers present in the current snapshot but absent from the
 * previous one for the same feed, then makes the current snapshot the new baseline. The first
 * snapshot of a feed only establishes the baseline.
 */
public class SnapshotDiffer {
  private final Map<String, Set<String>> baselines = new HashMap<>();

  /**
   * Diffs {@code current} against the stored baseline of {@code feed}.
   *
   * @param feed feed identity, e.g. {@code main} or {@code event}
   * @param current identifiers of the full current snapshot
   * @return newly appeared identifiers, in the iteration order of {@code current}
   */
  public synchronized Set<String> diff(String feed, Set<String> current) {
    Set<String> snapshot = Set.copyOf(current);
    Set<String> previous = baselines.put(feed, snapshot);
    if (previous == null) {
      return Set.of();
    }
    Set<String> fresh = new LinkedHashSet<>();
    for (String id : current) {
      if (!previous.contains(id)) {
        fresh.add(id);
      }
    }
    return fresh;
  }

  public synchronized boolean hasBaseline(String feed) {
    return baselines.containsKey(feed);
  }
}
