package com.planwatch.notifier.feed;

import com.planwatch.notifier.dedup.SnapshotDiffer;
import java.util.function.Function;

/**
 * Creates fresh adapter instances for one configured upstream. The snapshot baselines are handed
 * in by the coordinator so they outlive any single adapter.
 */
public record FeedAdapterFactory(String name, Function<SnapshotDiffer, FeedAdapter> creator) {
  public FeedAdapter create(SnapshotDiffer snapshots) {
    return creator.apply(snapshots);
  }
}
