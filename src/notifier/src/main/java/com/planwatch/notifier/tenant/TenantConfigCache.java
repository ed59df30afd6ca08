package com.planwatch.notifier.tenant;

import java.util.Collections;
import java.util.Map;
import java.util.TreeMap;
import java.util.concurrent.atomic.AtomicReference;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Read-only view of the tenant configurations used by the matching pass.
 *
 * <p>The snapshot is an immutable map swapped atomically on each successful refresh. When the
 * store cannot be read, the last-known snapshot stays in effect.
 */
@Component
public class TenantConfigCache {
  private static final Logger log = LoggerFactory.getLogger(TenantConfigCache.class);

  private final TenantConfigStore store;
  private final AtomicReference<Map<Long, TenantConfig>> snapshot = new AtomicReference<>(Map.of());

  public TenantConfigCache(TenantConfigStore store) {
    this.store = store;
  }

  /** Re-reads the store and returns the snapshot to match against. */
  public Map<Long, TenantConfig> refresh() {
    try {
      Map<Long, TenantConfig> latest = Collections.unmodifiableMap(new TreeMap<>(store.getAll()));
      Map<Long, TenantConfig> previous = snapshot.getAndSet(latest);
      if (previous.size() != latest.size()) {
        log.info("Loaded {} tenant configurations", latest.size());
      }
      return latest;
    } catch (RuntimeException ex) {
      Map<Long, TenantConfig> lastKnown = snapshot.get();
      log.warn("Tenant configuration unavailable, keeping last-known snapshot ({} tenants): {}",
          lastKnown.size(), ex.getMessage());
      return lastKnown;
    }
  }

  public Map<Long, TenantConfig> current() {
    return snapshot.get();
  }
}
