package com.planwatch.notifier;

import com.planwatch.notifier.config.NotifierProperties;
import com.planwatch.notifier.dedup.DeduplicationCache;
import com.planwatch.notifier.dedup.SnapshotDiffer;
import com.planwatch.notifier.dispatch.NotificationDispatcher;
import com.planwatch.notifier.event.DedupKey;
import com.planwatch.notifier.event.FlightEvent;
import com.planwatch.notifier.feed.FeedAdapter;
import com.planwatch.notifier.feed.FeedAdapterFactory;
import com.planwatch.notifier.feed.FeedTransport;
import com.planwatch.notifier.feed.Sleeper;
import com.planwatch.notifier.match.PrefixMatcher;
import com.planwatch.notifier.match.TenantMatch;
import com.planwatch.notifier.tenant.TenantConfig;
import com.planwatch.notifier.tenant.TenantConfigCache;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import java.time.Duration;
import java.util.EnumMap;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

/**
 * Runs every configured feed adapter and pushes its events through dedup, matching and dispatch.
 *
 * <p>Each adapter runs on its own supervisor thread. An adapter that fails is closed, and a fresh
 * instance is created after the restart delay. The dedup cache and the snapshot baselines belong
 * to the coordinator and outlive adapter restarts.
 */
@Component
public class PipelineCoordinator {
  private static final Logger log = LoggerFactory.getLogger(PipelineCoordinator.class);
  private static final Duration DEFAULT_RESTART_DELAY = Duration.ofSeconds(5);

  private final List<FeedAdapterFactory> factories;
  private final TenantConfigCache tenantConfigs;
  private final PrefixMatcher matcher;
  private final NotificationDispatcher dispatcher;
  private final Sleeper sleeper;
  private final Duration restartDelay;
  private final DeduplicationCache dedupCache;
  private final SnapshotDiffer snapshots = new SnapshotDiffer();
  private final ExecutorService supervisors;
  private final Map<String, FeedAdapter> activeAdapters = new ConcurrentHashMap<>();
  private final MeterRegistry meterRegistry;
  private final Map<FeedTransport, Counter> receivedCounters = new EnumMap<>(FeedTransport.class);
  private final Counter duplicateCounter;
  private final Counter matchedCounter;
  private final Counter errorCounter;
  private volatile boolean running;

  @Autowired
  public PipelineCoordinator(
      ObjectProvider<FeedAdapterFactory> factories,
      TenantConfigCache tenantConfigs,
      PrefixMatcher matcher,
      NotificationDispatcher dispatcher,
      NotifierProperties properties,
      Sleeper sleeper,
      MeterRegistry meterRegistry) {
    this(
        factories.orderedStream().toList(),
        tenantConfigs,
        matcher,
        dispatcher,
        new DeduplicationCache(dedupCapacity(properties)),
        properties.restartDelayMs() > 0 ? Duration.ofMillis(properties.restartDelayMs()) : DEFAULT_RESTART_DELAY,
        sleeper,
        meterRegistry);
  }

  public PipelineCoordinator(
      List<FeedAdapterFactory> factories,
      TenantConfigCache tenantConfigs,
      PrefixMatcher matcher,
      NotificationDispatcher dispatcher,
      DeduplicationCache dedupCache,
      Duration restartDelay,
      Sleeper sleeper,
      MeterRegistry meterRegistry) {
    this.factories = List.copyOf(factories);
    this.tenantConfigs = tenantConfigs;
    this.matcher = matcher;
    this.dispatcher = dispatcher;
    this.dedupCache = dedupCache;
    this.restartDelay = restartDelay;
    this.sleeper = sleeper;
    this.meterRegistry = meterRegistry;
    AtomicInteger counter = new AtomicInteger();
    this.supervisors = Executors.newFixedThreadPool(Math.max(1, this.factories.size()), runnable -> {
      Thread thread = new Thread(runnable, "feed-supervisor-" + counter.incrementAndGet());
      thread.setDaemon(true);
      return thread;
    });
    for (FeedTransport transport : FeedTransport.values()) {
      receivedCounters.put(transport, Counter.builder("notifier.events.received.total")
          .description("Flight events produced by feed adapters (by transport)")
          .tag("transport", transport.tag())
          .register(meterRegistry));
    }
    this.duplicateCounter = meterRegistry.counter("notifier.events.duplicates.total");
    this.matchedCounter = meterRegistry.counter("notifier.events.matched.total");
    this.errorCounter = meterRegistry.counter("notifier.events.errors.total");
  }

  /** Starts one supervisor per configured adapter. */
  @PostConstruct
  public void start() {
    if (factories.isEmpty()) {
      log.warn("No feed adapters enabled, nothing to ingest");
      return;
    }
    running = true;
    for (FeedAdapterFactory factory : factories) {
      supervisors.submit(() -> supervise(factory));
    }
    log.info("Pipeline started with feeds {}", factories.stream().map(FeedAdapterFactory::name).toList());
  }

  /** Closes live adapters and interrupts supervisors, which also cuts any pending backoff short. */
  @PreDestroy
  public void stop() {
    running = false;
    activeAdapters.values().forEach(FeedAdapter::close);
    supervisors.shutdownNow();
    try {
      if (!supervisors.awaitTermination(5, TimeUnit.SECONDS)) {
        log.warn("Feed supervisors did not stop within 5s");
      }
    } catch (InterruptedException ex) {
      Thread.currentThread().interrupt();
    }
  }

  /**
   * Processes one event produced by an adapter. Failures are contained to this event.
   *
   * @param transport transport of the producing adapter; pushed events are deduplicated
   */
  void handle(FeedTransport transport, FlightEvent event) {
    receivedCounters.get(transport).increment();
    try {
      if (transport.deduplicated() && isDuplicate(event.dedupKey())) {
        duplicateCounter.increment();
        log.debug("Skipping duplicate flight plan {}", event.dedupKey());
        return;
      }

      Map<Long, TenantConfig> tenants = tenantConfigs.refresh();
      List<TenantMatch> matches = matcher.match(event, tenants);
      if (matches.isEmpty()) {
        return;
      }
      log.info("New flight plan filed: {} by {}", event.callsign(),
          event.pilotName() == null ? "unknown pilot" : event.pilotName());
      matchedCounter.increment(matches.size());
      dispatcher.dispatch(event, matches);
    } catch (RuntimeException ex) {
      errorCounter.increment();
      log.error("Failed to process flight plan {}", event.callsign(), ex);
    }
  }

  private boolean isDuplicate(DedupKey key) {
    synchronized (dedupCache) {
      if (dedupCache.seen(key)) {
        return true;
      }
      dedupCache.record(key);
      return false;
    }
  }

  private void supervise(FeedAdapterFactory factory) {
    Counter restarts = Counter.builder("notifier.adapter.restarts.total")
        .description("Feed adapter restarts after a failure")
        .tag("adapter", factory.name())
        .register(meterRegistry);
    while (running && !Thread.currentThread().isInterrupted()) {
      FeedAdapter adapter = null;
      try {
        adapter = factory.create(snapshots);
        activeAdapters.put(factory.name(), adapter);
        if (!running) {
          return;
        }
        log.info("Started {} feed adapter {}", adapter.transport().tag(), adapter.name());
        Iterator<FlightEvent> events = adapter.events();
        while (events.hasNext()) {
          handle(adapter.transport(), events.next());
        }
        if (!running || Thread.currentThread().isInterrupted()) {
          return;
        }
        log.warn("Feed adapter {} stopped unexpectedly", factory.name());
      } catch (RuntimeException ex) {
        if (!running) {
          return;
        }
        log.error("Feed adapter {} failed", factory.name(), ex);
      } finally {
        if (adapter != null) {
          activeAdapters.remove(factory.name(), adapter);
          adapter.close();
        }
      }

      restarts.increment();
      log.info("Restarting feed adapter {} in {}ms", factory.name(), restartDelay.toMillis());
      try {
        sleeper.sleep(restartDelay);
      } catch (InterruptedException ex) {
        Thread.currentThread().interrupt();
        return;
      }
    }
  }

  DeduplicationCache dedupCache() {
    return dedupCache;
  }

  SnapshotDiffer snapshots() {
    return snapshots;
  }

  private static int dedupCapacity(NotifierProperties properties) {
    if (properties.dedup() == null || properties.dedup().capacity() <= 0) {
      return DeduplicationCache.DEFAULT_CAPACITY;
    }
    return properties.dedup().capacity();
  }
}
