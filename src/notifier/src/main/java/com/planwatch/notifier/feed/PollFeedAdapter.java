package com.planwatch.notifier.feed;

import com.fasterxml.jackson.databind.node.ObjectNode;
import com.planwatch.notifier.dedup.SnapshotDiffer;
import com.planwatch.notifier.event.FlightEvent;
import com.planwatch.notifier.event.FlightEventMapper;
import java.net.URI;
import java.time.Duration;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.NoSuchElementException;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Poll transport: fetches every configured snapshot feed once per tick, diffs each against its
 * previous snapshot and emits only entities that newly appeared.
 *
 * <p>The first tick runs immediately, later ticks after the configured interval. The feeds of a
 * tick are fetched concurrently.
 */
public class PollFeedAdapter implements FeedAdapter {
  private static final Logger log = LoggerFactory.getLogger(PollFeedAdapter.class);

  private final String name;
  private final Map<String, URI> feeds;
  private final Duration interval;
  private final SnapshotFeedClient client;
  private final SnapshotDiffer snapshots;
  private final FlightEventMapper mapper;
  private final Sleeper sleeper;
  private final ExecutorService fetchExecutor;
  private final AtomicBoolean consumed = new AtomicBoolean(false);
  private volatile boolean closed;

  public PollFeedAdapter(
      String name,
      Map<String, URI> feeds,
      Duration interval,
      SnapshotFeedClient client,
      SnapshotDiffer snapshots,
      FlightEventMapper mapper,
      Sleeper sleeper) {
    if (feeds == null || feeds.isEmpty()) {
      throw new IllegalStateException("Poll adapter " + name + " has no feeds configured");
    }
    this.name = name;
    this.feeds = new LinkedHashMap<>(feeds);
    this.interval = interval;
    this.client = client;
    this.snapshots = snapshots;
    this.mapper = mapper;
    this.sleeper = sleeper;
    AtomicInteger counter = new AtomicInteger();
    this.fetchExecutor = Executors.newFixedThreadPool(this.feeds.size(), runnable -> {
      Thread thread = new Thread(runnable, "feed-" + name + "-fetch-" + counter.incrementAndGet());
      thread.setDaemon(true);
      return thread;
    });
  }

  @Override
  public String name() {
    return name;
  }

  @Override
  public FeedTransport transport() {
    return FeedTransport.POLL;
  }

  @Override
  public Iterator<FlightEvent> events() {
    if (!consumed.compareAndSet(false, true)) {
      throw new IllegalStateException("Feed adapter " + name + " is not restartable");
    }
    return new TickIterator();
  }

  @Override
  public void close() {
    closed = true;
    fetchExecutor.shutdownNow();
  }

  /**
   * Runs one tick over every feed.
   *
   * @return events for entities that appeared since the previous tick of their feed
   */
  List<FlightEvent> tick() throws InterruptedException {
    List<Callable<FeedSnapshot>> fetches = new ArrayList<>();
    feeds.forEach((feed, uri) -> fetches.add(() -> new FeedSnapshot(feed, client.fetchSnapshot(feed, uri))));

    List<FlightEvent> events = new ArrayList<>();
    for (Future<FeedSnapshot> future : fetchExecutor.invokeAll(fetches)) {
      FeedSnapshot snapshot;
      try {
        snapshot = future.get();
      } catch (ExecutionException ex) {
        if (closed || ex.getCause() instanceof InterruptedException) {
          log.debug("Feed {} fetch interrupted by shutdown", name);
        } else {
          log.error("Feed fetch failed unexpectedly, skipping tick", ex.getCause());
        }
        continue;
      }
      snapshot.records().ifPresent(records -> events.addAll(newEntities(snapshot.feed(), records)));
    }
    return events;
  }

  private List<FlightEvent> newEntities(String feed, List<ObjectNode> records) {
    Map<String, ObjectNode> byId = new LinkedHashMap<>();
    for (ObjectNode record : records) {
      FlightEventMapper.identifierOf(record).ifPresent(id -> byId.putIfAbsent(id, record));
    }
    Set<String> fresh = snapshots.diff(feed, byId.keySet());
    List<FlightEvent> events = new ArrayList<>();
    for (String id : fresh) {
      mapper.fromRecord(byId.get(id)).ifPresent(events::add);
    }
    if (!fresh.isEmpty()) {
      log.info("Feed {} reported {} new aircraft ({} tracked)", feed, fresh.size(), byId.size());
    }
    return events;
  }

  private record FeedSnapshot(String feed, Optional<List<ObjectNode>> records) {}

  private final class TickIterator implements Iterator<FlightEvent> {
    private final Deque<FlightEvent> buffer = new ArrayDeque<>();
    private boolean firstTick = true;

    @Override
    public boolean hasNext() {
      try {
        while (buffer.isEmpty()) {
          if (closed) {
            return false;
          }
          if (!firstTick) {
            sleeper.sleep(interval);
          }
          firstTick = false;
          buffer.addAll(tick());
        }
        return true;
      } catch (InterruptedException ex) {
        Thread.currentThread().interrupt();
        log.debug("Feed adapter {} interrupted", name);
        return false;
      } catch (RejectedExecutionException ex) {
        if (closed) {
          return false;
        }
        throw ex;
      }
    }

    @Override
    public FlightEvent next() {
      if (!hasNext()) {
        throw new NoSuchElementException();
      }
      return buffer.poll();
    }
  }
}
