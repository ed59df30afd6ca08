package com.planwatch.notifier.feed;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.planwatch.notifier.dedup.SnapshotDiffer;
import com.planwatch.notifier.event.FlightEvent;
import com.planwatch.notifier.event.FlightEventMapper;
import java.net.URI;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.springframework.boot.test.system.CapturedOutput;
import org.springframework.boot.test.system.OutputCaptureExtension;

class PollFeedAdapterTest {
  private static final URI MAIN = URI.create("https://feed.example/acft-data");
  private static final URI EVENT = URI.create("https://feed.example/acft-data/event");

  private final ObjectMapper objectMapper = new ObjectMapper();
  private final PayloadDecoder decoder = new PayloadDecoder();
  private final SnapshotFeedClient client = mock(SnapshotFeedClient.class);
  private final SnapshotDiffer snapshots = new SnapshotDiffer();
  private final List<Duration> sleeps = new ArrayList<>();
  private PollFeedAdapter adapter;

  @AfterEach
  void tearDown() {
    if (adapter != null) {
      adapter.close();
    }
  }

  @Test
  void firstTickIsBaselineAndSecondTickEmitsOnlyNewEntities() throws Exception {
    when(client.fetchSnapshot(eq("main"), eq(MAIN)))
        .thenReturn(snapshot("{\"DAL123\":{\"aircraftType\":\"B738\"}}"))
        .thenReturn(snapshot("{\"DAL123\":{\"aircraftType\":\"B738\"},\"UAL456\":{\"aircraftType\":\"A320\"}}"));
    adapter = newAdapter(Map.of("main", MAIN), sleeps::add);

    assertThat(adapter.tick()).isEmpty();
    List<FlightEvent> second = adapter.tick();

    assertThat(second).extracting(FlightEvent::callsign).containsExactly("UAL456");
    assertThat(second.get(0).aircraftType()).isEqualTo("A320");
  }

  @Test
  void feedsKeepSeparateBaselinesAndFailedFetchLeavesBaselineUntouched() throws Exception {
    when(client.fetchSnapshot(eq("main"), eq(MAIN)))
        .thenReturn(snapshot("[{\"callsign\":\"A1\"}]"))
        .thenReturn(Optional.empty())
        .thenReturn(snapshot("[{\"callsign\":\"A1\"},{\"callsign\":\"B2\"}]"));
    when(client.fetchSnapshot(eq("event"), eq(EVENT)))
        .thenReturn(snapshot("[{\"callsign\":\"E1\"}]"))
        .thenReturn(snapshot("[{\"callsign\":\"E1\"},{\"callsign\":\"A1\"}]"))
        .thenReturn(snapshot("[{\"callsign\":\"E1\"},{\"callsign\":\"A1\"}]"));
    Map<String, URI> feeds = new LinkedHashMap<>();
    feeds.put("main", MAIN);
    feeds.put("event", EVENT);
    adapter = newAdapter(feeds, sleeps::add);

    assertThat(adapter.tick()).isEmpty();
    assertThat(adapter.tick()).extracting(FlightEvent::callsign).containsExactly("A1");
    assertThat(adapter.tick()).extracting(FlightEvent::callsign).containsExactly("B2");
  }

  @Test
  void recordsWithoutIdentifierAreIgnored() throws Exception {
    when(client.fetchSnapshot(eq("main"), eq(MAIN)))
        .thenReturn(snapshot("[{\"callsign\":\"A1\"}]"))
        .thenReturn(snapshot("[{\"callsign\":\"A1\"},{\"aircraft\":\"A320\"},{\"flight_id\":\"F7\"}]"));
    adapter = newAdapter(Map.of("main", MAIN), sleeps::add);

    adapter.tick();

    assertThat(adapter.tick()).extracting(FlightEvent::callsign).containsExactly("F7");
  }

  @Test
  void iteratorWaitsIntervalBetweenTicksAndStopsWhenClosed() throws Exception {
    when(client.fetchSnapshot(eq("main"), eq(MAIN)))
        .thenReturn(snapshot("[{\"callsign\":\"DAL123\"}]"))
        .thenReturn(snapshot("[{\"callsign\":\"DAL123\"},{\"callsign\":\"UAL456\"}]"));
    AtomicReference<PollFeedAdapter> self = new AtomicReference<>();
    Sleeper sleeper = duration -> {
      sleeps.add(duration);
      if (sleeps.size() >= 2) {
        self.get().close();
      }
    };
    adapter = newAdapter(Map.of("main", MAIN), sleeper);
    self.set(adapter);

    Iterator<FlightEvent> events = adapter.events();

    assertThat(events.hasNext()).isTrue();
    assertThat(events.next().callsign()).isEqualTo("UAL456");
    assertThat(events.hasNext()).isFalse();
    assertThat(sleeps).containsExactly(Duration.ofSeconds(3), Duration.ofSeconds(3));
  }

  @Test
  @ExtendWith(OutputCaptureExtension.class)
  void closeDuringFetchEndsTickQuietly(CapturedOutput output) throws Exception {
    CountDownLatch fetching = new CountDownLatch(1);
    when(client.fetchSnapshot(eq("main"), eq(MAIN))).thenAnswer(invocation -> {
      fetching.countDown();
      new CountDownLatch(1).await();
      return Optional.empty();
    });
    adapter = newAdapter(Map.of("main", MAIN), sleeps::add);
    ExecutorService supervisor = Executors.newSingleThreadExecutor();
    try {
      Future<List<FlightEvent>> tick = supervisor.submit(adapter::tick);
      assertThat(fetching.await(1, TimeUnit.SECONDS)).isTrue();

      adapter.close();

      assertThat(tick.get(2, TimeUnit.SECONDS)).isEmpty();
      assertThat(output.getOut()).doesNotContain("Feed fetch failed unexpectedly");
    } finally {
      supervisor.shutdownNow();
    }
  }

  @Test
  void eventsCanOnlyBeRequestedOnce() {
    adapter = newAdapter(Map.of("main", MAIN), sleeps::add);
    adapter.events();

    assertThatThrownBy(adapter::events).isInstanceOf(IllegalStateException.class);
  }

  @Test
  void requiresAtLeastOneFeed() {
    assertThatThrownBy(() -> newAdapter(Map.of(), sleeps::add)).isInstanceOf(IllegalStateException.class);
  }

  private PollFeedAdapter newAdapter(Map<String, URI> feeds, Sleeper sleeper) {
    return new PollFeedAdapter(
        "poll", feeds, Duration.ofSeconds(3), client, snapshots, new FlightEventMapper(objectMapper), sleeper);
  }

  private Optional<List<ObjectNode>> snapshot(String json) throws Exception {
    return decoder.decodeSnapshot(objectMapper.readTree(json));
  }
}
