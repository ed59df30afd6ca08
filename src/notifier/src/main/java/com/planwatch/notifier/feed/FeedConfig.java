package com.planwatch.notifier.feed;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.planwatch.notifier.config.NotifierProperties;
import com.planwatch.notifier.event.FlightEventMapper;
import io.micrometer.core.instrument.MeterRegistry;
import java.net.URI;
import java.net.http.HttpClient;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/** Wires one adapter factory per enabled transport. */
@Configuration
public class FeedConfig {
  static final List<String> DEFAULT_EVENT_TYPES = List.of("FLIGHT_PLAN", "EVENT_FLIGHT_PLAN");

  @Bean
  @ConditionalOnProperty(prefix = "notifier.poll", name = "enabled", havingValue = "true")
  public FeedAdapterFactory pollFeedAdapterFactory(
      NotifierProperties properties,
      SnapshotFeedClient client,
      FlightEventMapper mapper,
      Sleeper sleeper) {
    NotifierProperties.Poll poll = properties.poll();
    Map<String, URI> feeds = new LinkedHashMap<>();
    if (poll.feeds() != null) {
      poll.feeds().forEach((feed, url) -> feeds.put(feed, URI.create(url)));
    }
    Duration interval = Duration.ofMillis(poll.intervalMs());
    return new FeedAdapterFactory("poll", snapshots ->
        new PollFeedAdapter("poll", feeds, interval, client, snapshots, mapper, sleeper));
  }

  @Bean
  @ConditionalOnProperty(prefix = "notifier.push", name = "enabled", havingValue = "true", matchIfMissing = true)
  public FeedAdapterFactory pushFeedAdapterFactory(
      NotifierProperties properties,
      HttpClient httpClient,
      ObjectMapper objectMapper,
      PayloadDecoder decoder,
      FlightEventMapper mapper,
      Sleeper sleeper,
      MeterRegistry meterRegistry) {
    NotifierProperties.Push push = properties.push();
    if (push == null || push.url() == null || push.url().isBlank()) {
      throw new IllegalStateException("notifier.push.url is required when the push feed is enabled");
    }
    Set<String> eventTypes = push.eventTypes() == null || push.eventTypes().isEmpty()
        ? new LinkedHashSet<>(DEFAULT_EVENT_TYPES)
        : new LinkedHashSet<>(push.eventTypes());
    Duration connectTimeout = Duration.ofMillis(push.connectTimeoutMs());
    PushFeedAdapter.Settings settings = new PushFeedAdapter.Settings(
        URI.create(push.url()),
        eventTypes,
        Duration.ofMillis(push.pingIntervalMs()),
        Duration.ofMillis(push.pingTimeoutMs()),
        Duration.ofMillis(push.reconnectDelayMs()),
        connectTimeout);
    WebSocketConnector connector = WebSocketConnector.of(httpClient, connectTimeout);
    return new FeedAdapterFactory("push", snapshots ->
        new PushFeedAdapter("push", settings, connector, objectMapper, decoder, mapper, sleeper, meterRegistry));
  }
}
