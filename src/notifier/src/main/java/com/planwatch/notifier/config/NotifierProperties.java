package com.planwatch.notifier.config;

import java.util.List;
import java.util.Map;
import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "notifier")
public record NotifierProperties(
    long restartDelayMs,
    Poll poll,
    Push push,
    Dedup dedup,
    Dispatch dispatch,
    Tenants tenants) {

  /** Snapshot feeds fetched every {@code intervalMs}, keyed by feed identity. */
  public record Poll(
      boolean enabled,
      long intervalMs,
      long requestTimeoutMs,
      Map<String, String> feeds,
      Retry retry) {}

  public record Retry(int maxAttempts, long baseDelayMs) {}

  /** Streaming endpoint and its keep-alive / reconnect timings. */
  public record Push(
      boolean enabled,
      String url,
      List<String> eventTypes,
      long pingIntervalMs,
      long pingTimeoutMs,
      long reconnectDelayMs,
      long connectTimeoutMs) {}

  public record Dedup(int capacity) {}

  public record Dispatch(int threads, int queueCapacity, String footer) {}

  public record Tenants(String dbPath) {}
}
