package com.planwatch.notifier.feed;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.planwatch.notifier.config.NotifierProperties;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.time.Duration;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.TimeUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

/**
 * Fetches one full snapshot of a poll feed with bounded retries.
 *
 * <p>Retry state machine per fetch:
 * <ul>
 *   <li>HTTP 429: retried with exponential backoff</li>
 *   <li>timeout, I/O failure or 5xx: retried with linear backoff</li>
 *   <li>other non-200 status, unreadable body or unknown shape: given up at once</li>
 * </ul>
 * Giving up means the tick is skipped for this feed; it is never fatal.
 */
@Component
public class SnapshotFeedClient {
  private static final Logger log = LoggerFactory.getLogger(SnapshotFeedClient.class);
  private static final Duration DEFAULT_REQUEST_TIMEOUT = Duration.ofSeconds(10);

  private final HttpClient httpClient;
  private final ObjectMapper objectMapper;
  private final PayloadDecoder decoder;
  private final Sleeper sleeper;
  private final RetryPolicy retryPolicy;
  private final Duration requestTimeout;
  private final Timer requestTimer;
  private final Counter successCounter;
  private final Counter rateLimitedCounter;
  private final Counter clientErrorCounter;
  private final Counter serverErrorCounter;
  private final Counter exceptionCounter;
  private final Counter malformedCounter;

  @Autowired
  public SnapshotFeedClient(
      HttpClient httpClient,
      ObjectMapper objectMapper,
      PayloadDecoder decoder,
      Sleeper sleeper,
      MeterRegistry meterRegistry,
      NotifierProperties properties) {
    this(httpClient, objectMapper, decoder, sleeper, meterRegistry, retryPolicy(properties), requestTimeout(properties));
  }

  public SnapshotFeedClient(
      HttpClient httpClient,
      ObjectMapper objectMapper,
      PayloadDecoder decoder,
      Sleeper sleeper,
      MeterRegistry meterRegistry,
      RetryPolicy retryPolicy,
      Duration requestTimeout) {
    this.httpClient = httpClient;
    this.objectMapper = objectMapper;
    this.decoder = decoder;
    this.sleeper = sleeper;
    this.retryPolicy = retryPolicy;
    this.requestTimeout = requestTimeout;

    this.requestTimer = Timer.builder("notifier.feed.http.duration")
        .description("Poll feed HTTP request duration (seconds)")
        .register(meterRegistry);
    // Outcome tags only; feed URLs stay out of the labels.
    this.successCounter = outcomeCounter(meterRegistry, "success");
    this.rateLimitedCounter = outcomeCounter(meterRegistry, "rate_limited");
    this.clientErrorCounter = outcomeCounter(meterRegistry, "client_error");
    this.serverErrorCounter = outcomeCounter(meterRegistry, "server_error");
    this.exceptionCounter = outcomeCounter(meterRegistry, "exception");
    this.malformedCounter = outcomeCounter(meterRegistry, "malformed");
  }

  /**
   * Fetches and decodes the current snapshot of a feed.
   *
   * @param feed feed identity, for logging
   * @param uri snapshot endpoint
   * @return raw entity records, or empty when this tick is skipped for the feed
   * @throws InterruptedException when shutdown interrupts a request or a backoff
   */
  public Optional<List<ObjectNode>> fetchSnapshot(String feed, URI uri) throws InterruptedException {
    HttpRequest request = HttpRequest.newBuilder()
        .uri(uri)
        .timeout(requestTimeout)
        .header("Accept", "application/json")
        .GET()
        .build();

    int attempt = 0;
    while (true) {
      attempt++;
      Duration backoff;
      long startNs = System.nanoTime();
      try {
        HttpResponse<String> response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());
        requestTimer.record(System.nanoTime() - startNs, TimeUnit.NANOSECONDS);
        int status = response.statusCode();
        if (status == 200) {
          successCounter.increment();
          return decode(feed, response.body());
        }
        if (status == 429) {
          rateLimitedCounter.increment();
          backoff = retryPolicy.exponentialDelay(attempt);
          log.warn("Feed {} rate limited (429), attempt {}/{}", feed, attempt, retryPolicy.maxAttempts());
        } else if (status >= 500) {
          serverErrorCounter.increment();
          backoff = retryPolicy.linearDelay(attempt);
          log.warn("Feed {} server error {}, attempt {}/{}", feed, status, attempt, retryPolicy.maxAttempts());
        } else {
          clientErrorCounter.increment();
          log.warn("Feed {} fetch failed: status={}, skipping tick", feed, status);
          return Optional.empty();
        }
      } catch (HttpTimeoutException ex) {
        requestTimer.record(System.nanoTime() - startNs, TimeUnit.NANOSECONDS);
        exceptionCounter.increment();
        backoff = retryPolicy.linearDelay(attempt);
        log.warn("Feed {} request timed out, attempt {}/{}", feed, attempt, retryPolicy.maxAttempts());
      } catch (IOException ex) {
        requestTimer.record(System.nanoTime() - startNs, TimeUnit.NANOSECONDS);
        exceptionCounter.increment();
        backoff = retryPolicy.linearDelay(attempt);
        log.warn("Feed {} request failed, attempt {}/{}: {}", feed, attempt, retryPolicy.maxAttempts(), ex.toString());
      }

      if (retryPolicy.exhausted(attempt)) {
        log.warn("Feed {} gave up after {} attempts, skipping tick", feed, attempt);
        return Optional.empty();
      }
      sleeper.sleep(backoff);
    }
  }

  private Optional<List<ObjectNode>> decode(String feed, String body) {
    JsonNode root;
    try {
      root = objectMapper.readTree(body);
    } catch (IOException ex) {
      malformedCounter.increment();
      log.warn("Feed {} returned unreadable JSON, skipping tick", feed);
      return Optional.empty();
    }
    Optional<List<ObjectNode>> records = decoder.decodeSnapshot(root);
    if (records.isEmpty()) {
      malformedCounter.increment();
      log.warn("Feed {} returned unexpected payload type {}, skipping tick", feed, root == null ? "null" : root.getNodeType());
    }
    return records;
  }

  private static Counter outcomeCounter(MeterRegistry meterRegistry, String outcome) {
    return Counter.builder("notifier.feed.http.requests.total")
        .description("Poll feed HTTP requests (by outcome)")
        .tag("outcome", outcome)
        .register(meterRegistry);
  }

  private static RetryPolicy retryPolicy(NotifierProperties properties) {
    NotifierProperties.Poll poll = properties.poll();
    if (poll == null || poll.retry() == null) {
      return RetryPolicy.defaults();
    }
    return new RetryPolicy(poll.retry().maxAttempts(), Duration.ofMillis(poll.retry().baseDelayMs()));
  }

  private static Duration requestTimeout(NotifierProperties properties) {
    NotifierProperties.Poll poll = properties.poll();
    if (poll == null || poll.requestTimeoutMs() <= 0) {
      return DEFAULT_REQUEST_TIMEOUT;
    }
    return Duration.ofMillis(poll.requestTimeoutMs());
  }
}
