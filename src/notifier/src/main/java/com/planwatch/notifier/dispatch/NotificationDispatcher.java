package com.planwatch.notifier.dispatch;

import com.planwatch.notifier.event.FlightEvent;
import com.planwatch.notifier.match.TenantMatch;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.RejectedExecutionException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

/**
 * Fans one event out to its matched tenants.
 *
 * <p>Each tenant gets its own delivery task on the dispatch executor. Failures stay with the
 * tenant that caused them and are never retried.
 */
@Component
public class NotificationDispatcher {
  private static final Logger log = LoggerFactory.getLogger(NotificationDispatcher.class);

  private final NotificationRenderer renderer;
  private final DestinationClient destinationClient;
  private final Executor executor;
  private final Map<DeliveryResult, Counter> deliveryCounters = new EnumMap<>(DeliveryResult.class);

  @Autowired
  public NotificationDispatcher(
      NotificationRenderer renderer,
      DestinationClient destinationClient,
      @Qualifier("dispatchExecutor") ExecutorService executor,
      MeterRegistry meterRegistry) {
    this(renderer, destinationClient, (Executor) executor, meterRegistry);
  }

  public NotificationDispatcher(
      NotificationRenderer renderer,
      DestinationClient destinationClient,
      Executor executor,
      MeterRegistry meterRegistry) {
    this.renderer = renderer;
    this.destinationClient = destinationClient;
    this.executor = executor;
    for (DeliveryResult result : DeliveryResult.values()) {
      deliveryCounters.put(result, Counter.builder("notifier.notifications.total")
          .description("Notification deliveries (by outcome)")
          .tag("outcome", result.tag())
          .register(meterRegistry));
    }
  }

  /**
   * Starts one delivery per match.
   *
   * @return one future per match, in match order; futures never complete exceptionally
   */
  public List<CompletableFuture<DeliveryResult>> dispatch(FlightEvent event, List<TenantMatch> matches) {
    List<CompletableFuture<DeliveryResult>> deliveries = new ArrayList<>(matches.size());
    for (TenantMatch match : matches) {
      CompletableFuture<DeliveryResult> delivery;
      try {
        delivery = CompletableFuture.supplyAsync(() -> deliver(event, match), executor);
      } catch (RejectedExecutionException ex) {
        log.warn("Dispatch executor rejected notification for {} to guild {}", event.callsign(), match.guildId());
        record(DeliveryResult.ERROR);
        delivery = CompletableFuture.completedFuture(DeliveryResult.ERROR);
      }
      deliveries.add(delivery);
    }
    return deliveries;
  }

  private DeliveryResult deliver(FlightEvent event, TenantMatch match) {
    long guildId = match.guildId();
    long destinationId = match.config().destinationId();
    DeliveryResult result;
    try {
      Notification notification = renderer.render(event, match.config());
      result = destinationClient.send(destinationId, notification);
    } catch (RuntimeException ex) {
      log.error("Error sending notification for {} to guild {}", event.callsign(), guildId, ex);
      result = DeliveryResult.ERROR;
    }

    switch (result) {
      case SUCCESS -> log.info("Sent flight plan notification for {} (prefix: {}) to guild {}",
          event.callsign(), match.matchedPrefix(), guildId);
      case PERMISSION_DENIED -> log.warn("Missing permissions in channel {} for guild {}", destinationId, guildId);
      case NOT_FOUND -> log.warn("Channel {} not found for guild {}", destinationId, guildId);
      case ERROR -> log.warn("Failed to deliver notification for {} to guild {}", event.callsign(), guildId);
    }
    record(result);
    return result;
  }

  private void record(DeliveryResult result) {
    deliveryCounters.get(result).increment();
  }
}
