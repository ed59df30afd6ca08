package com.planwatch.notifier.dispatch;

/**
 * Transmits a rendered notification to a tenant destination.
 *
 * <p>Implementations report failures through the result and do not throw for delivery problems.
 */
public interface DestinationClient {
  DeliveryResult send(long destinationId, Notification notification);
}
