package com.planwatch.notifier.feed;

import com.planwatch.notifier.event.FlightEvent;
import java.util.Iterator;

/**
 * One upstream connection producing normalized flight events.
 *
 * <p>{@link #events()} returns a lazy, infinite, single-use sequence: {@code hasNext()} blocks
 * until an event is available and only returns {@code false} once the adapter is closed or the
 * consuming thread is interrupted. Retry, backoff and reconnect state belongs to the adapter
 * instance; a failed adapter is replaced, never restarted.
 */
public interface FeedAdapter extends AutoCloseable {
  String name();

  FeedTransport transport();

  /**
   * @throws IllegalStateException when called more than once
   */
  Iterator<FlightEvent> events();

  @Override
  void close();
}
