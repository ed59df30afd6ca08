package com.planwatch.notifier.feed;

import java.time.Duration;

/**
 * Blocking wait used between ticks, retries and reconnects. Interrupting the waiting thread ends
 * the wait with {@link InterruptedException}, which is how shutdown preempts a backoff.
 */
@FunctionalInterface
public interface Sleeper {
  void sleep(Duration duration) throws InterruptedException;

  static Sleeper system() {
    return duration -> {
      if (!duration.isNegative() && !duration.isZero()) {
        Thread.sleep(duration.toMillis());
      } else if (Thread.interrupted()) {
        throw new InterruptedException();
      }
    };
  }
}
