package com.planwatch.notifier.config;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.Test;

class AppConfigTest {
  private final AppConfig config = new AppConfig();

  @Test
  void dispatchExecutorRejectsWorkBeyondItsBacklog() throws Exception {
    ExecutorService executor = config.dispatchExecutor(properties(new NotifierProperties.Dispatch(1, 1, null)));
    CountDownLatch started = new CountDownLatch(1);
    CountDownLatch release = new CountDownLatch(1);
    try {
      executor.execute(() -> {
        started.countDown();
        try {
          release.await(5, TimeUnit.SECONDS);
        } catch (InterruptedException ex) {
          Thread.currentThread().interrupt();
        }
      });
      assertThat(started.await(1, TimeUnit.SECONDS)).isTrue();
      executor.execute(() -> { });

      assertThatThrownBy(() -> executor.execute(() -> { })).isInstanceOf(RejectedExecutionException.class);
    } finally {
      release.countDown();
      executor.shutdownNow();
    }
  }

  @Test
  void dispatchExecutorFallsBackToDefaultsWithoutSettings() {
    ExecutorService executor = config.dispatchExecutor(properties(null));
    try {
      ThreadPoolExecutor pool = (ThreadPoolExecutor) executor;
      assertThat(pool.getMaximumPoolSize()).isEqualTo(4);
      assertThat(pool.getQueue().remainingCapacity()).isEqualTo(1000);
    } finally {
      executor.shutdownNow();
    }
  }

  private static NotifierProperties properties(NotifierProperties.Dispatch dispatch) {
    return new NotifierProperties(0L, null, null, null, dispatch, null);
  }
}
