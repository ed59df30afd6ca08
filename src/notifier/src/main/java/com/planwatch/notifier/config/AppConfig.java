package com.planwatch.notifier.config;

import com.planwatch.notifier.feed.Sleeper;
import java.net.http.HttpClient;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class AppConfig {
  private static final int DEFAULT_DISPATCH_THREADS = 4;
  private static final int DEFAULT_DISPATCH_QUEUE_CAPACITY = 1000;

  @Bean
  public HttpClient httpClient() {
    return HttpClient.newHttpClient();
  }

  @Bean
  public Sleeper sleeper() {
    return Sleeper.system();
  }

  /**
   * Worker pool for per-tenant deliveries; deliveries never run on a feed thread. The backlog is
   * bounded, and a delivery that does not fit is rejected and reported as an error.
   */
  @Bean(destroyMethod = "shutdownNow")
  public ExecutorService dispatchExecutor(NotifierProperties properties) {
    NotifierProperties.Dispatch dispatch = properties.dispatch();
    int threads = dispatch == null ? DEFAULT_DISPATCH_THREADS : Math.max(1, dispatch.threads());
    int queueCapacity = dispatch == null || dispatch.queueCapacity() <= 0
        ? DEFAULT_DISPATCH_QUEUE_CAPACITY
        : dispatch.queueCapacity();
    AtomicInteger counter = new AtomicInteger();
    return new ThreadPoolExecutor(
        threads,
        threads,
        0L,
        TimeUnit.MILLISECONDS,
        new ArrayBlockingQueue<>(queueCapacity),
        runnable -> {
          Thread thread = new Thread(runnable, "notifier-dispatch-" + counter.incrementAndGet());
          thread.setDaemon(true);
          return thread;
        },
        new ThreadPoolExecutor.AbortPolicy());
  }
}
