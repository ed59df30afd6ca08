package com.planwatch.notifier.feed;

import java.util.Locale;

/** Upstream transport kinds. Pushed events are discrete occurrences and go through deduplication. */
public enum FeedTransport {
  POLL(false),
  PUSH(true);

  private final boolean deduplicated;

  FeedTransport(boolean deduplicated) {
    this.deduplicated = deduplicated;
  }

  public boolean deduplicated() {
    return deduplicated;
  }

  public String tag() {
    return name().toLowerCase(Locale.ROOT);
  }
}
