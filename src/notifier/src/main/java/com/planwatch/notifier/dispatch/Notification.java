package com.planwatch.notifier.dispatch;

import java.time.Instant;
import java.util.List;

/** Rendered, destination-agnostic notification for one tenant. */
public record Notification(
    String title,
    String description,
    int color,
    String thumbnailUrl,
    String imageUrl,
    List<Field> fields,
    String footer,
    Instant timestamp) {

  public Notification {
    fields = fields == null ? List.of() : List.copyOf(fields);
  }

  public record Field(String name, String value, boolean inline) {}
}
