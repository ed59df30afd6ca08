package com.planwatch.notifier.tenant;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.EnumSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Subscription and appearance settings of one tenant (one subscribing server).
 *
 * <p>Prefixes are trimmed, upper-cased and de-duplicated while keeping their configured order,
 * which is also the matching order.
 */
public record TenantConfig(long guildId, long destinationId, List<String> prefixes, Appearance appearance) {

  public TenantConfig {
    prefixes = normalizePrefixes(prefixes);
    appearance = appearance == null ? Appearance.defaults() : appearance;
  }

  static List<String> normalizePrefixes(Collection<String> prefixes) {
    if (prefixes == null) {
      return List.of();
    }
    Set<String> ordered = new LinkedHashSet<>();
    for (String prefix : prefixes) {
      if (prefix == null || prefix.isBlank()) {
        continue;
      }
      ordered.add(prefix.trim().toUpperCase(Locale.ROOT));
    }
    return List.copyOf(new ArrayList<>(ordered));
  }

  /** Notification look: color, title, optional images and per-field visibility. */
  public record Appearance(
      int color,
      String title,
      String thumbnailUrl,
      String imageUrl,
      Set<NotificationField> visibleFields) {
    public static final int DEFAULT_COLOR = 0x00FF00;
    public static final String DEFAULT_TITLE = "✈️ New Flight Plan Filed";

    public Appearance {
      title = title == null || title.isBlank() ? DEFAULT_TITLE : title;
      thumbnailUrl = thumbnailUrl == null || thumbnailUrl.isBlank() ? null : thumbnailUrl.trim();
      imageUrl = imageUrl == null || imageUrl.isBlank() ? null : imageUrl.trim();
      visibleFields = visibleFields == null || visibleFields.isEmpty()
          ? Collections.unmodifiableSet(EnumSet.noneOf(NotificationField.class))
          : Collections.unmodifiableSet(EnumSet.copyOf(visibleFields));
    }

    public static Appearance defaults() {
      return new Appearance(
          DEFAULT_COLOR, DEFAULT_TITLE, null, null, EnumSet.allOf(NotificationField.class));
    }

    public boolean isVisible(NotificationField field) {
      return visibleFields.contains(field);
    }
  }
}
