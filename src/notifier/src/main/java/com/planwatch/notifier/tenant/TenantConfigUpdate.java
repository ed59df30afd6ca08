package com.planwatch.notifier.tenant;

import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Partial change to a tenant configuration; {@code null} components leave the current value as
 * is. A blank thumbnail or image URL removes it.
 */
public record TenantConfigUpdate(
    Long destinationId,
    List<String> prefixes,
    Integer color,
    String title,
    String thumbnailUrl,
    String imageUrl,
    Map<NotificationField, Boolean> visibility) {

  public TenantConfigUpdate {
    visibility = visibility == null || visibility.isEmpty()
        ? Map.of()
        : Map.copyOf(visibility);
  }

  public static TenantConfigUpdate subscription(long destinationId, List<String> prefixes) {
    return new TenantConfigUpdate(destinationId, prefixes, null, null, null, null, null);
  }

  /**
   * Merges this update into {@code current}, or into the defaults when the tenant is new.
   *
   * @throws IllegalArgumentException when a new tenant has no destination
   */
  public TenantConfig applyTo(long guildId, TenantConfig current) {
    if (current == null && destinationId == null) {
      throw new IllegalArgumentException("A destination is required for new tenant " + guildId);
    }
    TenantConfig.Appearance base = current == null ? TenantConfig.Appearance.defaults() : current.appearance();

    Set<NotificationField> visible = base.visibleFields().isEmpty()
        ? EnumSet.noneOf(NotificationField.class)
        : EnumSet.copyOf(base.visibleFields());
    visibility.forEach((field, shown) -> {
      if (Boolean.TRUE.equals(shown)) {
        visible.add(field);
      } else {
        visible.remove(field);
      }
    });

    TenantConfig.Appearance appearance = new TenantConfig.Appearance(
        color != null ? color : base.color(),
        title != null ? title : base.title(),
        thumbnailUrl != null ? thumbnailUrl : base.thumbnailUrl(),
        imageUrl != null ? imageUrl : base.imageUrl(),
        visible);

    return new TenantConfig(
        guildId,
        destinationId != null ? destinationId : current.destinationId(),
        prefixes != null ? prefixes : (current == null ? List.of() : current.prefixes()),
        appearance);
  }
}
