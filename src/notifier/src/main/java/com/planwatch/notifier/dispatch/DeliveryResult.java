package com.planwatch.notifier.dispatch;

import java.util.Locale;

public enum DeliveryResult {
  SUCCESS,
  PERMISSION_DENIED,
  NOT_FOUND,
  ERROR;

  /** Metric tag value. */
  public String tag() {
    return name().toLowerCase(Locale.ROOT);
  }
}
