package com.planwatch.notifier.tenant;

public class ConfigurationUnavailableException extends RuntimeException {
  public ConfigurationUnavailableException(String message, Throwable cause) {
    super(message, cause);
  }
}
