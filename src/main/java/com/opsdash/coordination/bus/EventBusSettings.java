package com.opsdash.coordination.bus;

import java.time.Duration;

public record EventBusSettings(
    int retryAttempts,
    Duration retryDelay,
    boolean persistenceEnabled,
    Duration retention,
    int dispatchThreads
) {

  public EventBusSettings {
    retryAttempts = Math.max(1, retryAttempts);
    retryDelay = retryDelay == null ? Duration.ofSeconds(1) : retryDelay;
    retention = retention == null ? Duration.ofDays(30) : retention;
    dispatchThreads = Math.max(1, dispatchThreads);
  }
}
