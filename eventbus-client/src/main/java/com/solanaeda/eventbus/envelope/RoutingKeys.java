package com.solanaeda.eventbus.envelope;

import java.util.Locale;

public final class RoutingKeys {
  private RoutingKeys() {}

  /**
   * {@code BURN_DETECTED} becomes {@code burn.detected}.
   */
  public static String fromEventType(String eventType) {
    if (eventType == null || eventType.isBlank()) {
      throw new IllegalArgumentException("eventType must not be blank");
    }
    return eventType.toLowerCase(Locale.ROOT).replace('_', '.');
  }

  public static String forWorkerStatus(String workerName, String status) {
    return "worker." + workerName + "." + status.toLowerCase(Locale.ROOT);
  }
}
