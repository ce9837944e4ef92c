package com.solanaeda.eventbus.producer;

import java.time.Duration;
import java.util.HashMap;
import java.util.Map;

/**
 * Per-publish overrides. {@code null} fields fall back to the defaults.
 */
public record PublishOptions(
    String routingKey,
    String correlationId,
    String causationId,
    Integer priority,
    Duration expiration,
    boolean persistent,
    Map<String, Object> headers
) {
  public static final PublishOptions DEFAULTS = new PublishOptions(null, null, null, null, null, true, Map.of());

  public PublishOptions {
    headers = headers == null ? Map.of() : Map.copyOf(headers);
  }

  public static PublishOptions defaults() { return DEFAULTS; }

  public PublishOptions withRoutingKey(String routingKey) {
    return new PublishOptions(routingKey, correlationId, causationId, priority, expiration, persistent, headers);
  }

  public PublishOptions withCorrelationId(String correlationId) {
    return new PublishOptions(routingKey, correlationId, causationId, priority, expiration, persistent, headers);
  }

  public PublishOptions withCausationId(String causationId) {
    return new PublishOptions(routingKey, correlationId, causationId, priority, expiration, persistent, headers);
  }

  public PublishOptions withPriority(Integer priority) {
    return new PublishOptions(routingKey, correlationId, causationId, priority, expiration, persistent, headers);
  }

  public PublishOptions withExpiration(Duration expiration) {
    return new PublishOptions(routingKey, correlationId, causationId, priority, expiration, persistent, headers);
  }

  public PublishOptions withPersistent(boolean persistent) {
    return new PublishOptions(routingKey, correlationId, causationId, priority, expiration, persistent, headers);
  }

  public PublishOptions withHeader(String name, Object value) {
    Map<String, Object> copy = new HashMap<>(headers);
    copy.put(name, value);
    return new PublishOptions(routingKey, correlationId, causationId, priority, expiration, persistent, copy);
  }
}
