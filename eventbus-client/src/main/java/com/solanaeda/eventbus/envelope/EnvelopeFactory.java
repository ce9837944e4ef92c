package com.solanaeda.eventbus.envelope;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.time.Clock;
import java.util.UUID;

/**
 * Stamps id, timestamp, version and source onto outgoing events.
 */
public class EnvelopeFactory {
  public static final String VERSION = "1.0";

  private final ObjectMapper mapper;
  private final Clock clock;
  private final String source;

  public EnvelopeFactory(ObjectMapper mapper, String source) {
    this(mapper, Clock.systemUTC(), source);
  }

  public EnvelopeFactory(ObjectMapper mapper, Clock clock, String source) {
    this.mapper = mapper;
    this.clock = clock;
    this.source = source;
  }

  public EventEnvelope create(String eventType, Object data, String routingKey,
                              String correlationId, String causationId) {
    String id = UUID.randomUUID().toString();
    String key = routingKey == null || routingKey.isBlank() ? RoutingKeys.fromEventType(eventType) : routingKey;
    JsonNode tree = data instanceof JsonNode node ? node : mapper.valueToTree(data);
    return new EventEnvelope(
        VERSION,
        id,
        correlationId != null ? correlationId : id,
        causationId,
        clock.instant(),
        eventType,
        key,
        tree,
        source);
  }

  public String source() { return source; }
}
