package com.solanaeda.eventbus.envelope;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.solanaeda.eventbus.EnvelopeFormatException;

import java.io.IOException;

/**
 * JSON (de)serialization of {@link EventEnvelope}.
 */
public class EnvelopeCodec {
  private final ObjectMapper mapper;

  public EnvelopeCodec() {
    this(defaultMapper());
  }

  public EnvelopeCodec(ObjectMapper mapper) {
    this.mapper = mapper;
  }

  public static ObjectMapper defaultMapper() {
    ObjectMapper om = new ObjectMapper();
    om.registerModule(new JavaTimeModule());
    om.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
    return om;
  }

  public ObjectMapper mapper() { return mapper; }

  public byte[] encode(EventEnvelope envelope) {
    try {
      return mapper.writeValueAsBytes(envelope);
    } catch (JsonProcessingException e) {
      throw new EnvelopeFormatException("Failed to serialize event " + envelope.id(), e);
    }
  }

  public EventEnvelope decode(byte[] body) {
    if (body == null || body.length == 0) {
      throw new EnvelopeFormatException("Empty message body");
    }
    EventEnvelope envelope;
    try {
      envelope = mapper.readValue(body, EventEnvelope.class);
    } catch (JsonProcessingException e) {
      throw new EnvelopeFormatException("Malformed event envelope: " + e.getOriginalMessage(), e);
    } catch (IOException e) {
      throw new EnvelopeFormatException("Unreadable event envelope: " + e.getMessage(), e);
    }
    if (envelope == null || envelope.id() == null || envelope.type() == null) {
      throw new EnvelopeFormatException("Event envelope is missing id or type");
    }
    return envelope;
  }

  public <T> T readData(EventEnvelope envelope, Class<T> type) {
    try {
      return mapper.treeToValue(envelope.data(), type);
    } catch (JsonProcessingException | IllegalArgumentException e) {
      throw new EnvelopeFormatException("Cannot read " + envelope.type() + " data as " + type.getSimpleName(), e);
    }
  }
}
