package com.solanaeda.eventbus.validation;

import com.solanaeda.eventbus.EnvelopeFormatException;
import com.solanaeda.eventbus.envelope.EnvelopeCodec;
import com.solanaeda.eventbus.envelope.EventEnvelope;

import java.util.List;

/**
 * Minimal validator: the envelope carries the expected type and its data binds to {@code payloadType}.
 */
public class DataBindingValidator<T> implements EventValidator<T> {
  private final EnvelopeCodec codec;
  private final String expectedType;
  private final Class<T> payloadType;

  public DataBindingValidator(EnvelopeCodec codec, String expectedType, Class<T> payloadType) {
    this.codec = codec;
    this.expectedType = expectedType;
    this.payloadType = payloadType;
  }

  @Override
  public T validateEvent(EventEnvelope envelope) {
    if (expectedType != null && !expectedType.equals(envelope.type())) {
      throw new EventValidationException(envelope.type(), List.of("expected type " + expectedType));
    }
    if (envelope.data() == null || envelope.data().isNull()) {
      throw new EventValidationException(envelope.type(), List.of("data is missing"));
    }
    try {
      return codec.readData(envelope, payloadType);
    } catch (EnvelopeFormatException e) {
      throw new EventValidationException(envelope.type(), "data does not match " + payloadType.getSimpleName(), e);
    }
  }
}
