package com.solanaeda.eventbus.validation;

import com.solanaeda.eventbus.envelope.EventEnvelope;

/**
 * Turns an envelope into a typed, validated payload. Schema rules live in the implementation.
 *
 * @param <T> payload type
 */
@FunctionalInterface
public interface EventValidator<T> {
  T validateEvent(EventEnvelope envelope) throws EventValidationException;
}
