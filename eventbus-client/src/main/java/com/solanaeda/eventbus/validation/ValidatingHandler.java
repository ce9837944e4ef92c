package com.solanaeda.eventbus.validation;

import com.solanaeda.eventbus.consumer.Acknowledgement;
import com.solanaeda.eventbus.consumer.MessageHandler;
import com.solanaeda.eventbus.envelope.EventEnvelope;

/**
 * Runs a {@link TypedEventHandler} behind an {@link EventValidator}. Validation failures
 * propagate as {@link EventValidationException} and are dead-lettered by the consumer.
 */
public class ValidatingHandler<T> implements MessageHandler {
  private final EventValidator<T> validator;
  private final TypedEventHandler<T> delegate;

  public ValidatingHandler(EventValidator<T> validator, TypedEventHandler<T> delegate) {
    this.validator = validator;
    this.delegate = delegate;
  }

  public static <T> ValidatingHandler<T> of(EventValidator<T> validator, TypedEventHandler<T> delegate) {
    return new ValidatingHandler<>(validator, delegate);
  }

  @Override
  public void handle(EventEnvelope envelope, Acknowledgement ack) throws Exception {
    T payload = validator.validateEvent(envelope);
    delegate.handle(payload, envelope, ack);
  }
}
