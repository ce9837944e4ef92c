package com.solanaeda.eventbus.validation;

import org.springframework.amqp.AmqpRejectAndDontRequeueException;

import java.util.List;

/**
 * An event failed validation. Never retried: the consumer dead-letters the message and the
 * dead-letter handler treats it as a permanent failure.
 */
public class EventValidationException extends AmqpRejectAndDontRequeueException {
  private final String eventType;
  private final List<String> errors;

  public EventValidationException(String eventType, List<String> errors) {
    super("validation failed for " + eventType + ": " + String.join("; ", errors));
    this.eventType = eventType;
    this.errors = List.copyOf(errors);
  }

  public EventValidationException(String eventType, String error, Throwable cause) {
    super("validation failed for " + eventType + ": " + error, cause);
    this.eventType = eventType;
    this.errors = List.of(error);
  }

  public String getEventType() { return eventType; }
  public List<String> getErrors() { return errors; }
}
