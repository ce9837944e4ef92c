package com.solanaeda.eventbus;

import org.springframework.amqp.AmqpException;

/**
 * Base type for every failure raised by the event bus client.
 */
public class EventBusException extends AmqpException {
  public EventBusException(String message) { super(message); }
  public EventBusException(String message, Throwable cause) { super(message, cause); }
}
